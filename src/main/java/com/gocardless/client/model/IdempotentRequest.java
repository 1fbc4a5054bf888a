package com.gocardless.client.model;

/**
 * Marks a request that is sent with an {@code Idempotency-Key} header. When the key is
 * left empty one is generated before the first attempt and reused for any retry.
 */
public interface IdempotentRequest {

  String getIdempotencyKey();

  void setIdempotencyKey(String idempotencyKey);
}
