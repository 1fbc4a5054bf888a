package com.gocardless.client.exception;

import com.gocardless.client.model.ApiErrorDetail;
import java.util.List;
import java.util.Optional;

/**
 * The request could not be applied to the resource in its current state, e.g. cancelling
 * a mandate that is already cancelled, or re-using an idempotency key.
 */
public class InvalidStateException extends GoCardlessApiException {

  static final String IDEMPOTENT_CREATION_CONFLICT = "idempotent_creation_conflict";
  static final String CONFLICTING_RESOURCE_ID = "conflicting_resource_id";

  public InvalidStateException(int statusCode, String message, String type, int code,
      String requestId, String documentationUrl, List<ApiErrorDetail> errors) {
    super(statusCode, message, type, code, requestId, documentationUrl, errors);
  }

  /**
   * Returns the id of the resource already created with the same idempotency key, if this
   * error is an idempotent creation conflict.
   */
  public Optional<String> getConflictingResourceId() {
    return getErrors().stream()
        .filter(error -> IDEMPOTENT_CREATION_CONFLICT.equals(error.getReason()))
        .filter(error -> error.getLinks() != null)
        .map(error -> error.getLinks().get(CONFLICTING_RESOURCE_ID))
        .filter(id -> id != null && !id.isBlank())
        .findFirst();
  }
}
