package com.gocardless.client.exception;

/**
 * Thrown when a webhook's {@code Webhook-Signature} header does not match its body.
 */
public class InvalidSignatureException extends GoCardlessException {

  public InvalidSignatureException(String message) {
    super(message);
  }
}
