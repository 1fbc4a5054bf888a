package com.gocardless.client.exception;

/**
 * Base type for every error raised by this library.
 */
public class GoCardlessException extends RuntimeException {

  public GoCardlessException(String message) {
    super(message);
  }

  public GoCardlessException(String message, Throwable cause) {
    super(message, cause);
  }
}
