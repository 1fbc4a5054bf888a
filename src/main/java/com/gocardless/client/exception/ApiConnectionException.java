package com.gocardless.client.exception;

/**
 * Thrown when the GoCardless API cannot be reached: connection refused, timeouts,
 * or an interrupted wait between retries.
 *
 * <p>Requests that are safe to repeat are retried before this is surfaced.
 */
public class ApiConnectionException extends GoCardlessException {

  public ApiConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
