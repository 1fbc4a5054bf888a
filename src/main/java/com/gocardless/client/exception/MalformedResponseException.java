package com.gocardless.client.exception;

/**
 * Thrown when a body (success, error or webhook) cannot be parsed as the expected JSON.
 */
public class MalformedResponseException extends GoCardlessException {

  private final int statusCode;
  private final String responseBody;

  public MalformedResponseException(int statusCode, String responseBody, Throwable cause) {
    super("Malformed response from GoCardless (HTTP " + statusCode + ")", cause);
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  /** Parse failure of a body that did not come from an API response, e.g. a webhook. */
  public MalformedResponseException(String message, String responseBody, Throwable cause) {
    super(message, cause);
    this.statusCode = 0;
    this.responseBody = responseBody;
  }

  /** HTTP status of the response, or 0 when the body was not an API response. */
  public int getStatusCode() {
    return statusCode;
  }

  public String getResponseBody() {
    return responseBody;
  }
}
