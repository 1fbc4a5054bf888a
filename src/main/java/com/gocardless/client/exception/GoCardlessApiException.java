package com.gocardless.client.exception;

import com.gocardless.client.model.ApiErrorDetail;
import java.util.List;

/**
 * Thrown when the API answers with a structured error body.
 *
 * <p>The concrete subclass reflects the error {@code type}:
 * <ul>
 *   <li>{@code invalid_api_usage} -> {@link InvalidApiUsageException}</li>
 *   <li>{@code invalid_state} -> {@link InvalidStateException}</li>
 *   <li>{@code validation_failed} -> {@link ValidationFailedException}</li>
 *   <li>{@code gocardless} -> {@link GoCardlessInternalException}</li>
 * </ul>
 * Unknown types are raised as this class.
 */
public class GoCardlessApiException extends GoCardlessException {

  private final int statusCode;
  private final String type;
  private final int code;
  private final String requestId;
  private final String documentationUrl;
  private final List<ApiErrorDetail> errors;

  public GoCardlessApiException(int statusCode, String message, String type, int code,
      String requestId, String documentationUrl, List<ApiErrorDetail> errors) {
    super(message);
    this.statusCode = statusCode;
    this.type = type;
    this.code = code;
    this.requestId = requestId;
    this.documentationUrl = documentationUrl;
    this.errors = errors == null ? List.of() : List.copyOf(errors);
  }

  /** HTTP status of the response. */
  public int getStatusCode() {
    return statusCode;
  }

  public String getType() {
    return type;
  }

  /** Error code from the body, usually equal to the HTTP status. */
  public int getCode() {
    return code;
  }

  public String getRequestId() {
    return requestId;
  }

  public String getDocumentationUrl() {
    return documentationUrl;
  }

  public List<ApiErrorDetail> getErrors() {
    return errors;
  }
}
