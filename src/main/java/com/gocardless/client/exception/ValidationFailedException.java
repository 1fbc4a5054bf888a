package com.gocardless.client.exception;

import com.gocardless.client.model.ApiErrorDetail;
import java.util.List;

/**
 * One or more fields of the request were rejected. {@link #getErrors()} names the fields
 * at fault.
 */
public class ValidationFailedException extends GoCardlessApiException {

  public ValidationFailedException(int statusCode, String message, String type,
      int code, String requestId, String documentationUrl, List<ApiErrorDetail> errors) {
    super(statusCode, message, type, code, requestId, documentationUrl, errors);
  }
}
