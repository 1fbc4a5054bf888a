package com.gocardless.client.exception;

import com.gocardless.client.model.ApiErrorDetail;
import java.util.List;

/**
 * The request used the API incorrectly, e.g. an unknown parameter or a missing access
 * token.
 */
public class InvalidApiUsageException extends GoCardlessApiException {

  public InvalidApiUsageException(int statusCode, String message, String type,
      int code, String requestId, String documentationUrl, List<ApiErrorDetail> errors) {
    super(statusCode, message, type, code, requestId, documentationUrl, errors);
  }
}
