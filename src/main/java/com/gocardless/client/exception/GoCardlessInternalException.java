package com.gocardless.client.exception;

import com.gocardless.client.model.ApiErrorDetail;
import java.util.List;

/**
 * An internal error on the GoCardless side. Requests that are safe to repeat are retried
 * before this is thrown.
 */
public class GoCardlessInternalException extends GoCardlessApiException {

  public GoCardlessInternalException(int statusCode, String message, String type,
      int code, String requestId, String documentationUrl, List<ApiErrorDetail> errors) {
    super(statusCode, message, type, code, requestId, documentationUrl, errors);
  }
}
