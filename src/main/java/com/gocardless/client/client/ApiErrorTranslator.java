package com.gocardless.client.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gocardless.client.exception.GoCardlessApiException;
import com.gocardless.client.exception.GoCardlessException;
import com.gocardless.client.exception.GoCardlessInternalException;
import com.gocardless.client.exception.InvalidApiUsageException;
import com.gocardless.client.exception.InvalidStateException;
import com.gocardless.client.exception.MalformedResponseException;
import com.gocardless.client.exception.ValidationFailedException;
import com.gocardless.client.model.ApiErrorResponse;

/**
 * Maps an error response to the exception matching its {@code type}.
 *
 * <ul>
 *   <li>{@code invalid_api_usage} -> {@link InvalidApiUsageException}</li>
 *   <li>{@code invalid_state} -> {@link InvalidStateException}</li>
 *   <li>{@code validation_failed} -> {@link ValidationFailedException}</li>
 *   <li>{@code gocardless} -> {@link GoCardlessInternalException}</li>
 *   <li>any other type -> {@link GoCardlessApiException}</li>
 *   <li>a body without an {@code error} object -> {@link MalformedResponseException}</li>
 * </ul>
 */
class ApiErrorTranslator {

  private final ObjectMapper objectMapper;

  ApiErrorTranslator(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  GoCardlessException translate(int statusCode, String body) {
    ApiErrorResponse.Error error;
    try {
      ApiErrorResponse response = body == null || body.isBlank()
          ? null : objectMapper.readValue(body, ApiErrorResponse.class);
      error = response == null ? null : response.getError();
    } catch (JsonProcessingException e) {
      return new MalformedResponseException(statusCode, body, e);
    }
    if (error == null) {
      return new MalformedResponseException(statusCode, body, null);
    }

    String type = error.getType() == null ? "" : error.getType();
    switch (type) {
      case "invalid_api_usage":
        return new InvalidApiUsageException(statusCode, error.getMessage(), type, error.getCode(),
            error.getRequestId(), error.getDocumentationUrl(), error.getErrors());
      case "invalid_state":
        return new InvalidStateException(statusCode, error.getMessage(), type, error.getCode(),
            error.getRequestId(), error.getDocumentationUrl(), error.getErrors());
      case "validation_failed":
        return new ValidationFailedException(statusCode, error.getMessage(), type,
            error.getCode(), error.getRequestId(), error.getDocumentationUrl(), error.getErrors());
      case "gocardless":
        return new GoCardlessInternalException(statusCode, error.getMessage(), type,
            error.getCode(), error.getRequestId(), error.getDocumentationUrl(), error.getErrors());
      default:
        return new GoCardlessApiException(statusCode, error.getMessage(), type, error.getCode(),
            error.getRequestId(), error.getDocumentationUrl(), error.getErrors());
    }
  }
}
