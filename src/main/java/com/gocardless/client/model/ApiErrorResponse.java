package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Body of a non-2xx response: {@code {"error": {...}}}.
 */
public class ApiErrorResponse {

  @JsonProperty("error")
  private Error error;

  public Error getError() {
    return error;
  }

  public void setError(Error error) {
    this.error = error;
  }

  public static class Error {

    @JsonProperty("message")
    private String message;

    @JsonProperty("type")
    private String type;

    @JsonProperty("code")
    private int code;

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("documentation_url")
    private String documentationUrl;

    @JsonProperty("errors")
    private List<ApiErrorDetail> errors;

    public String getMessage() {
      return message;
    }

    public void setMessage(String message) {
      this.message = message;
    }

    public String getType() {
      return type;
    }

    public void setType(String type) {
      this.type = type;
    }

    public int getCode() {
      return code;
    }

    public void setCode(int code) {
      this.code = code;
    }

    public String getRequestId() {
      return requestId;
    }

    public void setRequestId(String requestId) {
      this.requestId = requestId;
    }

    public String getDocumentationUrl() {
      return documentationUrl;
    }

    public void setDocumentationUrl(String documentationUrl) {
      this.documentationUrl = documentationUrl;
    }

    public List<ApiErrorDetail> getErrors() {
      return errors;
    }

    public void setErrors(List<ApiErrorDetail> errors) {
      this.errors = errors;
    }
  }
}
