package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * One entry of the {@code errors} array of an error response.
 */
public class ApiErrorDetail {

  @JsonProperty("field")
  private String field;

  @JsonProperty("message")
  private String message;

  @JsonProperty("reason")
  private String reason;

  @JsonProperty("request_pointer")
  private String requestPointer;

  @JsonProperty("links")
  private Map<String, String> links;

  public String getField() {
    return field;
  }

  public void setField(String field) {
    this.field = field;
  }

  public String getMessage() {
    return message;
  }

  public void setMessage(String message) {
    this.message = message;
  }

  public String getReason() {
    return reason;
  }

  public void setReason(String reason) {
    this.reason = reason;
  }

  public String getRequestPointer() {
    return requestPointer;
  }

  public void setRequestPointer(String requestPointer) {
    this.requestPointer = requestPointer;
  }

  public Map<String, String> getLinks() {
    return links;
  }

  public void setLinks(Map<String, String> links) {
    this.links = links;
  }
}
