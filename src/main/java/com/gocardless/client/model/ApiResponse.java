package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Map;

/**
 * Base type for every successful response. Besides the resource fields declared by the
 * subclasses it exposes the raw HTTP status and headers.
 */
public abstract class ApiResponse {

  private static final String REQUEST_ID_HEADER = "x-request-id";

  @JsonIgnore
  private int statusCode;
  @JsonIgnore
  private Map<String, List<String>> headers = Map.of();

  @JsonIgnore
  public int getStatusCode() {
    return statusCode;
  }

  @JsonIgnore
  public Map<String, List<String>> getHeaders() {
    return headers;
  }

  /** Returns the API's request id, useful when contacting support, or null if absent. */
  @JsonIgnore
  public String getRequestId() {
    for (Map.Entry<String, List<String>> header : headers.entrySet()) {
      if (REQUEST_ID_HEADER.equalsIgnoreCase(header.getKey()) && !header.getValue().isEmpty()) {
        return header.getValue().get(0);
      }
    }
    return null;
  }

  /** Called by the transport once the body has been read. */
  public void attachHttpDetails(int statusCode, Map<String, List<String>> headers) {
    this.statusCode = statusCode;
    this.headers = headers == null ? Map.of() : Map.copyOf(headers);
  }
}
