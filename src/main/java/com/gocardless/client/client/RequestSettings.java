package com.gocardless.client.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call customisation of an API request. Headers set here are applied after the
 * library's own, so they can override them.
 */
public final class RequestSettings {

  private static final RequestSettings NONE = new RequestSettings(Map.of());

  private final Map<String, String> headers;

  private RequestSettings(Map<String, String> headers) {
    this.headers = headers;
  }

  public static RequestSettings none() {
    return NONE;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Map<String, String> getHeaders() {
    return headers;
  }

  public static final class Builder {

    private final Map<String, String> headers = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder header(String name, String value) {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("Header name must not be blank");
      }
      if (value == null) {
        throw new IllegalArgumentException("Value of header " + name + " must not be null");
      }
      headers.put(name, value);
      return this;
    }

    public RequestSettings build() {
      return new RequestSettings(Collections.unmodifiableMap(new LinkedHashMap<>(headers)));
    }
  }
}
