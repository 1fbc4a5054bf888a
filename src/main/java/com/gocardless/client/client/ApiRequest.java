package com.gocardless.client.client;

import com.gocardless.client.model.ApiResponse;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import org.springframework.http.HttpMethod;

/**
 * Everything needed to perform one API call.
 *
 * <p>The path is a template whose {@code :name} segments are replaced by the
 * percent-encoded path parameter of the same name. For {@code GET} requests the request
 * object becomes the query string; for other methods it is sent as
 * {@code {"<envelope>": <request>}}.
 *
 * @param <T> the response type
 */
public final class ApiRequest<T extends ApiResponse> {

  private final HttpMethod method;
  private final String pathTemplate;
  private final Map<String, String> pathParams;
  private final Object requestObject;
  private final String envelope;
  private final Class<T> responseType;
  private final Function<String, T> conflictHandler;
  private final RequestSettings settings;

  private ApiRequest(Builder<T> builder) {
    this.method = builder.method;
    this.pathTemplate = builder.pathTemplate;
    this.pathParams = Collections.unmodifiableMap(new LinkedHashMap<>(builder.pathParams));
    this.requestObject = builder.requestObject;
    this.envelope = builder.envelope;
    this.responseType = builder.responseType;
    this.conflictHandler = builder.conflictHandler;
    this.settings = builder.settings == null ? RequestSettings.none() : builder.settings;
  }

  public static <T extends ApiResponse> Builder<T> builder(HttpMethod method, String pathTemplate,
      Class<T> responseType) {
    return new Builder<>(method, pathTemplate, responseType);
  }

  public HttpMethod getMethod() {
    return method;
  }

  public String getPathTemplate() {
    return pathTemplate;
  }

  public Map<String, String> getPathParams() {
    return pathParams;
  }

  public Object getRequestObject() {
    return requestObject;
  }

  public String getEnvelope() {
    return envelope;
  }

  public Class<T> getResponseType() {
    return responseType;
  }

  /** Fetches an already-created resource by id; null when conflicts cannot be resolved. */
  public Function<String, T> getConflictHandler() {
    return conflictHandler;
  }

  public RequestSettings getSettings() {
    return settings;
  }

  public static final class Builder<T extends ApiResponse> {

    private final HttpMethod method;
    private final String pathTemplate;
    private final Class<T> responseType;
    private final Map<String, String> pathParams = new LinkedHashMap<>();
    private Object requestObject;
    private String envelope;
    private Function<String, T> conflictHandler;
    private RequestSettings settings;

    private Builder(HttpMethod method, String pathTemplate, Class<T> responseType) {
      this.method = method;
      this.pathTemplate = pathTemplate;
      this.responseType = responseType;
    }

    public Builder<T> pathParam(String name, String value) {
      pathParams.put(name, value);
      return this;
    }

    public Builder<T> requestObject(Object requestObject) {
      this.requestObject = requestObject;
      return this;
    }

    public Builder<T> envelope(String envelope) {
      this.envelope = envelope;
      return this;
    }

    public Builder<T> conflictHandler(Function<String, T> conflictHandler) {
      this.conflictHandler = conflictHandler;
      return this;
    }

    public Builder<T> settings(RequestSettings settings) {
      this.settings = settings;
      return this;
    }

    public ApiRequest<T> build() {
      return new ApiRequest<>(this);
    }
  }
}
