package com.gocardless.client.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gocardless.client.configuration.GoCardlessProperties;
import com.gocardless.client.exception.ApiConnectionException;
import com.gocardless.client.exception.GoCardlessException;
import com.gocardless.client.exception.GoCardlessInternalException;
import com.gocardless.client.exception.InvalidStateException;
import com.gocardless.client.exception.MalformedResponseException;
import com.gocardless.client.model.ApiResponse;
import com.gocardless.client.model.IdempotentRequest;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * {@link ApiClient} implementation on top of {@link RestTemplate}.
 *
 * <p>For every call it:
 * <ul>
 *   <li>assigns an idempotency key to creation requests that have none</li>
 *   <li>expands the path template and encodes the query string or JSON envelope</li>
 *   <li>adds authentication, versioning and client identification headers</li>
 *   <li>retries connection failures and internal API errors, but only for requests that are
 *       safe to repeat ({@code GET}, or carrying an idempotency key)</li>
 *   <li>resolves idempotent creation conflicts by fetching the resource created first</li>
 *   <li>translates error responses into {@link GoCardlessException} subclasses</li>
 * </ul>
 *
 * <p>The access token is never logged. The idempotency key is placed in the MDC under
 * {@code idempotencyKey} while the call is in flight.
 */
public class RestTemplateApiClient implements ApiClient {

  private static final Logger LOG = LoggerFactory.getLogger(RestTemplateApiClient.class);

  static final String LIBRARY_NAME = "gocardless-client-java";
  static final String LIBRARY_VERSION = "1.0.0";
  static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
  static final String VERSION_HEADER = "GoCardless-Version";
  private static final String MDC_IDEMPOTENCY_KEY = "idempotencyKey";
  private static final String RETRY_INSTANCE = "gocardless";

  private final RestTemplate restTemplate;
  private final ObjectMapper objectMapper;
  private final UriBuilder uriBuilder;
  private final ApiErrorTranslator errorTranslator;
  private final String accessToken;
  private final String apiVersion;
  private final Retry retry;
  private final boolean errorOnIdempotencyConflict;

  public RestTemplateApiClient(RestTemplate restTemplate, GoCardlessProperties properties,
      ObjectMapper objectMapper) {
    if (properties.getAccessToken() == null || properties.getAccessToken().isBlank()) {
      throw new IllegalArgumentException("GoCardless access token must not be blank");
    }
    if (properties.getMaxAttempts() < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.restTemplate = restTemplate;
    this.objectMapper = objectMapper;
    this.uriBuilder = new UriBuilder(properties.resolveBaseUrl(), objectMapper);
    this.errorTranslator = new ApiErrorTranslator(objectMapper);
    this.accessToken = properties.getAccessToken();
    this.apiVersion = properties.getApiVersion();
    this.retry = buildRetry(properties.getMaxAttempts(), properties.getRetryDelay());
    this.errorOnIdempotencyConflict = properties.isErrorOnIdempotencyConflict();
  }

  private static Retry buildRetry(int maxAttempts, Duration retryDelay) {
    RetryConfig config = RetryConfig.custom()
        .maxAttempts(maxAttempts)
        .waitDuration(retryDelay == null || retryDelay.isNegative() ? Duration.ZERO : retryDelay)
        .retryOnException(RestTemplateApiClient::isRetryable)
        .build();
    Retry retry = Retry.of(RETRY_INSTANCE, config);
    retry.getEventPublisher().onRetry(event ->
        LOG.warn("event=gocardless.retry attempt={} maxAttempts={} reason={}",
            event.getNumberOfRetryAttempts(), maxAttempts, event.getLastThrowable().getMessage()));
    return retry;
  }

  @Override
  public <T extends ApiResponse> T execute(ApiRequest<T> request) {
    String idempotencyKey = assignIdempotencyKey(request.getRequestObject());
    boolean isGet = HttpMethod.GET.equals(request.getMethod());

    URI uri = uriBuilder.build(request.getPathTemplate(), request.getPathParams(),
        isGet ? request.getRequestObject() : null);
    String body = isGet ? null : serializeBody(request);
    HttpEntity<String> entity = new HttpEntity<>(body,
        buildHeaders(request, idempotencyKey, body != null));
    boolean retrySafe = isGet || idempotencyKey != null;

    if (idempotencyKey != null) {
      MDC.put(MDC_IDEMPOTENCY_KEY, idempotencyKey);
    }
    try {
      return executeWithRetries(request, uri, entity, retrySafe);
    } catch (InvalidStateException e) {
      return resolveConflict(request, e);
    } finally {
      if (idempotencyKey != null) {
        MDC.remove(MDC_IDEMPOTENCY_KEY);
      }
    }
  }

  private <T extends ApiResponse> T executeWithRetries(ApiRequest<T> request, URI uri,
      HttpEntity<String> entity, boolean retrySafe) {
    if (!retrySafe) {
      return send(request, uri, entity);
    }
    return Retry.decorateSupplier(retry, () -> send(request, uri, entity)).get();
  }

  private <T extends ApiResponse> T send(ApiRequest<T> request, URI uri,
      HttpEntity<String> entity) {
    LOG.debug("event=gocardless.request method={} path={}", request.getMethod(),
        request.getPathTemplate());
    long start = System.currentTimeMillis();

    ResponseEntity<String> response;
    try {
      response = restTemplate.exchange(uri, request.getMethod(), entity, String.class);
    } catch (RestClientResponseException e) {
      int status = e.getStatusCode().value();
      LOG.warn("event=gocardless.error method={} path={} status={} latencyMs={}",
          request.getMethod(), request.getPathTemplate(), status,
          System.currentTimeMillis() - start);
      throw errorTranslator.translate(status, e.getResponseBodyAsString(StandardCharsets.UTF_8));
    } catch (ResourceAccessException e) {
      throw new ApiConnectionException("GoCardless API is unreachable: " + e.getMessage(), e);
    }

    int status = response.getStatusCode().value();
    T result = deserialize(response.getBody(), request.getResponseType(), status);
    result.attachHttpDetails(status, response.getHeaders());

    LOG.debug("event=gocardless.response method={} path={} status={} requestId={} latencyMs={}",
        request.getMethod(), request.getPathTemplate(), status, result.getRequestId(),
        System.currentTimeMillis() - start);
    return result;
  }

  private <T extends ApiResponse> T resolveConflict(ApiRequest<T> request,
      InvalidStateException e) {
    Optional<String> conflictingId = e.getConflictingResourceId();
    if (errorOnIdempotencyConflict || request.getConflictHandler() == null
        || conflictingId.isEmpty()) {
      throw e;
    }
    LOG.info("event=gocardless.idempotency_conflict path={} resourceId={}",
        request.getPathTemplate(), conflictingId.get());
    return request.getConflictHandler().apply(conflictingId.get());
  }

  private String assignIdempotencyKey(Object requestObject) {
    if (!(requestObject instanceof IdempotentRequest)) {
      return null;
    }
    IdempotentRequest idempotent = (IdempotentRequest) requestObject;
    if (idempotent.getIdempotencyKey() == null || idempotent.getIdempotencyKey().isBlank()) {
      idempotent.setIdempotencyKey(UUID.randomUUID().toString());
    }
    return idempotent.getIdempotencyKey();
  }

  private String serializeBody(ApiRequest<?> request) {
    if (request.getEnvelope() == null) {
      return null;
    }
    Object payload = request.getRequestObject() == null ? Map.of() : request.getRequestObject();
    try {
      return objectMapper.writeValueAsString(Map.of(request.getEnvelope(), payload));
    } catch (JsonProcessingException e) {
      throw new GoCardlessException("Could not serialize request for "
          + request.getPathTemplate(), e);
    }
  }

  private HttpHeaders buildHeaders(ApiRequest<?> request, String idempotencyKey,
      boolean hasBody) {
    HttpHeaders headers = new HttpHeaders();
    headers.setBearerAuth(accessToken);
    headers.set(VERSION_HEADER, apiVersion);
    headers.set("GoCardless-Client-Library", LIBRARY_NAME);
    headers.set("GoCardless-Client-Version", LIBRARY_VERSION);
    headers.set(HttpHeaders.USER_AGENT, LIBRARY_NAME + "/" + LIBRARY_VERSION + " java/"
        + System.getProperty("java.version"));
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    if (hasBody) {
      headers.setContentType(MediaType.APPLICATION_JSON);
    }
    if (idempotencyKey != null) {
      headers.set(IDEMPOTENCY_KEY_HEADER, idempotencyKey);
    }
    request.getSettings().getHeaders().forEach(headers::set);
    return headers;
  }

  private <T> T deserialize(String body, Class<T> responseType, int status) {
    T result;
    try {
      result = objectMapper.readValue(body, responseType);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new MalformedResponseException(status, body, e);
    }
    if (result == null) {
      throw new MalformedResponseException(status, body, null);
    }
    return result;
  }

  private static boolean isRetryable(Throwable e) {
    if (e instanceof ApiConnectionException || e instanceof GoCardlessInternalException) {
      return true;
    }
    return e instanceof MalformedResponseException
        && ((MalformedResponseException) e).getStatusCode() >= 500;
  }
}
