package com.gocardless.client.configuration;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Client settings, bound from {@code gocardless.*} properties when running under Spring
 * Boot or populated directly otherwise.
 */
@ConfigurationProperties(prefix = "gocardless")
public class GoCardlessProperties {

  /** API version sent in the {@code GoCardless-Version} header. */
  public static final String DEFAULT_API_VERSION = "2015-07-06";

  private String accessToken;
  private Environment environment = Environment.LIVE;
  /** Overrides the environment's URL, e.g. for a proxy or a stub server. */
  private String baseUrl;
  private String apiVersion = DEFAULT_API_VERSION;
  private Duration connectTimeout = Duration.ofSeconds(10);
  private Duration readTimeout = Duration.ofSeconds(10);
  /** Total attempts for requests that are safe to repeat, including the first one. */
  private int maxAttempts = 3;
  private Duration retryDelay = Duration.ofMillis(500);
  /**
   * When false, a creation that hits an already-used idempotency key returns the resource
   * created the first time instead of failing.
   */
  private boolean errorOnIdempotencyConflict;

  public String resolveBaseUrl() {
    if (baseUrl != null && !baseUrl.isBlank()) {
      return baseUrl;
    }
    return environment.getBaseUrl();
  }

  public String getAccessToken() {
    return accessToken;
  }

  public void setAccessToken(String accessToken) {
    this.accessToken = accessToken;
  }

  public Environment getEnvironment() {
    return environment;
  }

  public void setEnvironment(Environment environment) {
    this.environment = environment;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getApiVersion() {
    return apiVersion;
  }

  public void setApiVersion(String apiVersion) {
    this.apiVersion = apiVersion;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(Duration connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  public Duration getReadTimeout() {
    return readTimeout;
  }

  public void setReadTimeout(Duration readTimeout) {
    this.readTimeout = readTimeout;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  public Duration getRetryDelay() {
    return retryDelay;
  }

  public void setRetryDelay(Duration retryDelay) {
    this.retryDelay = retryDelay;
  }

  public boolean isErrorOnIdempotencyConflict() {
    return errorOnIdempotencyConflict;
  }

  public void setErrorOnIdempotencyConflict(boolean errorOnIdempotencyConflict) {
    this.errorOnIdempotencyConflict = errorOnIdempotencyConflict;
  }
}
