package com.gocardless.client.configuration;

/**
 * GoCardless environments and their API endpoints.
 */
public enum Environment {
  LIVE("https://api.gocardless.com"),
  SANDBOX("https://api-sandbox.gocardless.com");

  private final String baseUrl;

  Environment(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getBaseUrl() {
    return baseUrl;
  }
}
