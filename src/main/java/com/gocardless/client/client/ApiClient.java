package com.gocardless.client.client;

import com.gocardless.client.model.ApiResponse;

/**
 * Executes requests against the GoCardless API.
 *
 * <p>Services depend on this abstraction rather than on an HTTP library, so they can be
 * tested with a mock and the transport can be swapped without touching them.
 */
public interface ApiClient {

  /**
   * Sends the request and returns the deserialized response.
   *
   * @param request the request to execute
   * @param <T> the response type
   * @return the response, with HTTP status and headers attached
   * @throws com.gocardless.client.exception.GoCardlessApiException if the API returns an error
   * @throws com.gocardless.client.exception.ApiConnectionException if the API is unreachable
   *     after every permitted attempt
   * @throws com.gocardless.client.exception.MalformedResponseException if the response body
   *     cannot be parsed
   */
  <T extends ApiResponse> T execute(ApiRequest<T> request);
}
