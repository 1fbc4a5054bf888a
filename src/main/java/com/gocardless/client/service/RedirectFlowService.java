package com.gocardless.client.service;

import static com.gocardless.client.service.ServiceArguments.requireIdentity;

import com.gocardless.client.client.ApiClient;
import com.gocardless.client.client.ApiRequest;
import com.gocardless.client.client.RequestSettings;
import com.gocardless.client.model.RedirectFlowCompleteRequest;
import com.gocardless.client.model.RedirectFlowCreateRequest;
import com.gocardless.client.model.RedirectFlowResponse;
import org.springframework.http.HttpMethod;

/**
 * Works with redirect flows, which set up mandates through the hosted payment pages.
 *
 * <p>Typical use: {@link #create} a flow, redirect the customer to its redirect URL, then
 * {@link #complete} it with the same session token once the customer comes back. Completing
 * creates the customer, customer bank account and mandate, whose ids are in the returned
 * flow's links.
 */
public class RedirectFlowService {

  private final ApiClient apiClient;

  public RedirectFlowService(ApiClient apiClient) {
    this.apiClient = apiClient;
  }

  public RedirectFlowResponse create(RedirectFlowCreateRequest request) {
    return create(request, RequestSettings.none());
  }

  public RedirectFlowResponse create(RedirectFlowCreateRequest request,
      RequestSettings settings) {
    return apiClient.execute(
        ApiRequest.builder(HttpMethod.POST, "/redirect_flows", RedirectFlowResponse.class)
            .requestObject(request == null ? new RedirectFlowCreateRequest() : request)
            .envelope("redirect_flows")
            .conflictHandler(id -> get(id, settings))
            .settings(settings)
            .build());
  }

  /** @param identity unique identifier, beginning with "RE" */
  public RedirectFlowResponse get(String identity) {
    return get(identity, RequestSettings.none());
  }

  public RedirectFlowResponse get(String identity, RequestSettings settings) {
    return apiClient.execute(
        ApiRequest.builder(HttpMethod.GET, "/redirect_flows/:identity",
                RedirectFlowResponse.class)
            .pathParam("identity", requireIdentity(identity))
            .settings(settings)
            .build());
  }

  /**
   * Completes a flow after the customer has been redirected back. Expired flows, and flows
   * completed with a different session token, are rejected by the API.
   */
  public RedirectFlowResponse complete(String identity, RedirectFlowCompleteRequest request) {
    return complete(identity, request, RequestSettings.none());
  }

  public RedirectFlowResponse complete(String identity, RedirectFlowCompleteRequest request,
      RequestSettings settings) {
    return apiClient.execute(
        ApiRequest.builder(HttpMethod.POST, "/redirect_flows/:identity/actions/complete",
                RedirectFlowResponse.class)
            .pathParam("identity", requireIdentity(identity))
            .requestObject(request == null ? new RedirectFlowCompleteRequest() : request)
            .envelope("data")
            .settings(settings)
            .build());
  }
}
