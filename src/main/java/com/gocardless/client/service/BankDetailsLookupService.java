package com.gocardless.client.service;

import com.gocardless.client.client.ApiClient;
import com.gocardless.client.client.ApiRequest;
import com.gocardless.client.client.RequestSettings;
import com.gocardless.client.model.BankDetailsLookupCreateRequest;
import com.gocardless.client.model.BankDetailsLookupResponse;
import org.springframework.http.HttpMethod;

/**
 * Looks up the name and reachability of a bank from account details, without storing
 * anything. Useful for validating details before creating a bank account.
 */
public class BankDetailsLookupService {

  private final ApiClient apiClient;

  public BankDetailsLookupService(ApiClient apiClient) {
    this.apiClient = apiClient;
  }

  public BankDetailsLookupResponse create(BankDetailsLookupCreateRequest request) {
    return create(request, RequestSettings.none());
  }

  public BankDetailsLookupResponse create(BankDetailsLookupCreateRequest request,
      RequestSettings settings) {
    return apiClient.execute(
        ApiRequest.builder(HttpMethod.POST, "/bank_details_lookups",
                BankDetailsLookupResponse.class)
            .requestObject(request == null ? new BankDetailsLookupCreateRequest() : request)
            .envelope("bank_details_lookups")
            .settings(settings)
            .build());
  }
}
