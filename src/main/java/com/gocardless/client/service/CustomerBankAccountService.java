package com.gocardless.client.service;

import static com.gocardless.client.service.ServiceArguments.requireIdentity;

import com.gocardless.client.client.ApiClient;
import com.gocardless.client.client.ApiRequest;
import com.gocardless.client.client.Paginator;
import com.gocardless.client.client.RequestSettings;
import com.gocardless.client.model.CustomerBankAccountCreateRequest;
import com.gocardless.client.model.CustomerBankAccountListRequest;
import com.gocardless.client.model.CustomerBankAccountListResponse;
import com.gocardless.client.model.CustomerBankAccountResponse;
import com.gocardless.client.model.CustomerBankAccountUpdateRequest;
import com.gocardless.client.resources.CustomerBankAccount;
import com.gocardless.client.validation.MetadataValidator;
import org.springframework.http.HttpMethod;

/**
 * Works with customer bank accounts.
 */
public class CustomerBankAccountService {

  private final ApiClient apiClient;
  private final MetadataValidator metadataValidator;

  public CustomerBankAccountService(ApiClient apiClient, MetadataValidator metadataValidator) {
    this.apiClient = apiClient;
    this.metadataValidator = metadataValidator;
  }

  public CustomerBankAccountResponse create(CustomerBankAccountCreateRequest request) {
    return create(request, RequestSettings.none());
  }

  public CustomerBankAccountResponse create(CustomerBankAccountCreateRequest request,
      RequestSettings settings) {
    CustomerBankAccountCreateRequest body =
        request == null ? new CustomerBankAccountCreateRequest() : request;
    metadataValidator.requireValid(body.getMetadata());
    return apiClient.execute(
        ApiRequest.builder(HttpMethod.POST, "/customer_bank_accounts",
                CustomerBankAccountResponse.class)
            .requestObject(body)
            .envelope("customer_bank_accounts")
            .conflictHandler(id -> get(id, settings))
            .settings(settings)
            .build());
  }

  public CustomerBankAccountListResponse list(CustomerBankAccountListRequest request) {
    return list(request, RequestSettings.none());
  }

  public CustomerBankAccountListResponse list(CustomerBankAccountListRequest request,
      RequestSettings settings) {
    return apiClient.execute(
        ApiRequest.builder(HttpMethod.GET, "/customer_bank_accounts",
                CustomerBankAccountListResponse.class)
            .requestObject(request == null ? new CustomerBankAccountListRequest() : request)
            .settings(settings)
            .build());
  }

  public Paginator<CustomerBankAccount> all(CustomerBankAccountListRequest request) {
    return all(request, RequestSettings.none());
  }

  public Paginator<CustomerBankAccount> all(CustomerBankAccountListRequest request,
      RequestSettings settings) {
    CustomerBankAccountListRequest query =
        request == null ? new CustomerBankAccountListRequest() : request;
    String callerCursor = query.getAfter();
    return new Paginator<>(cursor -> {
      query.setAfter(cursor);
      try {
        return list(query, settings);
      } finally {
        query.setAfter(callerCursor);
      }
    }, null);
  }

  /** @param identity unique identifier, beginning with "BA" */
  public CustomerBankAccountResponse get(String identity) {
    return get(identity, RequestSettings.none());
  }

  public CustomerBankAccountResponse get(String identity, RequestSettings settings) {
    return apiClient.execute(
        ApiRequest.builder(HttpMethod.GET, "/customer_bank_accounts/:identity",
                CustomerBankAccountResponse.class)
            .pathParam("identity", requireIdentity(identity))
            .settings(settings)
            .build());
  }

  public CustomerBankAccountResponse update(String identity,
      CustomerBankAccountUpdateRequest request) {
    return update(identity, request, RequestSettings.none());
  }

  public CustomerBankAccountResponse update(String identity,
      CustomerBankAccountUpdateRequest request, RequestSettings settings) {
    CustomerBankAccountUpdateRequest body =
        request == null ? new CustomerBankAccountUpdateRequest() : request;
    metadataValidator.requireValid(body.getMetadata());
    return apiClient.execute(
        ApiRequest.builder(HttpMethod.PUT, "/customer_bank_accounts/:identity",
                CustomerBankAccountResponse.class)
            .pathParam("identity", requireIdentity(identity))
            .requestObject(body)
            .envelope("customer_bank_accounts")
            .settings(settings)
            .build());
  }

  /**
   * Immediately cancels all mandates on the bank account and stops it being used again.
   * This cannot be undone; the bank details have to be added again as a new account.
   */
  public CustomerBankAccountResponse disable(String identity) {
    return disable(identity, RequestSettings.none());
  }

  public CustomerBankAccountResponse disable(String identity, RequestSettings settings) {
    return apiClient.execute(
        ApiRequest.builder(HttpMethod.POST, "/customer_bank_accounts/:identity/actions/disable",
                CustomerBankAccountResponse.class)
            .pathParam("identity", requireIdentity(identity))
            .envelope("data")
            .settings(settings)
            .build());
  }
}
