package com.gocardless.client.service;

import static com.gocardless.client.service.ServiceArguments.requireIdentity;

import com.gocardless.client.client.ApiClient;
import com.gocardless.client.client.ApiRequest;
import com.gocardless.client.client.Paginator;
import com.gocardless.client.client.RequestSettings;
import com.gocardless.client.model.CustomerCreateRequest;
import com.gocardless.client.model.CustomerListRequest;
import com.gocardless.client.model.CustomerListResponse;
import com.gocardless.client.model.CustomerResponse;
import com.gocardless.client.model.CustomerUpdateRequest;
import com.gocardless.client.resources.Customer;
import com.gocardless.client.validation.MetadataValidator;
import org.springframework.http.HttpMethod;

/**
 * Works with customer resources.
 *
 * <p>Customer objects hold the contact details for a customer. A customer can have several
 * customer bank accounts, which in turn can have several Direct Debit mandates.
 *
 * <p>Instances are obtained from {@link com.gocardless.client.GoCardlessClient#customers()}.
 */
public class CustomerService {

  private final ApiClient apiClient;
  private final MetadataValidator metadataValidator;

  public CustomerService(ApiClient apiClient, MetadataValidator metadataValidator) {
    this.apiClient = apiClient;
    this.metadataValidator = metadataValidator;
  }

  /**
   * Creates a new customer. If the idempotency key was already used, the customer created
   * the first time is returned.
   *
   * @throws com.gocardless.client.exception.InvalidRequestException if the metadata is invalid
   */
  public CustomerResponse create(CustomerCreateRequest request) {
    return create(request, RequestSettings.none());
  }

  public CustomerResponse create(CustomerCreateRequest request, RequestSettings settings) {
    CustomerCreateRequest body = request == null ? new CustomerCreateRequest() : request;
    metadataValidator.requireValid(body.getMetadata());
    return apiClient.execute(
        ApiRequest.builder(HttpMethod.POST, "/customers", CustomerResponse.class)
            .requestObject(body)
            .envelope("customers")
            .conflictHandler(id -> get(id, settings))
            .settings(settings)
            .build());
  }

  /** Returns one page of your customers. */
  public CustomerListResponse list(CustomerListRequest request) {
    return list(request, RequestSettings.none());
  }

  public CustomerListResponse list(CustomerListRequest request, RequestSettings settings) {
    return apiClient.execute(
        ApiRequest.builder(HttpMethod.GET, "/customers", CustomerListResponse.class)
            .requestObject(request == null ? new CustomerListRequest() : request)
            .settings(settings)
            .build());
  }

  /**
   * Like {@link #list(CustomerListRequest)}, but follows the cursors for you. Pages are
   * fetched lazily while iterating, always from the first page.
   */
  public Paginator<Customer> all(CustomerListRequest request) {
    return all(request, RequestSettings.none());
  }

  public Paginator<Customer> all(CustomerListRequest request, RequestSettings settings) {
    CustomerListRequest query = request == null ? new CustomerListRequest() : request;
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

  /**
   * Retrieves the details of an existing customer.
   *
   * @param identity unique identifier, beginning with "CU"
   */
  public CustomerResponse get(String identity) {
    return get(identity, RequestSettings.none());
  }

  public CustomerResponse get(String identity, RequestSettings settings) {
    return apiClient.execute(
        ApiRequest.builder(HttpMethod.GET, "/customers/:identity", CustomerResponse.class)
            .pathParam("identity", requireIdentity(identity))
            .settings(settings)
            .build());
  }

  /**
   * Updates a customer. Only the fields that are set are changed.
   *
   * @param identity unique identifier, beginning with "CU"
   */
  public CustomerResponse update(String identity, CustomerUpdateRequest request) {
    return update(identity, request, RequestSettings.none());
  }

  public CustomerResponse update(String identity, CustomerUpdateRequest request,
      RequestSettings settings) {
    CustomerUpdateRequest body = request == null ? new CustomerUpdateRequest() : request;
    metadataValidator.requireValid(body.getMetadata());
    return apiClient.execute(
        ApiRequest.builder(HttpMethod.PUT, "/customers/:identity", CustomerResponse.class)
            .pathParam("identity", requireIdentity(identity))
            .requestObject(body)
            .envelope("customers")
            .settings(settings)
            .build());
  }
}
