package com.gocardless.client.service;

import static com.gocardless.client.service.ServiceArguments.requireIdentity;

import com.gocardless.client.client.ApiClient;
import com.gocardless.client.client.ApiRequest;
import com.gocardless.client.client.Paginator;
import com.gocardless.client.client.RequestSettings;
import com.gocardless.client.model.MandateCancelRequest;
import com.gocardless.client.model.MandateCreateRequest;
import com.gocardless.client.model.MandateListRequest;
import com.gocardless.client.model.MandateListResponse;
import com.gocardless.client.model.MandateReactivateRequest;
import com.gocardless.client.model.MandateResponse;
import com.gocardless.client.model.MandateUpdateRequest;
import com.gocardless.client.resources.Mandate;
import com.gocardless.client.validation.MetadataValidator;
import org.springframework.http.HttpMethod;

/**
 * Works with mandates.
 *
 * <p>A mandate is the customer's authorisation to collect payments from a bank account.
 * Besides the usual create/list/get/update operations it supports two state changes:
 * <ul>
 *   <li>{@link #cancel(String, MandateCancelRequest)} - stops further payments</li>
 *   <li>{@link #reactivate(String, MandateReactivateRequest)} - brings a cancelled or
 *       expired mandate back into use</li>
 * </ul>
 * Both fail with {@link com.gocardless.client.exception.InvalidStateException} when the
 * mandate is not in a state that allows them.
 */
public class MandateService {

  private final ApiClient apiClient;
  private final MetadataValidator metadataValidator;

  public MandateService(ApiClient apiClient, MetadataValidator metadataValidator) {
    this.apiClient = apiClient;
    this.metadataValidator = metadataValidator;
  }

  /** Creates a new mandate against an existing customer bank account. */
  public MandateResponse create(MandateCreateRequest request) {
    return create(request, RequestSettings.none());
  }

  public MandateResponse create(MandateCreateRequest request, RequestSettings settings) {
    MandateCreateRequest body = request == null ? new MandateCreateRequest() : request;
    metadataValidator.requireValid(body.getMetadata());
    return apiClient.execute(
        ApiRequest.builder(HttpMethod.POST, "/mandates", MandateResponse.class)
            .requestObject(body)
            .envelope("mandates")
            .conflictHandler(id -> get(id, settings))
            .settings(settings)
            .build());
  }

  public MandateListResponse list(MandateListRequest request) {
    return list(request, RequestSettings.none());
  }

  public MandateListResponse list(MandateListRequest request, RequestSettings settings) {
    return apiClient.execute(
        ApiRequest.builder(HttpMethod.GET, "/mandates", MandateListResponse.class)
            .requestObject(request == null ? new MandateListRequest() : request)
            .settings(settings)
            .build());
  }

  public Paginator<Mandate> all(MandateListRequest request) {
    return all(request, RequestSettings.none());
  }

  public Paginator<Mandate> all(MandateListRequest request, RequestSettings settings) {
    MandateListRequest query = request == null ? new MandateListRequest() : request;
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

  /** @param identity unique identifier, beginning with "MD" */
  public MandateResponse get(String identity) {
    return get(identity, RequestSettings.none());
  }

  public MandateResponse get(String identity, RequestSettings settings) {
    return apiClient.execute(
        ApiRequest.builder(HttpMethod.GET, "/mandates/:identity", MandateResponse.class)
            .pathParam("identity", requireIdentity(identity))
            .settings(settings)
            .build());
  }

  public MandateResponse update(String identity, MandateUpdateRequest request) {
    return update(identity, request, RequestSettings.none());
  }

  public MandateResponse update(String identity, MandateUpdateRequest request,
      RequestSettings settings) {
    MandateUpdateRequest body = request == null ? new MandateUpdateRequest() : request;
    metadataValidator.requireValid(body.getMetadata());
    return apiClient.execute(
        ApiRequest.builder(HttpMethod.PUT, "/mandates/:identity", MandateResponse.class)
            .pathParam("identity", requireIdentity(identity))
            .requestObject(body)
            .envelope("mandates")
            .settings(settings)
            .build());
  }

  public MandateResponse cancel(String identity, MandateCancelRequest request) {
    return cancel(identity, request, RequestSettings.none());
  }

  public MandateResponse cancel(String identity, MandateCancelRequest request,
      RequestSettings settings) {
    MandateCancelRequest body = request == null ? new MandateCancelRequest() : request;
    metadataValidator.requireValid(body.getMetadata());
    return action(identity, "cancel", body, settings);
  }

  public MandateResponse reactivate(String identity, MandateReactivateRequest request) {
    return reactivate(identity, request, RequestSettings.none());
  }

  public MandateResponse reactivate(String identity, MandateReactivateRequest request,
      RequestSettings settings) {
    MandateReactivateRequest body = request == null ? new MandateReactivateRequest() : request;
    metadataValidator.requireValid(body.getMetadata());
    return action(identity, "reactivate", body, settings);
  }

  private MandateResponse action(String identity, String action, Object body,
      RequestSettings settings) {
    return apiClient.execute(
        ApiRequest.builder(HttpMethod.POST, "/mandates/:identity/actions/" + action,
                MandateResponse.class)
            .pathParam("identity", requireIdentity(identity))
            .requestObject(body)
            .envelope("data")
            .settings(settings)
            .build());
  }
}
