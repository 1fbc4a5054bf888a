package com.gocardless.client.service;

import static com.gocardless.client.service.ServiceArguments.requireIdentity;

import com.gocardless.client.client.ApiClient;
import com.gocardless.client.client.ApiRequest;
import com.gocardless.client.client.Paginator;
import com.gocardless.client.client.RequestSettings;
import com.gocardless.client.model.EventListRequest;
import com.gocardless.client.model.EventListResponse;
import com.gocardless.client.model.EventResponse;
import com.gocardless.client.resources.Event;
import org.springframework.http.HttpMethod;

/**
 * Reads events. Events are created by GoCardless and cannot be modified.
 */
public class EventService {

  private final ApiClient apiClient;

  public EventService(ApiClient apiClient) {
    this.apiClient = apiClient;
  }

  public EventListResponse list(EventListRequest request) {
    return list(request, RequestSettings.none());
  }

  public EventListResponse list(EventListRequest request, RequestSettings settings) {
    return apiClient.execute(
        ApiRequest.builder(HttpMethod.GET, "/events", EventListResponse.class)
            .requestObject(request == null ? new EventListRequest() : request)
            .settings(settings)
            .build());
  }

  public Paginator<Event> all(EventListRequest request) {
    return all(request, RequestSettings.none());
  }

  public Paginator<Event> all(EventListRequest request, RequestSettings settings) {
    EventListRequest query = request == null ? new EventListRequest() : request;
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

  public EventResponse get(String identity) {
    return get(identity, RequestSettings.none());
  }

  public EventResponse get(String identity, RequestSettings settings) {
    return apiClient.execute(
        ApiRequest.builder(HttpMethod.GET, "/events/:identity", EventResponse.class)
            .pathParam("identity", requireIdentity(identity))
            .settings(settings)
            .build());
  }
}
