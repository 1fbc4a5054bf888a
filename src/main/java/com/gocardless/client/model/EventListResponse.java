package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gocardless.client.resources.Event;
import java.util.List;

public class EventListResponse extends ListResponse<Event> {

  @JsonProperty("events")
  private List<Event> events;

  public List<Event> getEvents() {
    return events;
  }

  public void setEvents(List<Event> events) {
    this.events = events;
  }

  @Override
  public List<Event> getItems() {
    return events == null ? List.of() : events;
  }
}
