package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gocardless.client.enums.EventResourceType;

public class EventListRequest implements ListRequest {

  /** Cursor pointing to the start of the desired set. */
  @JsonProperty("after")
  private String after;

  /** Cursor pointing to the end of the desired set. */
  @JsonProperty("before")
  private String before;

  /** Number of records to return. */
  @JsonProperty("limit")
  private Integer limit;

  @JsonProperty("created_at")
  private CreatedAtFilter createdAt;

  /** Limit to events with a given action, e.g. "cancelled". */
  @JsonProperty("action")
  private String action;

  @JsonProperty("customer")
  private String customer;

  @JsonProperty("mandate")
  private String mandate;

  @JsonProperty("resource_type")
  private EventResourceType resourceType;

  @Override
  public String getAfter() {
    return after;
  }

  @Override
  public void setAfter(String after) {
    this.after = after;
  }

  @Override
  public String getBefore() {
    return before;
  }

  @Override
  public void setBefore(String before) {
    this.before = before;
  }

  @Override
  public Integer getLimit() {
    return limit;
  }

  @Override
  public void setLimit(Integer limit) {
    this.limit = limit;
  }

  public CreatedAtFilter getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(CreatedAtFilter createdAt) {
    this.createdAt = createdAt;
  }

  public String getAction() {
    return action;
  }

  public void setAction(String action) {
    this.action = action;
  }

  public String getCustomer() {
    return customer;
  }

  public void setCustomer(String customer) {
    this.customer = customer;
  }

  public String getMandate() {
    return mandate;
  }

  public void setMandate(String mandate) {
    this.mandate = mandate;
  }

  public EventResourceType getResourceType() {
    return resourceType;
  }

  public void setResourceType(EventResourceType resourceType) {
    this.resourceType = resourceType;
  }
}
