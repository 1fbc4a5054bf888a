package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class CustomerListRequest implements ListRequest {

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
}
