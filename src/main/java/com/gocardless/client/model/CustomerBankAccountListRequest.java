package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class CustomerBankAccountListRequest implements ListRequest {

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

  /** Only bank accounts belonging to this customer. */
  @JsonProperty("customer")
  private String customer;

  /** Filter on whether the account is enabled. */
  @JsonProperty("enabled")
  private Boolean enabled;

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

  public String getCustomer() {
    return customer;
  }

  public void setCustomer(String customer) {
    this.customer = customer;
  }

  public Boolean getEnabled() {
    return enabled;
  }

  public void setEnabled(Boolean enabled) {
    this.enabled = enabled;
  }
}
