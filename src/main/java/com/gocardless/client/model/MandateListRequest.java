package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gocardless.client.enums.MandateStatus;
import java.util.List;

public class MandateListRequest implements ListRequest {

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

  @JsonProperty("customer")
  private String customer;

  @JsonProperty("customer_bank_account")
  private String customerBankAccount;

  @JsonProperty("reference")
  private String reference;

  /** At most four statuses can be given. */
  @JsonProperty("status")
  private List<MandateStatus> status;

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

  public String getCustomerBankAccount() {
    return customerBankAccount;
  }

  public void setCustomerBankAccount(String customerBankAccount) {
    this.customerBankAccount = customerBankAccount;
  }

  public String getReference() {
    return reference;
  }

  public void setReference(String reference) {
    this.reference = reference;
  }

  public List<MandateStatus> getStatus() {
    return status;
  }

  public void setStatus(List<MandateStatus> status) {
    this.status = status;
  }
}
