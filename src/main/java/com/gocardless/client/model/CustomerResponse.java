package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gocardless.client.resources.Customer;

public class CustomerResponse extends ApiResponse {

  @JsonProperty("customers")
  private Customer customer;

  public Customer getCustomer() {
    return customer;
  }

  public void setCustomer(Customer customer) {
    this.customer = customer;
  }
}
