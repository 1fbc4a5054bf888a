package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gocardless.client.resources.Customer;
import java.util.List;

public class CustomerListResponse extends ListResponse<Customer> {

  @JsonProperty("customers")
  private List<Customer> customers;

  public List<Customer> getCustomers() {
    return customers;
  }

  public void setCustomers(List<Customer> customers) {
    this.customers = customers;
  }

  @Override
  public List<Customer> getItems() {
    return customers == null ? List.of() : customers;
  }
}
