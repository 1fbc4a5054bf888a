package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gocardless.client.resources.CustomerBankAccount;
import java.util.List;

public class CustomerBankAccountListResponse extends ListResponse<CustomerBankAccount> {

  @JsonProperty("customer_bank_accounts")
  private List<CustomerBankAccount> customerBankAccounts;

  public List<CustomerBankAccount> getCustomerBankAccounts() {
    return customerBankAccounts;
  }

  public void setCustomerBankAccounts(List<CustomerBankAccount> customerBankAccounts) {
    this.customerBankAccounts = customerBankAccounts;
  }

  @Override
  public List<CustomerBankAccount> getItems() {
    return customerBankAccounts == null ? List.of() : customerBankAccounts;
  }
}
