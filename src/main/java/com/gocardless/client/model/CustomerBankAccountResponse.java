package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gocardless.client.resources.CustomerBankAccount;

public class CustomerBankAccountResponse extends ApiResponse {

  @JsonProperty("customer_bank_accounts")
  private CustomerBankAccount customerBankAccount;

  public CustomerBankAccount getCustomerBankAccount() {
    return customerBankAccount;
  }

  public void setCustomerBankAccount(CustomerBankAccount customerBankAccount) {
    this.customerBankAccount = customerBankAccount;
  }
}
