package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gocardless.client.resources.BankDetailsLookup;

public class BankDetailsLookupResponse extends ApiResponse {

  @JsonProperty("bank_details_lookups")
  private BankDetailsLookup bankDetailsLookup;

  public BankDetailsLookup getBankDetailsLookup() {
    return bankDetailsLookup;
  }

  public void setBankDetailsLookup(BankDetailsLookup bankDetailsLookup) {
    this.bankDetailsLookup = bankDetailsLookup;
  }
}
