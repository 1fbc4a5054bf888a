package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class BankDetailsLookupCreateRequest {

  /** Bank account number. Alternatively an IBAN can be provided. */
  @JsonProperty("account_number")
  private String accountNumber;

  @JsonProperty("bank_code")
  private String bankCode;

  @JsonProperty("branch_code")
  private String branchCode;

  /** ISO 3166-1 alpha-2 code. Must be provided if an IBAN is not. */
  @JsonProperty("country_code")
  private String countryCode;

  @JsonProperty("iban")
  private String iban;

  public String getAccountNumber() {
    return accountNumber;
  }

  public void setAccountNumber(String accountNumber) {
    this.accountNumber = accountNumber;
  }

  public String getBankCode() {
    return bankCode;
  }

  public void setBankCode(String bankCode) {
    this.bankCode = bankCode;
  }

  public String getBranchCode() {
    return branchCode;
  }

  public void setBranchCode(String branchCode) {
    this.branchCode = branchCode;
  }

  public String getCountryCode() {
    return countryCode;
  }

  public void setCountryCode(String countryCode) {
    this.countryCode = countryCode;
  }

  public String getIban() {
    return iban;
  }

  public void setIban(String iban) {
    this.iban = iban;
  }
}
