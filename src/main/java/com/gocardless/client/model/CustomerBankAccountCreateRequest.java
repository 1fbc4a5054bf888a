package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Bank details may be given as a local account number with bank and branch codes, as an
 * IBAN, or as a {@code customer_bank_account_token} link from a client-side tokenisation.
 */
public class CustomerBankAccountCreateRequest implements IdempotentRequest {

  /** Name of the account holder, as known by the bank. Usually the customer's name, in capitals. */
  @JsonProperty("account_holder_name")
  private String accountHolderName;

  @JsonProperty("account_number")
  private String accountNumber;

  @JsonProperty("bank_code")
  private String bankCode;

  @JsonProperty("branch_code")
  private String branchCode;

  @JsonProperty("country_code")
  private String countryCode;

  @JsonProperty("currency")
  private String currency;

  /** International Bank Account Number. Alternatively the local details can be provided. */
  @JsonProperty("iban")
  private String iban;

  /**
   * Key-value store of custom data. Up to 3 keys are permitted, with key names up to 50
   * characters and values up to 500 characters.
   */
  @JsonProperty("metadata")
  private Map<String, String> metadata;

  @JsonProperty("links")
  private Links links;

  @JsonIgnore
  private String idempotencyKey;

  public String getAccountHolderName() {
    return accountHolderName;
  }

  public void setAccountHolderName(String accountHolderName) {
    this.accountHolderName = accountHolderName;
  }

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

  public String getCurrency() {
    return currency;
  }

  public void setCurrency(String currency) {
    this.currency = currency;
  }

  public String getIban() {
    return iban;
  }

  public void setIban(String iban) {
    this.iban = iban;
  }

  public Map<String, String> getMetadata() {
    return metadata;
  }

  public void setMetadata(Map<String, String> metadata) {
    this.metadata = metadata;
  }

  public Links getLinks() {
    return links;
  }

  public void setLinks(Links links) {
    this.links = links;
  }

  @Override
  public String getIdempotencyKey() {
    return idempotencyKey;
  }

  @Override
  public void setIdempotencyKey(String idempotencyKey) {
    this.idempotencyKey = idempotencyKey;
  }

  public static class Links {

    /** ID of the customer that owns this bank account. */
    @JsonProperty("customer")
    private String customer;

    @JsonProperty("customer_bank_account_token")
    private String customerBankAccountToken;

    public String getCustomer() {
      return customer;
    }

    public void setCustomer(String customer) {
      this.customer = customer;
    }

    public String getCustomerBankAccountToken() {
      return customerBankAccountToken;
    }

    public void setCustomerBankAccountToken(String customerBankAccountToken) {
      this.customerBankAccountToken = customerBankAccountToken;
    }
  }
}
