package com.gocardless.client.resources;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * A bank account belonging to a customer. Mandates are created against bank accounts.
 */
public class CustomerBankAccount {

  /** Unique identifier, beginning with "BA". */
  @JsonProperty("id")
  private String id;

  @JsonProperty("created_at")
  private OffsetDateTime createdAt;

  /** Name of the account holder, as known by the bank. */
  @JsonProperty("account_holder_name")
  private String accountHolderName;

  /** Last two digits of the account number. */
  @JsonProperty("account_number_ending")
  private String accountNumberEnding;

  @JsonProperty("bank_name")
  private String bankName;

  @JsonProperty("country_code")
  private String countryCode;

  /** ISO 4217 currency code. */
  @JsonProperty("currency")
  private String currency;

  /**
   * False once the account has been disabled. Disabled accounts cannot be used for new
   * mandates.
   */
  @JsonProperty("enabled")
  private Boolean enabled;

  @JsonProperty("metadata")
  private Map<String, String> metadata;

  @JsonProperty("links")
  private Links links;

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public OffsetDateTime getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(OffsetDateTime createdAt) {
    this.createdAt = createdAt;
  }

  public String getAccountHolderName() {
    return accountHolderName;
  }

  public void setAccountHolderName(String accountHolderName) {
    this.accountHolderName = accountHolderName;
  }

  public String getAccountNumberEnding() {
    return accountNumberEnding;
  }

  public void setAccountNumberEnding(String accountNumberEnding) {
    this.accountNumberEnding = accountNumberEnding;
  }

  public String getBankName() {
    return bankName;
  }

  public void setBankName(String bankName) {
    this.bankName = bankName;
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

  public Boolean getEnabled() {
    return enabled;
  }

  public void setEnabled(Boolean enabled) {
    this.enabled = enabled;
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

  public static class Links {

    /** ID of the customer that owns this bank account. */
    @JsonProperty("customer")
    private String customer;

    public String getCustomer() {
      return customer;
    }

    public void setCustomer(String customer) {
      this.customer = customer;
    }
  }
}
