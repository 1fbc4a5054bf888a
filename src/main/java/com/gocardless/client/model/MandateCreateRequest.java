package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gocardless.client.enums.Scheme;
import java.util.Map;

public class MandateCreateRequest implements IdempotentRequest {

  /**
   * Unique reference. Different schemes have different length and character set requirements.
   * Generated by GoCardless if left blank.
   */
  @JsonProperty("reference")
  private String reference;

  /** Direct Debit scheme. Inferred from the bank account if not provided. */
  @JsonProperty("scheme")
  private Scheme scheme;

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

  public String getReference() {
    return reference;
  }

  public void setReference(String reference) {
    this.reference = reference;
  }

  public Scheme getScheme() {
    return scheme;
  }

  public void setScheme(Scheme scheme) {
    this.scheme = scheme;
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

    /** Only required if your account manages multiple creditors. */
    @JsonProperty("creditor")
    private String creditor;

    /** The customer bank account to set up the mandate against. */
    @JsonProperty("customer_bank_account")
    private String customerBankAccount;

    public String getCreditor() {
      return creditor;
    }

    public void setCreditor(String creditor) {
      this.creditor = creditor;
    }

    public String getCustomerBankAccount() {
      return customerBankAccount;
    }

    public void setCustomerBankAccount(String customerBankAccount) {
      this.customerBankAccount = customerBankAccount;
    }
  }
}
