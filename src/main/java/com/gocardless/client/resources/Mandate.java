package com.gocardless.client.resources;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gocardless.client.enums.MandateStatus;
import com.gocardless.client.enums.Scheme;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Map;

/** Authorisation to collect payments from a customer's bank account. */
public class Mandate {

  /** Unique identifier, beginning with "MD". */
  @JsonProperty("id")
  private String id;

  @JsonProperty("created_at")
  private OffsetDateTime createdAt;

  /** Unique reference. Generated by GoCardless if not supplied on creation. */
  @JsonProperty("reference")
  private String reference;

  @JsonProperty("scheme")
  private Scheme scheme;

  @JsonProperty("status")
  private MandateStatus status;

  /** The earliest date a newly created payment for this mandate could be charged. */
  @JsonProperty("next_possible_charge_date")
  private LocalDate nextPossibleChargeDate;

  @JsonProperty("payments_require_approval")
  private Boolean paymentsRequireApproval;

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

  public MandateStatus getStatus() {
    return status;
  }

  public void setStatus(MandateStatus status) {
    this.status = status;
  }

  public LocalDate getNextPossibleChargeDate() {
    return nextPossibleChargeDate;
  }

  public void setNextPossibleChargeDate(LocalDate nextPossibleChargeDate) {
    this.nextPossibleChargeDate = nextPossibleChargeDate;
  }

  public Boolean getPaymentsRequireApproval() {
    return paymentsRequireApproval;
  }

  public void setPaymentsRequireApproval(Boolean paymentsRequireApproval) {
    this.paymentsRequireApproval = paymentsRequireApproval;
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

    @JsonProperty("creditor")
    private String creditor;

    @JsonProperty("customer_bank_account")
    private String customerBankAccount;

    /** ID of the mandate this one was replaced by, e.g. after a bank account switch. */
    @JsonProperty("new_mandate")
    private String newMandate;

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

    public String getNewMandate() {
      return newMandate;
    }

    public void setNewMandate(String newMandate) {
      this.newMandate = newMandate;
    }
  }
}
