package com.gocardless.client.resources;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gocardless.client.enums.Scheme;
import java.time.OffsetDateTime;

/**
 * A redirect flow sends a customer to the hosted payment pages to set up a mandate.
 *
 * <p>The overall flow is:
 * <ol>
 *   <li>Create a redirect flow and send the customer to its {@code redirect_url}.</li>
 *   <li>The customer fills in their details and is sent back to {@code success_redirect_url}
 *       with the redirect flow id in the query string.</li>
 *   <li>Complete the flow, which creates the customer, bank account and mandate.</li>
 * </ol>
 *
 * <p>Redirect flows expire 30 minutes after they are created and cannot be completed after
 * that.
 */
public class RedirectFlow {

  /** Unique identifier, beginning with "RE". */
  @JsonProperty("id")
  private String id;

  @JsonProperty("created_at")
  private OffsetDateTime createdAt;

  /** Description of the item the customer is paying for, shown on the payment pages. */
  @JsonProperty("description")
  private String description;

  /** URL of the hosted payment pages. Redirect your customer here. */
  @JsonProperty("redirect_url")
  private String redirectUrl;

  /** If set, the payment pages only allow a mandate for this scheme. */
  @JsonProperty("scheme")
  private Scheme scheme;

  /** The customer's session id. Must be provided again on completion. */
  @JsonProperty("session_token")
  private String sessionToken;

  /**
   * Where the customer is sent after a successful mandate setup. Must use https in the live
   * environment.
   */
  @JsonProperty("success_redirect_url")
  private String successRedirectUrl;

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

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public String getRedirectUrl() {
    return redirectUrl;
  }

  public void setRedirectUrl(String redirectUrl) {
    this.redirectUrl = redirectUrl;
  }

  public Scheme getScheme() {
    return scheme;
  }

  public void setScheme(Scheme scheme) {
    this.scheme = scheme;
  }

  public String getSessionToken() {
    return sessionToken;
  }

  public void setSessionToken(String sessionToken) {
    this.sessionToken = sessionToken;
  }

  public String getSuccessRedirectUrl() {
    return successRedirectUrl;
  }

  public void setSuccessRedirectUrl(String successRedirectUrl) {
    this.successRedirectUrl = successRedirectUrl;
  }

  public Links getLinks() {
    return links;
  }

  public void setLinks(Links links) {
    this.links = links;
  }

  /**
   * Ids of the resources involved. All except {@code creditor} are only present once the
   * flow has been completed.
   */
  public static class Links {

    /** The creditor for whom the mandate will be created. */
    @JsonProperty("creditor")
    private String creditor;

    @JsonProperty("customer")
    private String customer;

    @JsonProperty("customer_bank_account")
    private String customerBankAccount;

    @JsonProperty("mandate")
    private String mandate;

    public String getCreditor() {
      return creditor;
    }

    public void setCreditor(String creditor) {
      this.creditor = creditor;
    }

    public String getCustomer() {
      return customer;
    }

    public void setCustomer(String customer) {
      this.customer = customer;
    }

    public String getCustomerBankAccount() {
      return customerBankAccount;
    }

    public void setCustomerBankAccount(String customerBankAccount) {
      this.customerBankAccount = customerBankAccount;
    }

    public String getMandate() {
      return mandate;
    }

    public void setMandate(String mandate) {
      this.mandate = mandate;
    }
  }
}
