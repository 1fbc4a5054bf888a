package com.gocardless.client.resources;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gocardless.client.enums.EventResourceType;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Something that happened to a resource, e.g. a mandate being cancelled. Events are
 * listed through the API and delivered by webhooks.
 */
public class Event {

  /** Unique identifier, beginning with "EV". */
  @JsonProperty("id")
  private String id;

  @JsonProperty("created_at")
  private OffsetDateTime createdAt;

  /** What happened to the resource, e.g. "cancelled". */
  @JsonProperty("action")
  private String action;

  @JsonProperty("resource_type")
  private EventResourceType resourceType;

  @JsonProperty("details")
  private Details details;

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

  public String getAction() {
    return action;
  }

  public void setAction(String action) {
    this.action = action;
  }

  public EventResourceType getResourceType() {
    return resourceType;
  }

  public void setResourceType(EventResourceType resourceType) {
    this.resourceType = resourceType;
  }

  public Details getDetails() {
    return details;
  }

  public void setDetails(Details details) {
    this.details = details;
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

  public static class Details {

    /** Who initiated the event: "bank", "api", "gocardless" or "customer". */
    @JsonProperty("origin")
    private String origin;

    @JsonProperty("cause")
    private String cause;

    @JsonProperty("description")
    private String description;

    @JsonProperty("scheme")
    private String scheme;

    /** Reason code supplied by the scheme, if any. */
    @JsonProperty("reason_code")
    private String reasonCode;

    public String getOrigin() {
      return origin;
    }

    public void setOrigin(String origin) {
      this.origin = origin;
    }

    public String getCause() {
      return cause;
    }

    public void setCause(String cause) {
      this.cause = cause;
    }

    public String getDescription() {
      return description;
    }

    public void setDescription(String description) {
      this.description = description;
    }

    public String getScheme() {
      return scheme;
    }

    public void setScheme(String scheme) {
      this.scheme = scheme;
    }

    public String getReasonCode() {
      return reasonCode;
    }

    public void setReasonCode(String reasonCode) {
      this.reasonCode = reasonCode;
    }
  }

  public static class Links {

    @JsonProperty("mandate")
    private String mandate;

    @JsonProperty("customer")
    private String customer;

    @JsonProperty("customer_bank_account")
    private String customerBankAccount;

    @JsonProperty("new_customer_bank_account")
    private String newCustomerBankAccount;

    @JsonProperty("new_mandate")
    private String newMandate;

    @JsonProperty("parent_event")
    private String parentEvent;

    @JsonProperty("payment")
    private String payment;

    @JsonProperty("payout")
    private String payout;

    @JsonProperty("refund")
    private String refund;

    @JsonProperty("subscription")
    private String subscription;

    public String getMandate() {
      return mandate;
    }

    public void setMandate(String mandate) {
      this.mandate = mandate;
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

    public String getNewCustomerBankAccount() {
      return newCustomerBankAccount;
    }

    public void setNewCustomerBankAccount(String newCustomerBankAccount) {
      this.newCustomerBankAccount = newCustomerBankAccount;
    }

    public String getNewMandate() {
      return newMandate;
    }

    public void setNewMandate(String newMandate) {
      this.newMandate = newMandate;
    }

    public String getParentEvent() {
      return parentEvent;
    }

    public void setParentEvent(String parentEvent) {
      this.parentEvent = parentEvent;
    }

    public String getPayment() {
      return payment;
    }

    public void setPayment(String payment) {
      this.payment = payment;
    }

    public String getPayout() {
      return payout;
    }

    public void setPayout(String payout) {
      this.payout = payout;
    }

    public String getRefund() {
      return refund;
    }

    public void setRefund(String refund) {
      this.refund = refund;
    }

    public String getSubscription() {
      return subscription;
    }

    public void setSubscription(String subscription) {
      this.subscription = subscription;
    }
  }
}
