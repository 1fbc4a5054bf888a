package com.gocardless.client.enums;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle states of a mandate.
 */
public enum MandateStatus {
  /** Waiting for the customer to approve the mandate (not used by all schemes). */
  @JsonProperty("pending_customer_approval")
  PENDING_CUSTOMER_APPROVAL,
  @JsonProperty("pending_submission")
  PENDING_SUBMISSION,
  @JsonProperty("submitted")
  SUBMITTED,
  @JsonProperty("active")
  ACTIVE,
  @JsonProperty("failed")
  FAILED,
  @JsonProperty("cancelled")
  CANCELLED,
  @JsonProperty("expired")
  EXPIRED,
  @JsonEnumDefaultValue
  UNKNOWN
}
