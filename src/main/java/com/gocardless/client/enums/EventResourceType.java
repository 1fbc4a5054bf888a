package com.gocardless.client.enums;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;

public enum EventResourceType {
  @JsonProperty("customers")
  CUSTOMERS,
  @JsonProperty("customer_bank_accounts")
  CUSTOMER_BANK_ACCOUNTS,
  @JsonProperty("mandates")
  MANDATES,
  @JsonProperty("payments")
  PAYMENTS,
  @JsonProperty("payouts")
  PAYOUTS,
  @JsonProperty("refunds")
  REFUNDS,
  @JsonProperty("subscriptions")
  SUBSCRIPTIONS,
  @JsonEnumDefaultValue
  UNKNOWN
}
