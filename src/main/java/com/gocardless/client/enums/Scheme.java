package com.gocardless.client.enums;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Direct Debit schemes.
 */
public enum Scheme {
  @JsonProperty("autogiro")
  AUTOGIRO,
  @JsonProperty("bacs")
  BACS,
  @JsonProperty("sepa_core")
  SEPA_CORE,
  /** A scheme added to the API after this library was released. */
  @JsonEnumDefaultValue
  UNKNOWN
}
