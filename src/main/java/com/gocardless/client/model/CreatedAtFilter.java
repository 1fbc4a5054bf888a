package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.OffsetDateTime;

/**
 * Limits a list to records created within certain times. Sent as
 * {@code created_at[gt]}, {@code created_at[gte]}, and so on.
 */
public class CreatedAtFilter {

  @JsonProperty("gt")
  private OffsetDateTime greaterThan;

  @JsonProperty("gte")
  private OffsetDateTime greaterThanOrEqual;

  @JsonProperty("lt")
  private OffsetDateTime lessThan;

  @JsonProperty("lte")
  private OffsetDateTime lessThanOrEqual;

  public OffsetDateTime getGreaterThan() {
    return greaterThan;
  }

  public void setGreaterThan(OffsetDateTime greaterThan) {
    this.greaterThan = greaterThan;
  }

  public OffsetDateTime getGreaterThanOrEqual() {
    return greaterThanOrEqual;
  }

  public void setGreaterThanOrEqual(OffsetDateTime greaterThanOrEqual) {
    this.greaterThanOrEqual = greaterThanOrEqual;
  }

  public OffsetDateTime getLessThan() {
    return lessThan;
  }

  public void setLessThan(OffsetDateTime lessThan) {
    this.lessThan = lessThan;
  }

  public OffsetDateTime getLessThanOrEqual() {
    return lessThanOrEqual;
  }

  public void setLessThanOrEqual(OffsetDateTime lessThanOrEqual) {
    this.lessThanOrEqual = lessThanOrEqual;
  }
}
