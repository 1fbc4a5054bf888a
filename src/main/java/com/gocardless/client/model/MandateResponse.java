package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gocardless.client.resources.Mandate;

public class MandateResponse extends ApiResponse {

  @JsonProperty("mandates")
  private Mandate mandate;

  public Mandate getMandate() {
    return mandate;
  }

  public void setMandate(Mandate mandate) {
    this.mandate = mandate;
  }
}
