package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gocardless.client.resources.RedirectFlow;

public class RedirectFlowResponse extends ApiResponse {

  @JsonProperty("redirect_flows")
  private RedirectFlow redirectFlow;

  public RedirectFlow getRedirectFlow() {
    return redirectFlow;
  }

  public void setRedirectFlow(RedirectFlow redirectFlow) {
    this.redirectFlow = redirectFlow;
  }
}
