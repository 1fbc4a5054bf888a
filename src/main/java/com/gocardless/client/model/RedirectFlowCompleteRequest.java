package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class RedirectFlowCompleteRequest {

  /** Must match the token given when the flow was created. */
  @JsonProperty("session_token")
  private String sessionToken;

  public String getSessionToken() {
    return sessionToken;
  }

  public void setSessionToken(String sessionToken) {
    this.sessionToken = sessionToken;
  }
}
