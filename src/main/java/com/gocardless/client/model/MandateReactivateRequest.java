package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public class MandateReactivateRequest {

  @JsonProperty("metadata")
  private Map<String, String> metadata;

  public Map<String, String> getMetadata() {
    return metadata;
  }

  public void setMetadata(Map<String, String> metadata) {
    this.metadata = metadata;
  }
}
