package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/** Only the metadata of a bank account can be updated. */
public class CustomerBankAccountUpdateRequest {

  /**
   * Key-value store of custom data. Up to 3 keys are permitted, with key names up to 50
   * characters and values up to 500 characters.
   */
  @JsonProperty("metadata")
  private Map<String, String> metadata;

  public Map<String, String> getMetadata() {
    return metadata;
  }

  public void setMetadata(Map<String, String> metadata) {
    this.metadata = metadata;
  }
}
