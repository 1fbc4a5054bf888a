package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gocardless.client.resources.Mandate;
import java.util.List;

public class MandateListResponse extends ListResponse<Mandate> {

  @JsonProperty("mandates")
  private List<Mandate> mandates;

  public List<Mandate> getMandates() {
    return mandates;
  }

  public void setMandates(List<Mandate> mandates) {
    this.mandates = mandates;
  }

  @Override
  public List<Mandate> getItems() {
    return mandates == null ? List.of() : mandates;
  }
}
