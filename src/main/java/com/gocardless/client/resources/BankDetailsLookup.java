package com.gocardless.client.resources;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gocardless.client.enums.Scheme;
import java.util.List;

/** Name and reachability of a bank. */
public class BankDetailsLookup {

  /** Schemes supported for this bank account. Empty if it is not reachable by any scheme. */
  @JsonProperty("available_debit_schemes")
  private List<Scheme> availableDebitSchemes;

  /** The name of the bank with which the account is held, if available. */
  @JsonProperty("bank_name")
  private String bankName;

  /** ISO 9362 SWIFT BIC of the bank with which the account is held. */
  @JsonProperty("bic")
  private String bic;

  public List<Scheme> getAvailableDebitSchemes() {
    return availableDebitSchemes;
  }

  public void setAvailableDebitSchemes(List<Scheme> availableDebitSchemes) {
    this.availableDebitSchemes = availableDebitSchemes;
  }

  public String getBankName() {
    return bankName;
  }

  public void setBankName(String bankName) {
    this.bankName = bankName;
  }

  public String getBic() {
    return bic;
  }

  public void setBic(String bic) {
    this.bic = bic;
  }
}
