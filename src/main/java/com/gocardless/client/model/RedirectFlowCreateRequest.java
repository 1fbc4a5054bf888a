package com.gocardless.client.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gocardless.client.enums.Scheme;

public class RedirectFlowCreateRequest implements IdempotentRequest {

  /** Shown on the hosted payment pages. */
  @JsonProperty("description")
  private String description;

  /** The customer's session id, checked again when the flow is completed. */
  @JsonProperty("session_token")
  private String sessionToken;

  @JsonProperty("success_redirect_url")
  private String successRedirectUrl;

  /** Leave blank so the most appropriate scheme is picked from the customer's bank account. */
  @JsonProperty("scheme")
  private Scheme scheme;

  @JsonProperty("links")
  private Links links;

  /** Details used to prefill the payment pages. */
  @JsonProperty("prefilled_customer")
  private PrefilledCustomer prefilledCustomer;

  @JsonIgnore
  private String idempotencyKey;

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public String getSessionToken() {
    return sessionToken;
  }

  public void setSessionToken(String sessionToken) {
    this.sessionToken = sessionToken;
  }

  public String getSuccessRedirectUrl() {
    return successRedirectUrl;
  }

  public void setSuccessRedirectUrl(String successRedirectUrl) {
    this.successRedirectUrl = successRedirectUrl;
  }

  public Scheme getScheme() {
    return scheme;
  }

  public void setScheme(Scheme scheme) {
    this.scheme = scheme;
  }

  public Links getLinks() {
    return links;
  }

  public void setLinks(Links links) {
    this.links = links;
  }

  public PrefilledCustomer getPrefilledCustomer() {
    return prefilledCustomer;
  }

  public void setPrefilledCustomer(PrefilledCustomer prefilledCustomer) {
    this.prefilledCustomer = prefilledCustomer;
  }

  @Override
  public String getIdempotencyKey() {
    return idempotencyKey;
  }

  @Override
  public void setIdempotencyKey(String idempotencyKey) {
    this.idempotencyKey = idempotencyKey;
  }

  public static class Links {

    /** Only required if your account manages multiple creditors. */
    @JsonProperty("creditor")
    private String creditor;

    public String getCreditor() {
      return creditor;
    }

    public void setCreditor(String creditor) {
      this.creditor = creditor;
    }
  }

  public static class PrefilledCustomer {

    /** The first line of the customer's address. */
    @JsonProperty("address_line1")
    private String addressLine1;

    @JsonProperty("address_line2")
    private String addressLine2;

    @JsonProperty("address_line3")
    private String addressLine3;

    @JsonProperty("city")
    private String city;

    /** The customer's address region, county or department. */
    @JsonProperty("region")
    private String region;

    @JsonProperty("postal_code")
    private String postalCode;

    /** ISO 3166-1 alpha-2 code. */
    @JsonProperty("country_code")
    private String countryCode;

    /** Required unless a given name and family name are provided. */
    @JsonProperty("company_name")
    private String companyName;

    /** Required unless a company name is provided. */
    @JsonProperty("given_name")
    private String givenName;

    /** Required unless a company name is provided. */
    @JsonProperty("family_name")
    private String familyName;

    @JsonProperty("email")
    private String email;

    /**
     * ISO 639-1 code used for notification emails. Currently only "en", "fr", "de", "pt", "es",
     * "it", "nl" and "sv" are supported.
     */
    @JsonProperty("language")
    private String language;

    /**
     * For Swedish customers only. Must be supplied if the customer's bank account is
     * denominated in Swedish krona (SEK).
     */
    @JsonProperty("swedish_identity_number")
    private String swedishIdentityNumber;

    public String getAddressLine1() {
      return addressLine1;
    }

    public void setAddressLine1(String addressLine1) {
      this.addressLine1 = addressLine1;
    }

    public String getAddressLine2() {
      return addressLine2;
    }

    public void setAddressLine2(String addressLine2) {
      this.addressLine2 = addressLine2;
    }

    public String getAddressLine3() {
      return addressLine3;
    }

    public void setAddressLine3(String addressLine3) {
      this.addressLine3 = addressLine3;
    }

    public String getCity() {
      return city;
    }

    public void setCity(String city) {
      this.city = city;
    }

    public String getRegion() {
      return region;
    }

    public void setRegion(String region) {
      this.region = region;
    }

    public String getPostalCode() {
      return postalCode;
    }

    public void setPostalCode(String postalCode) {
      this.postalCode = postalCode;
    }

    public String getCountryCode() {
      return countryCode;
    }

    public void setCountryCode(String countryCode) {
      this.countryCode = countryCode;
    }

    public String getCompanyName() {
      return companyName;
    }

    public void setCompanyName(String companyName) {
      this.companyName = companyName;
    }

    public String getGivenName() {
      return givenName;
    }

    public void setGivenName(String givenName) {
      this.givenName = givenName;
    }

    public String getFamilyName() {
      return familyName;
    }

    public void setFamilyName(String familyName) {
      this.familyName = familyName;
    }

    public String getEmail() {
      return email;
    }

    public void setEmail(String email) {
      this.email = email;
    }

    public String getLanguage() {
      return language;
    }

    public void setLanguage(String language) {
      this.language = language;
    }

    public String getSwedishIdentityNumber() {
      return swedishIdentityNumber;
    }

    public void setSwedishIdentityNumber(String swedishIdentityNumber) {
      this.swedishIdentityNumber = swedishIdentityNumber;
    }
  }
}
