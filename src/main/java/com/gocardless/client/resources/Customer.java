package com.gocardless.client.resources;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Contact details for a customer. A customer can have several customer bank accounts,
 * which in turn can have several Direct Debit mandates.
 */
public class Customer {

  /** Unique identifier, beginning with "CU". */
  @JsonProperty("id")
  private String id;

  /** Fixed timestamp recording when this resource was created. */
  @JsonProperty("created_at")
  private OffsetDateTime createdAt;

  /** The first line of the customer's address. */
  @JsonProperty("address_line1")
  private String addressLine1;

  /** The second line of the customer's address. */
  @JsonProperty("address_line2")
  private String addressLine2;

  /** The third line of the customer's address. */
  @JsonProperty("address_line3")
  private String addressLine3;

  /** The city of the customer's address. */
  @JsonProperty("city")
  private String city;

  /** The customer's address region, county or department. */
  @JsonProperty("region")
  private String region;

  /** The customer's postal code. */
  @JsonProperty("postal_code")
  private String postalCode;

  /** ISO 3166-1 alpha-2 code. */
  @JsonProperty("country_code")
  private String countryCode;

  /** Customer's company name. Required unless a given name and family name are provided. */
  @JsonProperty("company_name")
  private String companyName;

  /** Customer's first name. Required unless a company name is provided. */
  @JsonProperty("given_name")
  private String givenName;

  /** Customer's surname. Required unless a company name is provided. */
  @JsonProperty("family_name")
  private String familyName;

  /** Customer's email address. */
  @JsonProperty("email")
  private String email;

  /** ISO 639-1 code used for notification emails. Defaults from the country code, or "en". */
  @JsonProperty("language")
  private String language;

  /**
   * For Swedish customers only. The civic/company number (personnummer, samordningsnummer, or
   * organisationsnummer) of the customer. Cannot be changed once set.
   */
  @JsonProperty("swedish_identity_number")
  private String swedishIdentityNumber;

  /** Key-value store of custom data. */
  @JsonProperty("metadata")
  private Map<String, String> metadata;

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public OffsetDateTime getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(OffsetDateTime createdAt) {
    this.createdAt = createdAt;
  }

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

  public Map<String, String> getMetadata() {
    return metadata;
  }

  public void setMetadata(Map<String, String> metadata) {
    this.metadata = metadata;
  }
}
