package com.gocardless.client;

import com.gocardless.client.client.ApiClient;
import com.gocardless.client.client.RestTemplateApiClient;
import com.gocardless.client.configuration.Environment;
import com.gocardless.client.configuration.GoCardlessConfiguration;
import com.gocardless.client.configuration.GoCardlessProperties;
import com.gocardless.client.configuration.ObjectMapperFactory;
import com.gocardless.client.service.BankDetailsLookupService;
import com.gocardless.client.service.CustomerBankAccountService;
import com.gocardless.client.service.CustomerService;
import com.gocardless.client.service.EventService;
import com.gocardless.client.service.MandateService;
import com.gocardless.client.service.RedirectFlowService;
import com.gocardless.client.validation.MetadataValidator;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.web.client.RestTemplate;

/**
 * Entry point to the GoCardless API.
 *
 * <p>Outside Spring, create one with {@link #create(String, Environment)} and reuse it; it
 * is thread-safe. Under Spring Boot a bean is configured automatically when
 * {@code gocardless.access-token} is set.
 *
 * <pre>{@code
 * GoCardlessClient client = GoCardlessClient.create(token, Environment.SANDBOX);
 * for (Customer customer : client.customers().all(null)) {
 *   ...
 * }
 * }</pre>
 */
public class GoCardlessClient {

  private final CustomerService customers;
  private final CustomerBankAccountService customerBankAccounts;
  private final MandateService mandates;
  private final RedirectFlowService redirectFlows;
  private final BankDetailsLookupService bankDetailsLookups;
  private final EventService events;

  public GoCardlessClient(ApiClient apiClient) {
    MetadataValidator metadataValidator = new MetadataValidator();
    this.customers = new CustomerService(apiClient, metadataValidator);
    this.customerBankAccounts = new CustomerBankAccountService(apiClient, metadataValidator);
    this.mandates = new MandateService(apiClient, metadataValidator);
    this.redirectFlows = new RedirectFlowService(apiClient);
    this.bankDetailsLookups = new BankDetailsLookupService(apiClient);
    this.events = new EventService(apiClient);
  }

  public static GoCardlessClient create(String accessToken, Environment environment) {
    if (environment == null) {
      throw new IllegalArgumentException("environment must not be null");
    }
    GoCardlessProperties properties = new GoCardlessProperties();
    properties.setAccessToken(accessToken);
    properties.setEnvironment(environment);
    return create(properties);
  }

  public static GoCardlessClient create(GoCardlessProperties properties) {
    RestTemplate restTemplate =
        GoCardlessConfiguration.restTemplate(new RestTemplateBuilder(), properties);
    return new GoCardlessClient(
        new RestTemplateApiClient(restTemplate, properties, ObjectMapperFactory.create()));
  }

  public CustomerService customers() {
    return customers;
  }

  public CustomerBankAccountService customerBankAccounts() {
    return customerBankAccounts;
  }

  public MandateService mandates() {
    return mandates;
  }

  public RedirectFlowService redirectFlows() {
    return redirectFlows;
  }

  public BankDetailsLookupService bankDetailsLookups() {
    return bankDetailsLookups;
  }

  public EventService events() {
    return events;
  }
}
