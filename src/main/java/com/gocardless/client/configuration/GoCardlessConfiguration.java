package com.gocardless.client.configuration;

import com.gocardless.client.GoCardlessClient;
import com.gocardless.client.client.ApiClient;
import com.gocardless.client.client.RestTemplateApiClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.web.client.RestTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.web.client.RestTemplate;

/**
 * Spring Boot auto-configuration, active when {@code gocardless.access-token} is set.
 *
 * <p>Provides:
 * <ul>
 *   <li>a {@link RestTemplate} with the configured connect/read timeouts</li>
 *   <li>the {@link ApiClient} executing requests through it</li>
 *   <li>the {@link GoCardlessClient} exposing the resource services</li>
 * </ul>
 * Each bean backs off when the application defines its own.
 */
@AutoConfiguration(after = RestTemplateAutoConfiguration.class)
@ConditionalOnProperty(prefix = "gocardless", name = "access-token")
@EnableConfigurationProperties(GoCardlessProperties.class)
public class GoCardlessConfiguration {

  @Bean
  @ConditionalOnMissingBean(name = "goCardlessRestTemplate")
  public RestTemplate goCardlessRestTemplate(ObjectProvider<RestTemplateBuilder> builder,
      GoCardlessProperties properties) {
    return restTemplate(builder.getIfAvailable(RestTemplateBuilder::new), properties);
  }

  @Bean
  @ConditionalOnMissingBean
  public ApiClient goCardlessApiClient(
      @Qualifier("goCardlessRestTemplate") RestTemplate goCardlessRestTemplate,
      GoCardlessProperties properties) {
    return new RestTemplateApiClient(goCardlessRestTemplate, properties,
        ObjectMapperFactory.create());
  }

  @Bean
  @ConditionalOnMissingBean
  public GoCardlessClient goCardlessClient(ApiClient goCardlessApiClient) {
    return new GoCardlessClient(goCardlessApiClient);
  }

  /** Builds the client's {@link RestTemplate}; also used outside Spring. */
  public static RestTemplate restTemplate(RestTemplateBuilder builder,
      GoCardlessProperties properties) {
    return builder
        .setConnectTimeout(properties.getConnectTimeout())
        .setReadTimeout(properties.getReadTimeout())
        .build();
  }
}
