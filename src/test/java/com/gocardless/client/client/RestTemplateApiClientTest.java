package com.gocardless.client.client;

import static org.hamcrest.Matchers.matchesPattern;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.ExpectedCount.times;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.headerDoesNotExist;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.gocardless.client.configuration.GoCardlessProperties;
import com.gocardless.client.configuration.ObjectMapperFactory;
import com.gocardless.client.enums.MandateStatus;
import com.gocardless.client.enums.Scheme;
import com.gocardless.client.exception.ApiConnectionException;
import com.gocardless.client.exception.GoCardlessInternalException;
import com.gocardless.client.exception.InvalidApiUsageException;
import com.gocardless.client.exception.InvalidStateException;
import com.gocardless.client.exception.MalformedResponseException;
import com.gocardless.client.exception.ValidationFailedException;
import com.gocardless.client.model.CustomerCreateRequest;
import com.gocardless.client.model.CustomerListRequest;
import com.gocardless.client.model.CustomerListResponse;
import com.gocardless.client.model.CustomerResponse;
import com.gocardless.client.model.CustomerUpdateRequest;
import com.gocardless.client.model.MandateResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

@DisplayName("RestTemplateApiClient")
class RestTemplateApiClientTest {

  private static final String BASE_URL = "https://api.test";

  private MockRestServiceServer mockServer;
  private GoCardlessProperties properties;
  private RestTemplate restTemplate;
  private RestTemplateApiClient apiClient;

  @BeforeEach
  void setUp() {
    restTemplate = new RestTemplate();
    mockServer = MockRestServiceServer.bindTo(restTemplate).build();
    properties = new GoCardlessProperties();
    properties.setAccessToken("test_token");
    properties.setBaseUrl(BASE_URL);
    properties.setRetryDelay(Duration.ZERO);
    apiClient = new RestTemplateApiClient(restTemplate, properties, ObjectMapperFactory.create());
  }

  private static String customerJson(String id) {
    return """
        {
          "customers": {
            "id": "%s",
            "given_name": "Jane",
            "family_name": "Doe",
            "created_at": "2024-01-15T10:00:00.000Z",
            "metadata": {"crm_id": "42"}
          }
        }
        """.formatted(id);
  }

  private static String errorJson(String type, int code, String reason) {
    return """
        {
          "error": {
            "message": "Request failed",
            "type": "%s",
            "code": %d,
            "request_id": "RQ-ERR",
            "documentation_url": "https://developer.gocardless.com/api-reference#%s",
            "errors": [{"reason": "%s", "message": "Request failed"}]
          }
        }
        """.formatted(type, code, reason, reason);
  }

  private static String conflictJson(String conflictingId) {
    return """
        {
          "error": {
            "message": "A resource has already been created with this idempotency key",
            "type": "invalid_state",
            "code": 409,
            "request_id": "RQ-409",
            "errors": [{
              "reason": "idempotent_creation_conflict",
              "message": "A resource has already been created with this idempotency key",
              "links": {"conflicting_resource_id": "%s"}
            }]
          }
        }
        """.formatted(conflictingId);
  }

  private ApiRequest<CustomerResponse> createCustomer(CustomerCreateRequest body) {
    return ApiRequest.builder(HttpMethod.POST, "/customers", CustomerResponse.class)
        .requestObject(body)
        .envelope("customers")
        .conflictHandler(id -> apiClient.execute(
            ApiRequest.builder(HttpMethod.GET, "/customers/:identity", CustomerResponse.class)
                .pathParam("identity", id)
                .build()))
        .build();
  }

  private ApiRequest<CustomerResponse> getCustomer(String id) {
    return ApiRequest.builder(HttpMethod.GET, "/customers/:identity", CustomerResponse.class)
        .pathParam("identity", id)
        .build();
  }

  private CustomerCreateRequest janeDoe() {
    CustomerCreateRequest request = new CustomerCreateRequest();
    request.setGivenName("Jane");
    request.setFamilyName("Doe");
    request.setEmail("jane@example.com");
    return request;
  }

  @Nested
  @DisplayName("Successful Responses")
  class SuccessfulResponses {

    @Test
    @DisplayName("Should unwrap the envelope and attach status and request id")
    void shouldParseEnvelope_andAttachHttpDetails() {
      // given
      HttpHeaders headers = new HttpHeaders();
      headers.set("X-Request-Id", "RQ-123");
      mockServer.expect(requestTo(BASE_URL + "/customers/CU123"))
          .andExpect(method(HttpMethod.GET))
          .andRespond(withSuccess(customerJson("CU123"), MediaType.APPLICATION_JSON)
              .headers(headers));

      // when
      CustomerResponse response = apiClient.execute(getCustomer("CU123"));

      // then
      assertEquals("CU123", response.getCustomer().getId());
      assertEquals("Jane", response.getCustomer().getGivenName());
      assertEquals("42", response.getCustomer().getMetadata().get("crm_id"));
      assertEquals(2024, response.getCustomer().getCreatedAt().getYear());
      assertEquals(200, response.getStatusCode());
      assertEquals("RQ-123", response.getRequestId());
      mockServer.verify();
    }

    @Test
    @DisplayName("Should ignore unknown fields and read unknown enum values as UNKNOWN")
    void shouldTolerateNewApiFields() {
      // given
      mockServer.expect(requestTo(BASE_URL + "/mandates/MD1"))
          .andRespond(withSuccess("""
              {
                "mandates": {
                  "id": "MD1",
                  "scheme": "faster_payments",
                  "status": "active",
                  "brand_new_field": {"nested": true}
                }
              }
              """, MediaType.APPLICATION_JSON));

      // when
      MandateResponse response = apiClient.execute(
          ApiRequest.builder(HttpMethod.GET, "/mandates/:identity", MandateResponse.class)
              .pathParam("identity", "MD1")
              .build());

      // then
      assertEquals(Scheme.UNKNOWN, response.getMandate().getScheme());
      assertEquals(MandateStatus.ACTIVE, response.getMandate().getStatus());
      mockServer.verify();
    }
  }

  @Nested
  @DisplayName("Request Formatting")
  class RequestFormatting {

    @Test
    @DisplayName("Should send authentication, version and client headers")
    void shouldSendStandardHeaders() {
      // given
      mockServer.expect(requestTo(BASE_URL + "/customers/CU1"))
          .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer test_token"))
          .andExpect(header("GoCardless-Version", "2015-07-06"))
          .andExpect(header("GoCardless-Client-Library", "gocardless-client-java"))
          .andExpect(header(HttpHeaders.USER_AGENT, startsWith("gocardless-client-java/")))
          .andExpect(header(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE))
          .andExpect(headerDoesNotExist("Idempotency-Key"))
          .andRespond(withSuccess(customerJson("CU1"), MediaType.APPLICATION_JSON));

      // when
      apiClient.execute(getCustomer("CU1"));

      // then
      mockServer.verify();
    }

    @Test
    @DisplayName("Should wrap the request in its envelope and omit null fields")
    void shouldSendEnvelopedJsonBody() {
      // given
      mockServer.expect(requestTo(BASE_URL + "/customers"))
          .andExpect(method(HttpMethod.POST))
          .andExpect(header(HttpHeaders.CONTENT_TYPE, startsWith("application/json")))
          .andExpect(content().json("""
              {"customers": {"given_name": "Jane", "family_name": "Doe",
                             "email": "jane@example.com"}}
              """, true))
          .andRespond(withSuccess(customerJson("CU1"), MediaType.APPLICATION_JSON));

      // when
      apiClient.execute(createCustomer(janeDoe()));

      // then
      mockServer.verify();
    }

    @Test
    @DisplayName("Should send an empty envelope for actions without a body")
    void shouldSendEmptyEnvelope_whenNoRequestObject() {
      // given
      mockServer.expect(requestTo(BASE_URL + "/mandates/MD1/actions/cancel"))
          .andExpect(content().json("{\"data\": {}}", true))
          .andRespond(withSuccess("{\"mandates\": {\"id\": \"MD1\", \"status\": \"cancelled\"}}",
              MediaType.APPLICATION_JSON));

      // when
      MandateResponse response = apiClient.execute(
          ApiRequest.builder(HttpMethod.POST, "/mandates/:identity/actions/cancel",
                  MandateResponse.class)
              .pathParam("identity", "MD1")
              .envelope("data")
              .build());

      // then
      assertEquals(MandateStatus.CANCELLED, response.getMandate().getStatus());
      mockServer.verify();
    }

    @Test
    @DisplayName("Should encode list filters as query parameters")
    void shouldEncodeQueryParameters_forGet() {
      // given
      CustomerListRequest request = new CustomerListRequest();
      request.setLimit(2);
      request.setAfter("CU2");
      mockServer.expect(requestTo(startsWith(BASE_URL + "/customers?")))
          .andExpect(method(HttpMethod.GET))
          .andExpect(queryParam("limit", "2"))
          .andExpect(queryParam("after", "CU2"))
          .andRespond(withSuccess("""
              {"customers": [], "meta": {"cursors": {"before": null, "after": null},
                                         "limit": 2}}
              """, MediaType.APPLICATION_JSON));

      // when
      CustomerListResponse response = apiClient.execute(
          ApiRequest.builder(HttpMethod.GET, "/customers", CustomerListResponse.class)
              .requestObject(request)
              .build());

      // then
      assertEquals(List.of(), response.getItems());
      assertNull(response.getNextCursor());
      assertEquals(2, response.getMeta().getLimit());
      mockServer.verify();
    }

    @Test
    @DisplayName("Should percent-encode path parameters as a single segment")
    void shouldEncodePathParameters() {
      // given
      mockServer.expect(requestTo(BASE_URL + "/customers/CU1%2F..%2Fadmin%3Fx=1"))
          .andRespond(withSuccess(customerJson("CU1"), MediaType.APPLICATION_JSON));

      // when
      apiClient.execute(getCustomer("CU1/../admin?x=1"));

      // then
      mockServer.verify();
    }

    @Test
    @DisplayName("Should apply request settings headers last")
    void shouldApplyRequestSettingsHeaders() {
      // given
      mockServer.expect(requestTo(BASE_URL + "/customers/CU1"))
          .andExpect(header("GoCardless-Version", "2099-01-01"))
          .andExpect(header("X-Trace", "abc"))
          .andRespond(withSuccess(customerJson("CU1"), MediaType.APPLICATION_JSON));

      // when
      apiClient.execute(
          ApiRequest.builder(HttpMethod.GET, "/customers/:identity", CustomerResponse.class)
              .pathParam("identity", "CU1")
              .settings(RequestSettings.builder()
                  .header("GoCardless-Version", "2099-01-01")
                  .header("X-Trace", "abc")
                  .build())
              .build());

      // then
      mockServer.verify();
    }
  }

  @Nested
  @DisplayName("Idempotency")
  class Idempotency {

    @Test
    @DisplayName("Should generate an idempotency key when none is set")
    void shouldGenerateIdempotencyKey() {
      // given
      CustomerCreateRequest request = janeDoe();
      mockServer.expect(requestTo(BASE_URL + "/customers"))
          .andExpect(header("Idempotency-Key", matchesPattern("[0-9a-f-]{36}")))
          .andRespond(withSuccess(customerJson("CU1"), MediaType.APPLICATION_JSON));

      // when
      apiClient.execute(createCustomer(request));

      // then
      assertNotNull(request.getIdempotencyKey());
      mockServer.verify();
    }

    @Test
    @DisplayName("Should keep an idempotency key chosen by the caller")
    void shouldKeepCallerIdempotencyKey() {
      // given
      CustomerCreateRequest request = janeDoe();
      request.setIdempotencyKey("signup-42");
      mockServer.expect(requestTo(BASE_URL + "/customers"))
          .andExpect(header("Idempotency-Key", "signup-42"))
          .andRespond(withSuccess(customerJson("CU1"), MediaType.APPLICATION_JSON));

      // when
      apiClient.execute(createCustomer(request));

      // then
      assertEquals("signup-42", request.getIdempotencyKey());
      mockServer.verify();
    }

    @Test
    @DisplayName("Should return the existing resource on an idempotent creation conflict")
    void shouldFetchConflictingResource() {
      // given
      mockServer.expect(requestTo(BASE_URL + "/customers"))
          .andExpect(method(HttpMethod.POST))
          .andRespond(withStatus(HttpStatus.CONFLICT)
              .contentType(MediaType.APPLICATION_JSON)
              .body(conflictJson("CU999")));
      mockServer.expect(requestTo(BASE_URL + "/customers/CU999"))
          .andExpect(method(HttpMethod.GET))
          .andRespond(withSuccess(customerJson("CU999"), MediaType.APPLICATION_JSON));

      // when
      CustomerResponse response = apiClient.execute(createCustomer(janeDoe()));

      // then
      assertEquals("CU999", response.getCustomer().getId());
      mockServer.verify();
    }

    @Test
    @DisplayName("Should raise the conflict when configured to")
    void shouldThrowConflict_whenErrorOnIdempotencyConflict() {
      // given
      properties.setErrorOnIdempotencyConflict(true);
      apiClient = new RestTemplateApiClient(restTemplate, properties,
          ObjectMapperFactory.create());
      mockServer.expect(requestTo(BASE_URL + "/customers"))
          .andRespond(withStatus(HttpStatus.CONFLICT)
              .contentType(MediaType.APPLICATION_JSON)
              .body(conflictJson("CU999")));

      // when
      InvalidStateException ex = assertThrows(InvalidStateException.class,
          () -> apiClient.execute(createCustomer(janeDoe())));

      // then
      assertEquals("CU999", ex.getConflictingResourceId().orElseThrow());
      assertEquals(409, ex.getStatusCode());
      mockServer.verify();
    }

    @Test
    @DisplayName("Should expose the idempotency key in the MDC only while the call runs")
    void shouldScopeIdempotencyKeyToCall() {
      // given
      CustomerCreateRequest request = janeDoe();
      request.setIdempotencyKey("signup-42");
      List<String> duringCall = new ArrayList<>();
      mockServer.expect(requestTo(BASE_URL + "/customers"))
          .andExpect(sent -> duringCall.add(MDC.get("idempotencyKey")))
          .andRespond(withSuccess(customerJson("CU1"), MediaType.APPLICATION_JSON));

      // when
      apiClient.execute(createCustomer(request));

      // then
      assertEquals(List.of("signup-42"), duringCall);
      assertNull(MDC.get("idempotencyKey"));
      mockServer.verify();
    }

    @Test
    @DisplayName("Should clear the idempotency key from the MDC when the call fails")
    void shouldClearMdc_whenCallThrows() {
      // given
      List<String> duringCall = new ArrayList<>();
      mockServer.expect(requestTo(BASE_URL + "/customers"))
          .andExpect(sent -> duringCall.add(MDC.get("idempotencyKey")))
          .andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY)
              .contentType(MediaType.APPLICATION_JSON)
              .body(errorJson("validation_failed", 422, "validation_failed")));

      // when
      assertThrows(ValidationFailedException.class,
          () -> apiClient.execute(createCustomer(janeDoe())));

      // then
      assertNotNull(duringCall.get(0));
      assertNull(MDC.get("idempotencyKey"));
      mockServer.verify();
    }
  }

  @Nested
  @DisplayName("Retries")
  class Retries {

    @Test
    @DisplayName("Should retry a keyed creation with the same idempotency key")
    void shouldRetryWithSameKey_whenInternalError() {
      // given
      List<String> keys = new ArrayList<>();
      mockServer.expect(requestTo(BASE_URL + "/customers"))
          .andExpect(request -> keys.add(request.getHeaders().getFirst("Idempotency-Key")))
          .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR)
              .contentType(MediaType.APPLICATION_JSON)
              .body(errorJson("gocardless", 500, "internal_server_error")));
      mockServer.expect(requestTo(BASE_URL + "/customers"))
          .andExpect(request -> keys.add(request.getHeaders().getFirst("Idempotency-Key")))
          .andRespond(withSuccess(customerJson("CU1"), MediaType.APPLICATION_JSON));

      // when
      CustomerResponse response = apiClient.execute(createCustomer(janeDoe()));

      // then
      assertEquals("CU1", response.getCustomer().getId());
      assertEquals(2, keys.size());
      assertEquals(keys.get(0), keys.get(1));
      mockServer.verify();
    }

    @Test
    @DisplayName("Should retry a GET when the API is unreachable")
    void shouldRetryGet_whenConnectionFails() {
      // given
      mockServer.expect(requestTo(BASE_URL + "/customers/CU1"))
          .andRespond(withException(new IOException("Connection reset")));
      mockServer.expect(requestTo(BASE_URL + "/customers/CU1"))
          .andRespond(withSuccess(customerJson("CU1"), MediaType.APPLICATION_JSON));

      // when
      CustomerResponse response = apiClient.execute(getCustomer("CU1"));

      // then
      assertEquals("CU1", response.getCustomer().getId());
      mockServer.verify();
    }

    @Test
    @DisplayName("Should give up after the configured number of attempts")
    void shouldThrow_whenAttemptsExhausted() {
      // given
      mockServer.expect(times(3), requestTo(BASE_URL + "/customers/CU1"))
          .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR)
              .contentType(MediaType.APPLICATION_JSON)
              .body(errorJson("gocardless", 500, "internal_server_error")));

      // when
      GoCardlessInternalException ex = assertThrows(GoCardlessInternalException.class,
          () -> apiClient.execute(getCustomer("CU1")));

      // then
      assertEquals("RQ-ERR", ex.getRequestId());
      mockServer.verify();
    }

    @Test
    @DisplayName("Should not retry an update, which has no idempotency key")
    void shouldNotRetryUnkeyedWrite() {
      // given
      mockServer.expect(once(), requestTo(BASE_URL + "/customers/CU1"))
          .andExpect(method(HttpMethod.PUT))
          .andRespond(withServerError());

      // when
      MalformedResponseException ex = assertThrows(MalformedResponseException.class,
          () -> apiClient.execute(
              ApiRequest.builder(HttpMethod.PUT, "/customers/:identity", CustomerResponse.class)
                  .pathParam("identity", "CU1")
                  .requestObject(new CustomerUpdateRequest())
                  .envelope("customers")
                  .build()));

      // then
      assertEquals(500, ex.getStatusCode());
      mockServer.verify();
    }

    @Test
    @DisplayName("Should report an unreachable API once attempts are exhausted")
    void shouldThrowConnectionException_whenAlwaysUnreachable() {
      // given
      mockServer.expect(times(3), requestTo(BASE_URL + "/customers/CU1"))
          .andRespond(withException(new IOException("Connection refused")));

      // when / then
      assertThrows(ApiConnectionException.class, () -> apiClient.execute(getCustomer("CU1")));
      mockServer.verify();
    }

    @Test
    @DisplayName("Should stop retrying and keep the interrupt flag when the wait is interrupted")
    void shouldRestoreInterruptFlag_whenRetryWaitInterrupted() {
      // given
      properties.setRetryDelay(Duration.ofSeconds(5));
      apiClient = new RestTemplateApiClient(restTemplate, properties,
          ObjectMapperFactory.create());
      mockServer.expect(once(), requestTo(BASE_URL + "/customers/CU1"))
          .andRespond(withException(new IOException("Connection reset")));
      Thread.currentThread().interrupt();

      // when
      boolean interrupted;
      try {
        assertThrows(ApiConnectionException.class,
            () -> apiClient.execute(getCustomer("CU1")));
      } finally {
        interrupted = Thread.interrupted();
      }

      // then
      assertTrue(interrupted);
      mockServer.verify();
    }
  }

  @Nested
  @DisplayName("Error Handling")
  class ErrorHandling {

    @Test
    @DisplayName("Should map validation_failed without retrying")
    void shouldThrowValidationFailed() {
      // given
      mockServer.expect(once(), requestTo(BASE_URL + "/customers"))
          .andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY)
              .contentType(MediaType.APPLICATION_JSON)
              .body("""
                  {
                    "error": {
                      "message": "Validation failed",
                      "type": "validation_failed",
                      "code": 422,
                      "request_id": "RQ-422",
                      "errors": [{"field": "email", "message": "is invalid",
                                  "request_pointer": "/customers/email"}]
                    }
                  }
                  """));

      // when
      ValidationFailedException ex = assertThrows(ValidationFailedException.class,
          () -> apiClient.execute(createCustomer(janeDoe())));

      // then
      assertEquals(422, ex.getStatusCode());
      assertEquals("email", ex.getErrors().get(0).getField());
      assertEquals("/customers/email", ex.getErrors().get(0).getRequestPointer());
      mockServer.verify();
    }

    @Test
    @DisplayName("Should report a success body that is not JSON")
    void shouldThrowMalformed_whenSuccessBodyIsNotJson() {
      // given
      mockServer.expect(requestTo(BASE_URL + "/customers/CU1"))
          .andRespond(withSuccess("<html>oops</html>", MediaType.TEXT_HTML));

      // when
      MalformedResponseException ex = assertThrows(MalformedResponseException.class,
          () -> apiClient.execute(getCustomer("CU1")));

      // then
      assertEquals(200, ex.getStatusCode());
      assertEquals("<html>oops</html>", ex.getResponseBody());
      mockServer.verify();
    }

    @Test
    @DisplayName("Should decode error bodies as UTF-8 when no charset is given")
    void shouldDecodeErrorBodyAsUtf8() {
      // given
      mockServer.expect(requestTo(BASE_URL + "/customers/CU1"))
          .andRespond(withStatus(HttpStatus.BAD_REQUEST)
              .contentType(MediaType.APPLICATION_JSON)
              .body("""
                  {"error": {"message": "Überweisung fehlgeschlagen", "type": "invalid_api_usage",
                             "code": 400, "request_id": "RQ-400", "errors": []}}
                  """));

      // when
      InvalidApiUsageException ex = assertThrows(InvalidApiUsageException.class,
          () -> apiClient.execute(getCustomer("CU1")));

      // then
      assertEquals("Überweisung fehlgeschlagen", ex.getMessage());
      mockServer.verify();
    }
  }

  @Nested
  @DisplayName("Construction")
  class Construction {

    @Test
    @DisplayName("Should reject a blank access token")
    void shouldRejectBlankAccessToken() {
      properties.setAccessToken(" ");

      assertThrows(IllegalArgumentException.class, () -> new RestTemplateApiClient(
          restTemplate, properties, ObjectMapperFactory.create()));
    }

    @Test
    @DisplayName("Should reject a request whose path parameter is missing")
    void shouldRejectMissingPathParameter() {
      assertThrows(IllegalArgumentException.class, () -> apiClient.execute(
          ApiRequest.builder(HttpMethod.GET, "/customers/:identity", CustomerResponse.class)
              .build()));
    }

    @Test
    @DisplayName("Should reject a request settings header without a value")
    void shouldRejectNullHeaderValue() {
      RequestSettings.Builder builder = RequestSettings.builder();

      assertThrows(IllegalArgumentException.class, () -> builder.header("X-Trace", null));
    }

    @Test
    @DisplayName("Should reject fewer than one attempt")
    void shouldRejectZeroAttempts() {
      properties.setMaxAttempts(0);

      assertThrows(IllegalArgumentException.class, () -> new RestTemplateApiClient(
          restTemplate, properties, ObjectMapperFactory.create()));
    }
  }
}
