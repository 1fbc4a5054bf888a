package com.gocardless.client.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gocardless.client.configuration.ObjectMapperFactory;
import com.gocardless.client.exception.InvalidSignatureException;
import com.gocardless.client.exception.MalformedResponseException;
import com.gocardless.client.resources.Event;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies and parses webhooks sent by GoCardless.
 *
 * <p>Each webhook carries a {@code Webhook-Signature} header: the lower-case hex
 * HMAC-SHA256 of the raw request body, keyed with the webhook endpoint's secret. The body
 * must be passed exactly as received; re-serialized JSON will not match.
 */
public class WebhookParser {

  public static final String SIGNATURE_HEADER = "Webhook-Signature";

  private static final Logger LOG = LoggerFactory.getLogger(WebhookParser.class);
  private static final String HMAC_ALGORITHM = "HmacSHA256";

  private final SecretKeySpec key;
  private final ObjectMapper objectMapper;

  public WebhookParser(String endpointSecret) {
    this(endpointSecret, ObjectMapperFactory.create());
  }

  public WebhookParser(String endpointSecret, ObjectMapper objectMapper) {
    if (endpointSecret == null || endpointSecret.isEmpty()) {
      throw new IllegalArgumentException("Webhook endpoint secret must not be empty");
    }
    this.key = new SecretKeySpec(endpointSecret.getBytes(StandardCharsets.UTF_8),
        HMAC_ALGORITHM);
    this.objectMapper = objectMapper;
  }

  /**
   * Checks the signature and returns the events contained in the webhook.
   *
   * @param requestBody the raw request body
   * @param signatureHeader value of the {@code Webhook-Signature} header
   * @return the events, in the order they were sent
   * @throws InvalidSignatureException if the header is missing or does not match the body
   * @throws MalformedResponseException if the body is not a webhook payload
   */
  public List<Event> parse(String requestBody, String signatureHeader) {
    if (signatureHeader == null || signatureHeader.isBlank()) {
      throw new InvalidSignatureException("Missing " + SIGNATURE_HEADER + " header");
    }
    String body = requestBody == null ? "" : requestBody;
    if (!isValidSignature(body, signatureHeader.trim())) {
      LOG.warn("event=webhook.invalid_signature bodyLength={}", body.length());
      throw new InvalidSignatureException("Webhook signature does not match the request body");
    }

    WebhookPayload payload;
    try {
      payload = objectMapper.readValue(body, WebhookPayload.class);
    } catch (JsonProcessingException e) {
      throw new MalformedResponseException("Webhook body is not valid JSON", body, e);
    }
    List<Event> events = payload == null || payload.events == null ? List.of() : payload.events;
    LOG.debug("event=webhook.parsed eventCount={}", events.size());
    return events;
  }

  /** Computes the signature GoCardless would send for the given body. */
  public String sign(String requestBody) {
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(key);
      byte[] digest = mac.doFinal(requestBody.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(digest);
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      throw new IllegalStateException("Failed to compute webhook signature", e);
    }
  }

  private boolean isValidSignature(String body, String signature) {
    byte[] expected = sign(body).getBytes(StandardCharsets.UTF_8);
    return MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.UTF_8));
  }

  static class WebhookPayload {

    @JsonProperty("events")
    List<Event> events;
  }
}
