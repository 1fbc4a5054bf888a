package com.gocardless.client.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriUtils;

/**
 * Turns a path template, its parameters and an optional request object into the URI of
 * an API call.
 */
class UriBuilder {

  private static final Pattern PATH_PARAM = Pattern.compile(":([a-z_]+)");
  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
      new TypeReference<>() {
      };

  private final String baseUrl;
  private final ObjectMapper objectMapper;

  UriBuilder(String baseUrl, ObjectMapper objectMapper) {
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.objectMapper = objectMapper;
  }

  URI build(String pathTemplate, Map<String, String> pathParams, Object queryObject) {
    StringBuilder uri = new StringBuilder(baseUrl).append(expandPath(pathTemplate, pathParams));
    MultiValueMap<String, String> query = toQueryParams(queryObject);
    if (!query.isEmpty()) {
      String encoded = query.entrySet().stream()
          .flatMap(entry -> entry.getValue().stream()
              .map(value -> encodeQueryParam(entry.getKey()) + "=" + encodeQueryParam(value)))
          .collect(Collectors.joining("&"));
      uri.append('?').append(encoded);
    }
    return URI.create(uri.toString());
  }

  /**
   * Replaces each {@code :name} segment by its parameter. Values are encoded as a single
   * path segment, so a {@code /} or {@code ?} in an id cannot change the target.
   */
  String expandPath(String pathTemplate, Map<String, String> pathParams) {
    Matcher matcher = PATH_PARAM.matcher(pathTemplate);
    StringBuilder path = new StringBuilder();
    while (matcher.find()) {
      String name = matcher.group(1);
      String value = pathParams.get(name);
      if (value == null) {
        throw new IllegalArgumentException("Missing path parameter '" + name + "' for "
            + pathTemplate);
      }
      matcher.appendReplacement(path, Matcher.quoteReplacement(
          UriUtils.encodePathSegment(value, StandardCharsets.UTF_8)));
    }
    matcher.appendTail(path);
    return path.toString();
  }

  // '+' is legal in a query but read as a space by most servers.
  private static String encodeQueryParam(String raw) {
    return UriUtils.encodeQueryParam(raw, StandardCharsets.UTF_8).replace("+", "%2B");
  }

  /**
   * Flattens a request object into query parameters. Null fields are skipped, nested
   * objects become {@code parent[child]} and lists are comma-joined.
   */
  MultiValueMap<String, String> toQueryParams(Object queryObject) {
    MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
    if (queryObject == null) {
      return params;
    }
    Map<String, Object> fields = objectMapper.convertValue(queryObject, MAP_TYPE);
    fields.forEach((name, value) -> flatten(name, value, params));
    return params;
  }

  private void flatten(String name, Object value, MultiValueMap<String, String> params) {
    if (value == null) {
      return;
    }
    if (value instanceof Map) {
      ((Map<?, ?>) value).forEach(
          (key, nested) -> flatten(name + "[" + key + "]", nested, params));
    } else if (value instanceof Collection) {
      Collection<?> values = (Collection<?>) value;
      if (!values.isEmpty()) {
        params.add(name, values.stream().map(String::valueOf).collect(Collectors.joining(",")));
      }
    } else {
      params.add(name, String.valueOf(value));
    }
  }
}
