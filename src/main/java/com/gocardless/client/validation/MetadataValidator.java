package com.gocardless.client.validation;

import com.gocardless.client.exception.InvalidRequestException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks the {@code metadata} of a request before it is sent.
 *
 * <p>Every violation is collected, not just the first one, so callers can fix a request in
 * one go. Rules:
 * <ul>
 *   <li>at most 3 keys</li>
 *   <li>keys: not blank, at most 50 characters</li>
 *   <li>values: not null, at most 500 characters</li>
 * </ul>
 */
public class MetadataValidator {

  static final int MAX_KEYS = 3;
  static final int MAX_KEY_LENGTH = 50;
  static final int MAX_VALUE_LENGTH = 500;

  /**
   * Validates the given metadata.
   *
   * @param metadata the metadata to check; null means "not set" and is valid
   * @return human-readable error messages; empty if the metadata is valid
   */
  public List<String> validate(Map<String, String> metadata) {
    List<String> errors = new ArrayList<>();
    if (metadata == null) {
      return errors;
    }
    if (metadata.size() > MAX_KEYS) {
      errors.add("Metadata must have at most " + MAX_KEYS + " keys");
    }
    metadata.forEach((key, value) -> {
      validateKey(key, errors);
      validateValue(key, value, errors);
    });
    return errors;
  }

  /**
   * Same as {@link #validate(Map)} but throws when anything is wrong.
   *
   * @throws InvalidRequestException carrying all errors
   */
  public void requireValid(Map<String, String> metadata) {
    List<String> errors = validate(metadata);
    if (!errors.isEmpty()) {
      throw new InvalidRequestException(errors);
    }
  }

  private void validateKey(String key, List<String> errors) {
    if (key == null || key.isBlank()) {
      errors.add("Metadata keys must not be blank");
      return;
    }
    if (key.length() > MAX_KEY_LENGTH) {
      errors.add("Metadata key '" + key + "' must be at most " + MAX_KEY_LENGTH
          + " characters");
    }
  }

  private void validateValue(String key, String value, List<String> errors) {
    if (value == null) {
      errors.add("Metadata value for '" + key + "' is required");
      return;
    }
    if (value.length() > MAX_VALUE_LENGTH) {
      errors.add("Metadata value for '" + key + "' must be at most " + MAX_VALUE_LENGTH
          + " characters");
    }
  }
}
