package com.gocardless.client.validation;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gocardless.client.exception.InvalidRequestException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MetadataValidator")
class MetadataValidatorTest {

  private final MetadataValidator validator = new MetadataValidator();

  @Nested
  @DisplayName("Key Count")
  class KeyCount {

    @Test
    @DisplayName("Should accept missing metadata")
    void shouldAccept_whenNull() {
      assertTrue(validator.validate(null).isEmpty());
    }

    @Test
    @DisplayName("Should accept three keys (maximum)")
    void shouldAccept_whenThreeKeys() {
      // given
      Map<String, String> metadata = Map.of("a", "1", "b", "2", "c", "3");

      // when
      List<String> errors = validator.validate(metadata);

      // then
      assertTrue(errors.isEmpty());
    }

    @Test
    @DisplayName("Should reject four keys")
    void shouldReject_whenFourKeys() {
      // given
      Map<String, String> metadata = Map.of("a", "1", "b", "2", "c", "3", "d", "4");

      // when
      List<String> errors = validator.validate(metadata);

      // then
      assertEquals(List.of("Metadata must have at most 3 keys"), errors);
    }
  }

  @Nested
  @DisplayName("Keys")
  class Keys {

    @Test
    @DisplayName("Should accept a 50-character key (maximum length)")
    void shouldAccept_whenKeyIs50Characters() {
      String key = "k".repeat(MetadataValidator.MAX_KEY_LENGTH);

      assertTrue(validator.validate(Map.of(key, "v")).isEmpty());
    }

    @Test
    @DisplayName("Should reject a 51-character key")
    void shouldReject_whenKeyIs51Characters() {
      // given
      String key = "k".repeat(51);

      // when
      List<String> errors = validator.validate(Map.of(key, "v"));

      // then
      assertEquals(List.of("Metadata key '" + key + "' must be at most 50 characters"), errors);
    }

    @Test
    @DisplayName("Should reject a blank key")
    void shouldReject_whenKeyIsBlank() {
      List<String> errors = validator.validate(Map.of("  ", "v"));

      assertEquals(List.of("Metadata keys must not be blank"), errors);
    }
  }

  @Nested
  @DisplayName("Values")
  class Values {

    @Test
    @DisplayName("Should accept a 500-character value (maximum length)")
    void shouldAccept_whenValueIs500Characters() {
      String value = "v".repeat(MetadataValidator.MAX_VALUE_LENGTH);

      assertTrue(validator.validate(Map.of("notes", value)).isEmpty());
    }

    @Test
    @DisplayName("Should reject a 501-character value")
    void shouldReject_whenValueIs501Characters() {
      List<String> errors = validator.validate(Map.of("notes", "v".repeat(501)));

      assertEquals(List.of("Metadata value for 'notes' must be at most 500 characters"),
          errors);
    }

    @Test
    @DisplayName("Should reject a null value")
    void shouldReject_whenValueIsNull() {
      // given
      Map<String, String> metadata = new HashMap<>();
      metadata.put("notes", null);

      // when
      List<String> errors = validator.validate(metadata);

      // then
      assertEquals(List.of("Metadata value for 'notes' is required"), errors);
    }

    @Test
    @DisplayName("Should accept an empty value")
    void shouldAccept_whenValueIsEmpty() {
      assertTrue(validator.validate(Map.of("notes", "")).isEmpty());
    }
  }

  @Nested
  @DisplayName("Multiple Errors")
  class MultipleErrors {

    @Test
    @DisplayName("Should report every violation at once")
    void shouldCollectAllErrors() {
      // given
      Map<String, String> metadata = new LinkedHashMap<>();
      metadata.put("a", "1");
      metadata.put("", "2");
      metadata.put("c", "v".repeat(501));
      metadata.put("d", null);

      // when
      List<String> errors = validator.validate(metadata);

      // then
      assertEquals(4, errors.size());
      assertEquals("Metadata must have at most 3 keys", errors.get(0));
    }

    @Test
    @DisplayName("Should throw with all errors when required to be valid")
    void shouldThrow_whenInvalid() {
      // given
      Map<String, String> metadata = new HashMap<>();
      metadata.put("", null);

      // when
      InvalidRequestException ex = assertThrows(InvalidRequestException.class,
          () -> validator.requireValid(metadata));

      // then
      assertEquals(2, ex.getErrors().size());
      assertTrue(ex.getMessage().startsWith("Invalid request"));
    }

    @Test
    @DisplayName("Should not throw for valid metadata")
    void shouldNotThrow_whenValid() {
      assertDoesNotThrow(() -> validator.requireValid(Map.of("crm_id", "42")));
    }
  }
}
