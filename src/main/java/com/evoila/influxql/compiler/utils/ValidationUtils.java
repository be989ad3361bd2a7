package com.evoila.influxql.compiler.utils;

import java.util.Collection;
import java.util.Objects;

/**
 * Utility class for argument validation shared by the model types and statement builders. Only
 * syntactic checks are made here; names are never checked against a database schema.
 */
public final class ValidationUtils {

  private ValidationUtils() {
    // Utility class - prevent instantiation
  }

  /**
   * Validates that a string is not null or empty (after trimming)
   *
   * @param value the string to validate
   * @param fieldName the name of the field for error messages
   * @throws IllegalArgumentException if the string is null or empty
   */
  public static void validateNotNullOrEmpty(String value, String fieldName) {
    if (value == null) {
      throw new IllegalArgumentException(fieldName + " cannot be null");
    }
    if (value.trim().isEmpty()) {
      throw new IllegalArgumentException(fieldName + " cannot be empty");
    }
  }

  /**
   * Validates that an optional collection holds no null entries
   *
   * @param values the collection to validate; {@code null} is accepted as absent
   * @param fieldName the name of the field for error messages
   * @throws IllegalArgumentException if any entry is null
   */
  public static void validateNoNullElements(Collection<?> values, String fieldName) {
    if (values != null && values.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException(fieldName + " cannot contain null entries");
    }
  }

  /**
   * Validates that an identifier can be written between double quotes
   *
   * @param identifier the database, measurement or tag name to validate
   * @param fieldName the name of the field for error messages
   * @throws IllegalArgumentException if the identifier is blank or contains quotes or line breaks
   */
  public static void validateIdentifier(String identifier, String fieldName) {
    validateNotNullOrEmpty(identifier, fieldName);

    if (identifier.contains("\"")
        || identifier.contains("'")
        || identifier.contains("\n")
        || identifier.contains("\r")) {
      throw new IllegalArgumentException(
          fieldName + " contains invalid characters: " + identifier);
    }
  }
}
