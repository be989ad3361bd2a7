package com.evoila.influxql.compiler.utils;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pure utility class for recognizing the textual shapes that InfluxQL treats specially: duration
 * literals, regex literals and numeric fill options.
 */
public final class ValuePatternUtils {

  private ValuePatternUtils() {
    // Utility class - prevent instantiation
  }

  // ============================================================================
  // CONSTANTS
  // ============================================================================

  // Micro sign (U+00B5) is accepted alongside "u" for microseconds
  public static final String MICRO_SIGN = "µ";

  public static final List<String> DURATION_UNITS =
      List.of("u", MICRO_SIGN, "ms", "s", "m", "h", "d", "w");

  public static final Set<String> FILL_KEYWORDS = Set.of("linear", "none", "null", "previous");

  public static final String FILL_OPTIONS_DESCRIPTION =
      "any numerical value, `null`, `none`, `previous`, `linear`";

  private static final Pattern DURATION_PATTERN =
      Pattern.compile("[+-]?\\d+(?:" + String.join("|", DURATION_UNITS) + ")");

  // Two slashes anywhere in the value, e.g. /cpu.*/
  private static final Pattern REGEX_LITERAL_PATTERN = Pattern.compile("/.*/");

  private static final Pattern NUMBER_PATTERN =
      Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

  // ============================================================================
  // PURE UTILITY METHODS
  // ============================================================================

  /** Checks if a value is an integer immediately followed by a duration unit, e.g. "20ms" */
  public static boolean isDuration(String value) {
    return value != null && DURATION_PATTERN.matcher(value).matches();
  }

  /** Checks if a value contains a slash-delimited regex literal */
  public static boolean isRegexLiteral(String value) {
    return value != null && REGEX_LITERAL_PATTERN.matcher(value).find();
  }

  /**
   * Checks if a value is an integer or decimal number, optionally with an exponent. A missing
   * integer or fraction part is allowed, e.g. "5." and ".5"
   */
  public static boolean isNumber(String value) {
    return value != null && NUMBER_PATTERN.matcher(value).matches();
  }

  /** Checks if a fill option is one of the fill keywords or a number */
  public static boolean isValidFillOption(String option) {
    return FILL_KEYWORDS.contains(option) || isNumber(option);
  }
}
