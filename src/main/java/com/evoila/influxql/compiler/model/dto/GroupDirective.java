package com.evoila.influxql.compiler.model.dto;

import com.evoila.influxql.compiler.utils.ValidationUtils;
import java.util.Optional;

/**
 * One entry of a GROUP BY list.
 *
 * <p>The kind is derived from the directive text: {@code time(...)} is a time bucket, {@code
 * fill(...)} a fill directive, {@code *} the wildcard and anything else a tag name.
 *
 * @param text The directive as written by the caller
 */
public record GroupDirective(String text) {

  public static final String WILDCARD_TEXT = "*";
  private static final String TIME_PREFIX = "time(";
  private static final String FILL_PREFIX = "fill(";

  public GroupDirective {
    ValidationUtils.validateNotNullOrEmpty(text, "Group by directive");
  }

  public static GroupDirective tag(String name) {
    return new GroupDirective(name);
  }

  public static GroupDirective timeBucket(String interval) {
    return new GroupDirective(TIME_PREFIX + interval + ")");
  }

  public static GroupDirective fill(String option) {
    return new GroupDirective(FILL_PREFIX + option + ")");
  }

  public static GroupDirective wildcard() {
    return new GroupDirective(WILDCARD_TEXT);
  }

  public Kind kind() {
    if (text.startsWith(TIME_PREFIX)) {
      return Kind.TIME_BUCKET;
    }
    if (text.startsWith(FILL_PREFIX)) {
      return Kind.FILL;
    }
    if (WILDCARD_TEXT.equals(text)) {
      return Kind.WILDCARD;
    }
    return Kind.TAG;
  }

  /**
   * Text between "fill(" and the closing parenthesis.
   *
   * @return the option, or empty if this is not a fill directive or the parenthesis is not closed
   *     exactly once at the end
   */
  public Optional<String> fillOption() {
    if (kind() != Kind.FILL || !text.endsWith(")")) {
      return Optional.empty();
    }
    String option = text.substring(FILL_PREFIX.length(), text.length() - 1);
    return option.contains(")") ? Optional.empty() : Optional.of(option);
  }

  /** Directive kinds recognized in a GROUP BY list. */
  public enum Kind {
    TAG,
    TIME_BUCKET,
    FILL,
    WILDCARD
  }
}
