package com.evoila.influxql.compiler.core;

import com.evoila.influxql.compiler.model.dto.IntegerRendering;
import com.evoila.influxql.compiler.model.dto.Literal;
import com.evoila.influxql.compiler.model.dto.QuotingMode;
import com.evoila.influxql.compiler.model.dto.RawExpression;
import com.evoila.influxql.compiler.model.dto.Value;
import com.evoila.influxql.compiler.utils.ValuePatternUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Classifies a value and renders it into query text.
 *
 * <p>Classification precedence:
 *
 * <ol>
 *   <li>raw expressions are emitted verbatim
 *   <li>strings shaped like a duration ({@code 20m}) are emitted verbatim
 *   <li>strings containing a regex literal ({@code /^web/}) are emitted verbatim
 *   <li>other strings are wrapped in the quote character of the {@link QuotingMode}
 * </ol>
 *
 * <p>Non-string literals are never quoted: integers get the {@code i} type marker unless {@link
 * IntegerRendering#PLAIN} is configured, decimals and booleans use their natural text and null
 * renders as {@code 0}. Rendering never fails.
 */
@Slf4j
@Getter
public final class ValueClassifier {

  private static final String INTEGER_MARKER = "i";
  private static final String NULL_VALUE = "0";

  private final IntegerRendering integerRendering;

  public ValueClassifier(IntegerRendering integerRendering) {
    this.integerRendering =
        integerRendering != null ? integerRendering : IntegerRendering.INTEGER_SUFFIX;
  }

  public ValueClassifier() {
    this(IntegerRendering.INTEGER_SUFFIX);
  }

  /**
   * Renders a value for the given quoting mode.
   *
   * @param value The value to render
   * @param quotingMode Quoting applied if the value ends up as a plain string literal
   * @return The query text for the value
   */
  public String render(Value value, QuotingMode quotingMode) {
    if (value instanceof RawExpression raw) {
      return raw.expression();
    }
    return renderLiteral((Literal) value, quotingMode);
  }

  /** Renders a bare name (measurement, tag) with the same shape rules as a string literal. */
  public String render(String text, QuotingMode quotingMode) {
    return renderText(text, quotingMode);
  }

  private String renderLiteral(Literal literal, QuotingMode quotingMode) {
    if (literal.isNull()) {
      return NULL_VALUE;
    }
    if (literal.isInteger()) {
      return integerRendering == IntegerRendering.INTEGER_SUFFIX
          ? literal.text() + INTEGER_MARKER
          : literal.text();
    }
    if (literal.isDecimal() || literal.isBoolean()) {
      return literal.text();
    }
    return renderText(literal.text(), quotingMode);
  }

  private String renderText(String text, QuotingMode quotingMode) {
    if (ValuePatternUtils.isDuration(text)) {
      log.trace("ValueClassifier: '{}' recognized as duration", text);
      return text;
    }
    if (ValuePatternUtils.isRegexLiteral(text)) {
      log.trace("ValueClassifier: '{}' recognized as regex literal", text);
      return text;
    }
    return quotingMode.quote(text);
  }
}
