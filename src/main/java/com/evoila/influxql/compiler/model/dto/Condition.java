package com.evoila.influxql.compiler.model.dto;

import com.evoila.influxql.compiler.utils.ValidationUtils;

/**
 * A single filter condition of the form {@code field comparator value}.
 *
 * <p>The comparator is kept as the caller supplied it so that unsupported operators can be reported
 * back verbatim; {@link Comparator#fromSymbol(String)} decides whether it is valid.
 *
 * @param field The field or tag name; {@code time} marks a time-bound condition
 * @param value The value compared against
 * @param comparator The operator symbol (e.g. "=", "=~")
 */
public record Condition(String field, Value value, String comparator) {

  public static final String TIME_FIELD = "time";

  public Condition {
    ValidationUtils.validateNotNullOrEmpty(field, "Condition field");
    if (value == null) {
      throw new IllegalArgumentException("Condition value cannot be null");
    }
  }

  public Condition(String field, Value value, Comparator comparator) {
    this(field, value, comparator.getSymbol());
  }

  /** Shorthand for a literal condition. */
  public static Condition of(String field, Object literal, String comparator) {
    return new Condition(field, Value.literal(literal), comparator);
  }

  /** Shorthand for a condition whose value is a raw expression. */
  public static Condition expression(String field, String expression, String comparator) {
    return new Condition(field, Value.expression(expression), comparator);
  }

  public boolean isTimeCondition() {
    return TIME_FIELD.equals(field);
  }

  /** Human-readable form used in error reports. */
  public String describe() {
    String valueText;
    if (value instanceof RawExpression raw) {
      valueText = raw.expression();
    } else {
      Literal literal = (Literal) value;
      valueText = literal.isNull() ? "null" : literal.text();
    }
    return field + " " + comparator + " " + valueText;
  }
}
