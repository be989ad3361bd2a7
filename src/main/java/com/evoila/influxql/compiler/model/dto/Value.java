package com.evoila.influxql.compiler.model.dto;

/**
 * Right-hand side of a condition.
 *
 * <p>A value is either a {@link Literal}, which is classified and quoted when rendered, or a {@link
 * RawExpression}, which is emitted verbatim. Durations and regex patterns are not separate variants:
 * they are recognized from the textual shape of a string literal at render time.
 */
public sealed interface Value permits Literal, RawExpression {

  /** Creates a raw expression value that is rendered without escaping (e.g. "now() - 2h"). */
  static Value expression(String expression) {
    return new RawExpression(expression);
  }

  /** Creates a literal value from a string, number, boolean or null. */
  static Value literal(Object raw) {
    return new Literal(raw);
  }
}
