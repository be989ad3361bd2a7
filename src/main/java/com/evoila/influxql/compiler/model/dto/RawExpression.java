package com.evoila.influxql.compiler.model.dto;

import com.evoila.influxql.compiler.utils.ValidationUtils;

/**
 * Expression emitted verbatim into the query, never quoted or escaped.
 *
 * @param expression the expression text (e.g. "now() - 2w")
 */
public record RawExpression(String expression) implements Value {

  public RawExpression {
    ValidationUtils.validateNotNullOrEmpty(expression, "Expression");
  }
}
