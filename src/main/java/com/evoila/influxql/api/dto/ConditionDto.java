package com.evoila.influxql.api.dto;

/**
 * JSON form of a condition.
 *
 * @param field Field or tag name
 * @param comparator Operator symbol
 * @param value String, number, boolean or null
 * @param expression If true, {@code value} is a raw expression written without quoting
 */
public record ConditionDto(String field, String comparator, Object value, Boolean expression) {

  public boolean isExpression() {
    return Boolean.TRUE.equals(expression);
  }
}
