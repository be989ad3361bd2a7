package com.evoila.influxql.compiler.model.dto;

import lombok.Getter;

/**
 * Quoting applied to values that are rendered as plain literals.
 *
 * <p>IDENTIFIER is used for measurement and tag names, LITERAL for string values on the right-hand
 * side of a condition.
 */
@Getter
public enum QuotingMode {
  IDENTIFIER('"'),
  LITERAL('\'');

  private final char quoteChar;

  QuotingMode(char quoteChar) {
    this.quoteChar = quoteChar;
  }

  public String quote(String text) {
    return quoteChar + text + quoteChar;
  }
}
