package com.evoila.influxql.compiler.model.dto;

import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;

/** Comparison operators accepted in a WHERE condition. */
@Getter
public enum Comparator {
  EQUAL("="),
  LESS_THAN("<"),
  LESS_THAN_OR_EQUAL("<="),
  GREATER_THAN(">"),
  GREATER_THAN_OR_EQUAL(">="),
  REGEX_MATCH("=~"),
  REGEX_NOT_MATCH("!~");

  /** -- GETTER -- The operator as written in the query */
  private final String symbol;

  Comparator(String symbol) {
    this.symbol = symbol;
  }

  /**
   * Looks up a comparator by its query symbol.
   *
   * @param symbol the operator text, e.g. "=~"
   * @return the comparator, or empty if the symbol is not a supported operator
   */
  public static Optional<Comparator> fromSymbol(String symbol) {
    if (symbol == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(c -> c.symbol.equals(symbol)).findFirst();
  }

  @Override
  public String toString() {
    return symbol;
  }
}
