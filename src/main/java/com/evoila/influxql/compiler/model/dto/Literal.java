package com.evoila.influxql.compiler.model.dto;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Literal condition value.
 *
 * @param raw a {@link String}, {@link Number}, {@link Boolean} or {@code null}
 */
public record Literal(Object raw) implements Value {

  public Literal {
    if (raw != null
        && !(raw instanceof String)
        && !(raw instanceof Number)
        && !(raw instanceof Boolean)) {
      throw new IllegalArgumentException(
          "Unsupported literal type: " + raw.getClass().getSimpleName());
    }
  }

  public boolean isNull() {
    return raw == null;
  }

  public boolean isString() {
    return raw instanceof String;
  }

  public boolean isBoolean() {
    return raw instanceof Boolean;
  }

  /** True for integral numbers (Byte, Short, Integer, Long, BigInteger). */
  public boolean isInteger() {
    return raw instanceof Byte
        || raw instanceof Short
        || raw instanceof Integer
        || raw instanceof Long
        || raw instanceof BigInteger;
  }

  /** True for non-integral numbers (Float, Double, BigDecimal and other Number types). */
  public boolean isDecimal() {
    return raw instanceof Number && !isInteger();
  }

  /** Natural textual form of the value. Null renders as an empty string here. */
  public String text() {
    if (raw == null) {
      return "";
    }
    if (raw instanceof BigDecimal decimal) {
      return decimal.toPlainString();
    }
    return String.valueOf(raw);
  }
}
