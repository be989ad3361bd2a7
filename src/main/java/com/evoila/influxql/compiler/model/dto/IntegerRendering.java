package com.evoila.influxql.compiler.model.dto;

/** How integral literal values are written into a query. */
public enum IntegerRendering {
  /** Digits followed by the integer type marker, e.g. {@code 42i}. */
  INTEGER_SUFFIX,
  /** Digits only, read by the database as a float, e.g. {@code 42}. */
  PLAIN
}
