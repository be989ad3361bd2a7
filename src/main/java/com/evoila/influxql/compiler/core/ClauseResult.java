package com.evoila.influxql.compiler.core;

import com.evoila.influxql.compiler.model.result.CompileError;

/**
 * Rendered query segment or the error that prevented rendering it.
 *
 * @param text The segment including its leading space and keyword, or "" if omitted
 * @param error The error, or null if the segment rendered
 */
public record ClauseResult(String text, CompileError error) {

  private static final ClauseResult EMPTY = new ClauseResult("", null);

  public static ClauseResult of(String text) {
    return new ClauseResult(text, null);
  }

  public static ClauseResult empty() {
    return EMPTY;
  }

  public static ClauseResult failed(CompileError error) {
    return new ClauseResult("", error);
  }

  public boolean isValid() {
    return error == null;
  }
}
