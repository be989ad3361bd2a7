package com.evoila.influxql.compiler.exception;

import com.evoila.influxql.compiler.model.result.CompileError;
import lombok.Getter;

/** Thrown when a caller requires a compiled query but the request was rejected. */
@Getter
public class QueryCompilationException extends RuntimeException {

  private final transient CompileError error;

  public QueryCompilationException(CompileError error) {
    super(error.message());
    this.error = error;
  }

  public QueryCompilationException(String context, CompileError error) {
    super(context + ": " + error.message());
    this.error = error;
  }
}
