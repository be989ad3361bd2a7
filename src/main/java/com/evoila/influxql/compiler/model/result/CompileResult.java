package com.evoila.influxql.compiler.model.result;

import com.evoila.influxql.compiler.exception.QueryCompilationException;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of compiling a query request.
 *
 * <p>A successful result carries the complete query string; a failed one carries the {@link
 * CompileError} and never a partially assembled query.
 */
@Getter
@Builder(access = AccessLevel.PRIVATE)
public class CompileResult {
  private static final String DEFAULT_QUERY = "";

  /**
   * -- GETTER -- Gets the compiled query.
   *
   * @return The query string, or empty string if compilation failed
   */
  private final String query;

  /**
   * -- GETTER -- Gets the reason compilation failed.
   *
   * @return The error, or null if compilation succeeded
   */
  private final CompileError error;

  private final boolean success;

  public static CompileResult success(String query) {
    return CompileResult.builder().query(query).success(true).build();
  }

  public static CompileResult failure(CompileError error) {
    if (error == null) {
      throw new IllegalArgumentException("Compile error cannot be null");
    }
    return CompileResult.builder().query(DEFAULT_QUERY).error(error).success(false).build();
  }

  /**
   * Returns the compiled query or throws if compilation failed.
   *
   * @throws QueryCompilationException carrying the error of a failed result
   */
  public String orElseThrow() {
    if (!success) {
      throw new QueryCompilationException(error);
    }
    return query;
  }
}
