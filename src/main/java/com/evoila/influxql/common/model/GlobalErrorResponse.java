package com.evoila.influxql.common.model;

import java.util.List;

/**
 * Error response for global exception handling with detailed context.
 *
 * @param details one entry per offending condition or GROUP BY directive; empty for errors that
 *     are not tied to individual request entries
 */
public record GlobalErrorResponse(
    String error,
    String message,
    int status,
    String errorCode,
    List<String> details,
    String timestamp,
    String path) {

  public GlobalErrorResponse {
    details = details == null ? List.of() : List.copyOf(details);
  }
}
