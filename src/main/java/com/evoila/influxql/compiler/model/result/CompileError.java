package com.evoila.influxql.compiler.model.result;

import java.util.List;

/**
 * Reason a query request could not be compiled.
 *
 * <p>Every variant carries a stable error code for API consumers and a message describing all
 * offending entries of the request, not only the first one.
 */
public sealed interface CompileError
    permits MeasurementsRequired, InvalidComparator, InvalidGroupByDirective {

  String code();

  String message();

  /** One line per offending request entry. */
  default List<String> details() {
    return List.of();
  }
}
