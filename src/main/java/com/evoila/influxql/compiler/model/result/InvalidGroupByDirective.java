package com.evoila.influxql.compiler.model.result;

import java.util.List;

/**
 * One or more GROUP BY directives were rejected.
 *
 * @param violations every rejected directive with the reason, in request order
 */
public record InvalidGroupByDirective(List<DirectiveViolation> violations)
    implements CompileError {

  public InvalidGroupByDirective {
    violations = List.copyOf(violations);
  }

  @Override
  public String code() {
    return "INVALID_GROUP_BY";
  }

  @Override
  public List<String> details() {
    return violations.stream().map(v -> v.directive() + ": " + v.reason()).toList();
  }

  @Override
  public String message() {
    return "Invalid GROUP BY directive(s): " + String.join("; ", details());
  }
}
