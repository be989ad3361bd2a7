package com.evoila.influxql.compiler.model.result;

import com.evoila.influxql.compiler.model.dto.Condition;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One or more conditions use an operator outside the supported set.
 *
 * @param conditions every offending condition, in request order
 */
public record InvalidComparator(List<Condition> conditions) implements CompileError {

  public InvalidComparator {
    conditions = List.copyOf(conditions);
  }

  @Override
  public String code() {
    return "INVALID_COMPARATOR";
  }

  @Override
  public List<String> details() {
    return conditions.stream().map(Condition::describe).toList();
  }

  @Override
  public String message() {
    return "Invalid comparator in condition(s): "
        + conditions.stream()
            .map(c -> "'" + c.comparator() + "' (" + c.describe() + ")")
            .collect(Collectors.joining(", "));
  }
}
