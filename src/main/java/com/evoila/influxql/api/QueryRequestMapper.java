package com.evoila.influxql.api;

import com.evoila.influxql.api.dto.CompileRequest;
import com.evoila.influxql.api.dto.ConditionDto;
import com.evoila.influxql.compiler.model.dto.Condition;
import com.evoila.influxql.compiler.model.dto.GroupDirective;
import com.evoila.influxql.compiler.model.dto.QueryRequest;
import com.evoila.influxql.compiler.model.dto.Value;
import com.evoila.influxql.compiler.utils.ValidationUtils;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Maps the JSON request shape onto the compiler's request model. */
@Slf4j
public final class QueryRequestMapper {

  private QueryRequestMapper() {
    // Utility class - prevent instantiation
  }

  /**
   * Converts a JSON request into a {@link QueryRequest}.
   *
   * @param request The deserialized request body
   * @return The request model
   * @throws IllegalArgumentException if a list holds null entries or a condition is malformed
   *     (missing field, non-string expression, nested object as value)
   */
  public static QueryRequest toQueryRequest(CompileRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Request body cannot be null");
    }

    ValidationUtils.validateNoNullElements(request.measurements(), "Measurements");
    ValidationUtils.validateNoNullElements(request.fields(), "Fields");
    ValidationUtils.validateNoNullElements(request.conditions(), "Condition groups");
    ValidationUtils.validateNoNullElements(request.groupBy(), "Group by directives");

    List<List<Condition>> conditions =
        request.conditions() == null
            ? List.of()
            : request.conditions().stream()
                .map(group -> group.stream().map(QueryRequestMapper::toCondition).toList())
                .toList();

    List<GroupDirective> groupBy =
        request.groupBy() == null
            ? null
            : request.groupBy().stream().map(GroupDirective::new).toList();

    QueryRequest queryRequest =
        QueryRequest.builder()
            .measurements(request.measurements())
            .fields(request.fields())
            .conditions(conditions)
            .from(request.from())
            .to(request.to())
            .groupBy(groupBy)
            .build();
    log.debug("QueryRequestMapper: Mapped request {}", queryRequest);
    return queryRequest;
  }

  private static Condition toCondition(ConditionDto dto) {
    if (dto == null) {
      throw new IllegalArgumentException("Condition cannot be null");
    }
    if (dto.isExpression()) {
      if (!(dto.value() instanceof String expression)) {
        throw new IllegalArgumentException(
            "Expression value of field '" + dto.field() + "' must be a string");
      }
      return new Condition(dto.field(), Value.expression(expression), dto.comparator());
    }
    return new Condition(dto.field(), Value.literal(dto.value()), dto.comparator());
  }
}
