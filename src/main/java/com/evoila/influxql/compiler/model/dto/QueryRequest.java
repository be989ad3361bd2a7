package com.evoila.influxql.compiler.model.dto;

import com.evoila.influxql.compiler.utils.ValidationUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Structured description of a SELECT query.
 *
 * <p>Conditions are a list of groups: conditions inside a group are combined with AND, groups are
 * combined with OR. {@code from} and {@code to} are raw time-bound expressions that are turned into
 * {@code time > from} and {@code time < to} conditions before compilation.
 *
 * <p>Instances are immutable; all lists are copied on construction and must not hold null
 * entries. {@code fields} and {@code
 * groupBy} stay {@code null} when absent.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class QueryRequest {

  private final List<String> measurements;
  private final List<String> fields;
  private final List<List<Condition>> conditions;
  private final String from;
  private final String to;
  private final List<GroupDirective> groupBy;

  @Builder(toBuilder = true)
  private QueryRequest(
      List<String> measurements,
      List<String> fields,
      List<List<Condition>> conditions,
      String from,
      String to,
      List<GroupDirective> groupBy) {
    ValidationUtils.validateNoNullElements(measurements, "Measurements");
    ValidationUtils.validateNoNullElements(fields, "Fields");
    ValidationUtils.validateNoNullElements(conditions, "Condition groups");
    if (conditions != null) {
      conditions.forEach(group -> ValidationUtils.validateNoNullElements(group, "Condition group"));
    }
    ValidationUtils.validateNoNullElements(groupBy, "Group by directives");

    this.measurements = measurements == null ? List.of() : List.copyOf(measurements);
    this.fields = fields == null ? null : List.copyOf(fields);
    this.conditions =
        conditions == null ? List.of() : conditions.stream().map(List::copyOf).toList();
    this.from = from;
    this.to = to;
    this.groupBy = groupBy == null ? null : List.copyOf(groupBy);
  }

  public boolean hasFields() {
    return fields != null && !fields.isEmpty();
  }

  /** Builder additions for assembling requests condition group by condition group. */
  public static class QueryRequestBuilder {

    /** Appends one AND-group of conditions. */
    public QueryRequestBuilder andGroup(Condition... groupConditions) {
      List<List<Condition>> groups =
          this.conditions == null ? new ArrayList<>() : new ArrayList<>(this.conditions);
      groups.add(Arrays.asList(groupConditions));
      this.conditions = groups;
      return this;
    }

    /** Sets the GROUP BY list from directive texts, e.g. "time(5m)", "host", "fill(none)". */
    public QueryRequestBuilder groupByDirectives(String... directives) {
      this.groupBy = Arrays.stream(directives).map(GroupDirective::new).toList();
      return this;
    }
  }
}
