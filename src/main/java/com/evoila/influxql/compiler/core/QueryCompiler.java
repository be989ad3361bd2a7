package com.evoila.influxql.compiler.core;

import com.evoila.influxql.compiler.model.dto.Condition;
import com.evoila.influxql.compiler.model.dto.IntegerRendering;
import com.evoila.influxql.compiler.model.dto.QueryRequest;
import com.evoila.influxql.compiler.model.dto.QuotingMode;
import com.evoila.influxql.compiler.model.result.CompileResult;
import com.evoila.influxql.compiler.model.result.MeasurementsRequired;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Compiles a {@link QueryRequest} into an InfluxQL SELECT statement.
 *
 * <p>The compiled statement has the form {@code SELECT <fields> FROM <measurements>[ WHERE
 * ...][ GROUP BY ...]}. Fields are written verbatim so they may hold function expressions such as
 * {@code max(value) - 20}; measurements are quoted as identifiers.
 *
 * <p>Compilation is a pure function of the request and the configured {@link IntegerRendering};
 * instances hold no mutable state and can be shared between threads.
 */
@Slf4j
public class QueryCompiler {

  private static final String SELECT_ALL = "*";
  private static final String STATEMENT_SEPARATOR = ";";

  private final ValueClassifier valueClassifier;
  private final ClauseAssembler clauseAssembler;

  public QueryCompiler(IntegerRendering integerRendering) {
    this.valueClassifier = new ValueClassifier(integerRendering);
    this.clauseAssembler =
        new ClauseAssembler(new ConditionRenderer(valueClassifier), valueClassifier);
  }

  public QueryCompiler() {
    this(IntegerRendering.INTEGER_SUFFIX);
  }

  /**
   * Compiles a request.
   *
   * @param request The structured query
   * @return The compiled statement, or the first failing validation: missing measurements,
   *     invalid comparators, or invalid GROUP BY directives
   */
  public CompileResult compile(QueryRequest request) {
    if (request == null || request.getMeasurements().isEmpty()) {
      log.warn("QueryCompiler: Rejecting request without measurements");
      return CompileResult.failure(new MeasurementsRequired());
    }

    List<List<Condition>> groups = clauseAssembler.desugarTimeBounds(request);

    String measurements = buildMeasurements(request.getMeasurements());
    String fields = buildFields(request);

    ClauseResult where = clauseAssembler.renderWhere(groups);
    if (!where.isValid()) {
      return CompileResult.failure(where.error());
    }

    ClauseResult groupBy = clauseAssembler.renderGroupBy(request.getGroupBy(), groups);
    if (!groupBy.isValid()) {
      return CompileResult.failure(groupBy.error());
    }

    String query = "SELECT " + fields + " FROM " + measurements + where.text() + groupBy.text();
    log.debug("QueryCompiler: Compiled query '{}'", query);
    return CompileResult.success(query);
  }

  /**
   * Stacks compiled statements into one multi-statement request, preserving their order.
   *
   * @param queries Compiled statements
   * @return The statements joined with ";"
   */
  public static String stackQueries(List<String> queries) {
    return String.join(STATEMENT_SEPARATOR, queries);
  }

  private String buildMeasurements(List<String> measurements) {
    return measurements.stream()
        .map(m -> valueClassifier.render(m, QuotingMode.IDENTIFIER))
        .collect(Collectors.joining(","));
  }

  private static String buildFields(QueryRequest request) {
    return request.hasFields() ? String.join(",", request.getFields()) : SELECT_ALL;
  }
}
