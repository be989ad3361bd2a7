package com.evoila.influxql.compiler.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

import com.evoila.influxql.base.BaseUnitTest;
import com.evoila.influxql.compiler.exception.QueryCompilationException;
import com.evoila.influxql.compiler.model.dto.Condition;
import com.evoila.influxql.compiler.model.dto.IntegerRendering;
import com.evoila.influxql.compiler.model.dto.QueryRequest;
import com.evoila.influxql.compiler.model.result.CompileError;
import com.evoila.influxql.compiler.model.result.CompileResult;
import com.evoila.influxql.compiler.model.result.InvalidComparator;
import com.evoila.influxql.compiler.model.result.InvalidGroupByDirective;
import com.evoila.influxql.compiler.model.result.MeasurementsRequired;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("QueryCompiler Tests")
class QueryCompilerTest extends BaseUnitTest {

  private static QueryRequest.QueryRequestBuilder measurement(String... measurements) {
    return QueryRequest.builder().measurements(List.of(measurements));
  }

  // ========================================================================
  // Measurements / SELECT / FROM
  // ========================================================================

  @Nested
  @DisplayName("SELECT and FROM")
  class SelectAndFrom {

    @Test
    @DisplayName("Should reject requests without measurements")
    void measurementsRequired() {
      assertInstanceOf(
          MeasurementsRequired.class, compileError(QueryRequest.builder().build()));
      assertInstanceOf(
          MeasurementsRequired.class,
          compileError(QueryRequest.builder().measurements(List.of()).build()));
    }

    @Test
    @DisplayName("Should check measurements before anything else")
    void measurementsCheckedFirst() {
      QueryRequest request =
          QueryRequest.builder()
              .andGroup(Condition.of("a", "b", "!="))
              .groupByDirectives("time(1h)")
              .build();

      assertInstanceOf(MeasurementsRequired.class, compileError(request));
    }

    @Test
    @DisplayName("Should reject a null request")
    void nullRequest() {
      CompileResult result = compiler.compile(null);

      assertFalse(result.isSuccess());
      assertEquals("MEASUREMENTS_REQUIRED", result.getError().code());
    }

    @Test
    @DisplayName("Should select all fields when none are given")
    void selectAll() {
      assertEquals("SELECT * FROM \"m\"", compileOk(measurement("m").build()));
    }

    @Test
    @DisplayName("Should treat an empty field list like an absent one")
    void emptyFields() {
      assertThat(compileOk(measurement("m").fields(List.of()).build())).startsWith("SELECT * ");
    }

    @Test
    @DisplayName("Should join fields with commas")
    void multipleFields() {
      assertThat(compileOk(measurement("m").fields(List.of("f1", "f2")).build()))
          .startsWith("SELECT f1,f2 ");
    }

    @Test
    @DisplayName("Should write field expressions verbatim")
    void fieldExpressions() {
      assertThat(compileOk(measurement("m").fields(List.of("max(value) - 20")).build()))
          .startsWith("SELECT max(value) - 20 FROM");
    }

    @Test
    @DisplayName("Should quote and join measurements")
    void multipleMeasurements() {
      assertEquals("SELECT * FROM \"cpu\",\"mem\"", compileOk(measurement("cpu", "mem").build()));
    }

    @Test
    @DisplayName("Should not quote regex measurements")
    void regexMeasurement() {
      assertEquals("SELECT * FROM /cpu.*/", compileOk(measurement("/cpu.*/").build()));
    }
  }

  // ========================================================================
  // WHERE
  // ========================================================================

  @Nested
  @DisplayName("WHERE")
  class Where {

    @Test
    @DisplayName("Should render a simple condition")
    void simpleCondition() {
      String query = compileOk(measurement("m").andGroup(Condition.of("node", "node-1", "=")).build());

      assertEquals("SELECT * FROM \"m\" WHERE node = 'node-1'", query);
      assertEquals("node = 'node-1'", whereClauseOf(query));
    }

    @Test
    @DisplayName("Should render expressions verbatim")
    void expression() {
      String query =
          compileOk(measurement("m").andGroup(Condition.expression("time", "now() - 2h", "<")).build());

      assertEquals("time < now() - 2h", whereClauseOf(query));
    }

    @ParameterizedTest(name = "unit {0}")
    @ValueSource(strings = {"u", "µ", "ms", "s", "m", "h", "d", "w"})
    @DisplayName("Should not escape duration units")
    void durationUnits(String unit) {
      String query =
          compileOk(measurement("m").andGroup(Condition.of("time", "20" + unit, "<")).build());

      assertEquals("time < 20" + unit, whereClauseOf(query));
    }

    @Test
    @DisplayName("Should join conditions of a single group with AND")
    void flatConditions() {
      String query =
          compileOk(
              measurement("m")
                  .andGroup(Condition.of("node", "node-1", "="), Condition.of("dc", "eu", "="))
                  .build());

      assertEquals("node = 'node-1' AND dc = 'eu'", whereClauseOf(query));
    }

    @Test
    @DisplayName("Should convert from and to into AND-joined time conditions")
    void fromAndTo() {
      String query = compileOk(measurement("m").from("now() - 2d").to("now() - 1d").build());

      String where = whereClauseOf(query);
      assertEquals(
          Set.of("time > now() - 2d", "time < now() - 1d"), Set.of(where.split(" AND ")));
      assertEquals("SELECT * FROM \"m\" WHERE time > now() - 2d AND time < now() - 1d", query);
    }

    @Test
    @DisplayName("Should combine time bounds with OR groups")
    void timeBoundsWithGroups() {
      String query =
          compileOk(
              measurement("cpu")
                  .fields(List.of("mean(value)"))
                  .from("now() - 1h")
                  .andGroup(Condition.of("host", "web-1", "="), Condition.of("region", "eu", "="))
                  .andGroup(Condition.of("host", "/^db/", "=~"))
                  .groupByDirectives("host", "time(10m)", "fill(0)")
                  .build());

      assertEquals(
          "SELECT mean(value) FROM \"cpu\" WHERE (time > now() - 1h) AND "
              + "(host = 'web-1' AND region = 'eu' OR host =~ /^db/) "
              + "GROUP BY \"host\",time(10m) fill(0)",
          query);
    }

    @Test
    @DisplayName("Should mark integer values by default and honour plain rendering")
    void integerValues() {
      QueryRequest request = measurement("m").andGroup(Condition.of("value", 5, ">")).build();

      assertEquals("value > 5i", whereClauseOf(compileOk(request)));
      assertEquals(
          "SELECT * FROM \"m\" WHERE value > 5",
          new QueryCompiler(IntegerRendering.PLAIN).compile(request).getQuery());
    }

    @Test
    @DisplayName("Should fail with every invalid comparator")
    void invalidComparators() {
      QueryRequest request =
          measurement("m")
              .andGroup(Condition.of("a", "x", "!="), Condition.of("b", "y", "="))
              .andGroup(Condition.of("c", "z", "=="))
              .build();

      InvalidComparator error = assertInstanceOf(InvalidComparator.class, compileError(request));
      assertEquals(List.of("a", "c"), error.conditions().stream().map(Condition::field).toList());
    }

    @Test
    @DisplayName("Should report WHERE errors before GROUP BY errors")
    void whereBeforeGroupBy() {
      QueryRequest request =
          measurement("m").andGroup(Condition.of("a", "x", "!=")).groupByDirectives("time(1h)").build();

      assertInstanceOf(InvalidComparator.class, compileError(request));
    }
  }

  // ========================================================================
  // GROUP BY
  // ========================================================================

  @Nested
  @DisplayName("GROUP BY")
  class GroupBy {

    @Test
    @DisplayName("Should quote tag names")
    void tag() {
      String query = compileOk(measurement("m").groupByDirectives("node").build());

      assertEquals("\"node\"", groupByClauseOf(query));
    }

    @Test
    @DisplayName("Should render the wildcard")
    void wildcard() {
      assertEquals(
          "SELECT * FROM \"m\" GROUP BY *", compileOk(measurement("m").groupByDirectives("*").build()));
    }

    @Test
    @DisplayName("Should reject time buckets without a time condition")
    void timeWithoutCondition() {
      CompileError error = compileError(measurement("m").groupByDirectives("time(2d)").build());

      assertInstanceOf(InvalidGroupByDirective.class, error);
    }

    @Test
    @DisplayName("Should accept time buckets once a time bound is given")
    void timeWithFrom() {
      String query =
          compileOk(measurement("m").from("now() - 2d").groupByDirectives("time(2d)").build());

      assertEquals("time(2d)", groupByClauseOf(query));
    }

    @Test
    @DisplayName("Should accept time buckets with a user supplied time condition")
    void timeWithUserCondition() {
      String query =
          compileOk(
              measurement("m")
                  .andGroup(Condition.expression("time", "now() - 1h", ">="))
                  .groupByDirectives("time(5m)")
                  .build());

      assertEquals("time(5m)", groupByClauseOf(query));
    }

    @Test
    @DisplayName("Should render fill last even if it is not the last element")
    void fillReordered() {
      String query =
          compileOk(
              measurement("m")
                  .fields(List.of("f1"))
                  .groupByDirectives("time(2d)", "fill(null)", "sample_tag")
                  .from("now() - 2d")
                  .to("now() - 1d")
                  .build());

      assertEquals("time(2d),\"sample_tag\" fill(null)", groupByClauseOf(query));
    }

    @ParameterizedTest(name = "fill({0})")
    @ValueSource(strings = {"10", "10.1", "-3", "null", "none", "previous", "linear"})
    @DisplayName("Should accept valid fill options")
    void validFillOptions(String option) {
      String fill = "fill(" + option + ")";
      String query =
          compileOk(
              measurement("m")
                  .fields(List.of("f1"))
                  .groupByDirectives("time(5m)", fill)
                  .from("now() - 2d")
                  .to("now() - 1d")
                  .build());

      assertEquals("time(5m) " + fill, groupByClauseOf(query));
    }

    @Test
    @DisplayName("Should reject invalid fill options")
    void invalidFillOption() {
      CompileError error =
          compileError(
              measurement("m")
                  .fields(List.of("f1"))
                  .groupByDirectives("time(2d)", "fill(invalid_opt)")
                  .from("now() - 2d")
                  .to("now() - 1d")
                  .build());

      InvalidGroupByDirective groupByError = assertInstanceOf(InvalidGroupByDirective.class, error);
      assertEquals("fill(invalid_opt)", groupByError.violations().get(0).directive());
      assertThat(error.message()).contains("fill(invalid_opt)");
    }
  }

  // ========================================================================
  // Results, batching and purity
  // ========================================================================

  @Nested
  @DisplayName("Results and batching")
  class ResultsAndBatching {

    @Test
    @DisplayName("Should throw the compile error from orElseThrow")
    void orElseThrow() {
      CompileResult result = compiler.compile(QueryRequest.builder().build());

      assertThatThrownBy(result::orElseThrow)
          .isInstanceOf(QueryCompilationException.class)
          .hasMessageContaining("measurement")
          .satisfies(
              e ->
                  assertInstanceOf(
                      MeasurementsRequired.class, ((QueryCompilationException) e).getError()));
    }

    @Test
    @DisplayName("Should stack queries with semicolons in order")
    void stackQueries() {
      assertEquals("q1;q2;q3", QueryCompiler.stackQueries(List.of("q1", "q2", "q3")));
      assertEquals("q1", QueryCompiler.stackQueries(List.of("q1")));
      assertEquals("", QueryCompiler.stackQueries(List.of()));
    }

    @Test
    @DisplayName("Should produce identical output for the same request")
    void idempotent() {
      QueryRequest request =
          measurement("m")
              .from("now() - 1d")
              .andGroup(Condition.of("host", "a", "="))
              .groupByDirectives("fill(none)", "time(1h)")
              .build();

      assertEquals(compileOk(request), compileOk(request));
    }

    @Test
    @DisplayName("Should compile concurrently without interference")
    void concurrentCompiles() {
      QueryRequest request =
          measurement("m").from("now() - 1d").groupByDirectives("time(1h)", "host").build();
      String expected = compileOk(request);

      Set<String> results =
          IntStream.range(0, 500)
              .parallel()
              .mapToObj(i -> compiler.compile(request).getQuery())
              .collect(Collectors.toSet());

      assertEquals(Set.of(expected), results);
    }
  }
}
