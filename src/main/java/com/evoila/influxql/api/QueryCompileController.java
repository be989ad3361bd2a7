package com.evoila.influxql.api;

import com.evoila.influxql.api.dto.BatchCompileRequest;
import com.evoila.influxql.api.dto.BatchCompileResponse;
import com.evoila.influxql.api.dto.CompileRequest;
import com.evoila.influxql.api.dto.CompileResponse;
import com.evoila.influxql.common.config.CompilerProperties;
import com.evoila.influxql.compiler.core.QueryCompiler;
import com.evoila.influxql.compiler.exception.QueryCompilationException;
import com.evoila.influxql.compiler.model.result.CompileResult;
import com.evoila.influxql.compiler.statement.SchemaStatements;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Compiles structured query requests into InfluxQL. Nothing is sent to a database; callers get the
 * statement text back and submit it themselves.
 *
 * <p>Rejected requests surface as {@link QueryCompilationException} or {@link
 * IllegalArgumentException} and are turned into 400 responses by the global exception handler.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class QueryCompileController {

  private final QueryCompiler queryCompiler;
  private final CompilerProperties compilerProperties;

  @PostMapping(
      value = "/query/compile",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<CompileResponse> compile(@RequestBody CompileRequest request) {
    return Mono.fromCallable(
        () -> {
          log.debug("QueryCompileController: Compiling request for {}", request.measurements());
          return new CompileResponse(compileOne(request));
        });
  }

  /**
   * Compiles every request of the batch and stacks the statements. The batch fails as a whole on
   * the first rejected request, reporting its index.
   */
  @PostMapping(
      value = "/query/batch",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<BatchCompileResponse> compileBatch(@RequestBody BatchCompileRequest request) {
    return Mono.fromCallable(
        () -> {
          List<CompileRequest> queries = request.queries();
          validateBatchSize(queries);

          List<String> statements = new ArrayList<>();
          for (int i = 0; i < queries.size(); i++) {
            CompileResult result =
                queryCompiler.compile(QueryRequestMapper.toQueryRequest(queries.get(i)));
            if (!result.isSuccess()) {
              throw new QueryCompilationException("Statement " + i, result.getError());
            }
            statements.add(result.getQuery());
          }

          log.debug("QueryCompileController: Compiled batch of {} statements", statements.size());
          return new BatchCompileResponse(QueryCompiler.stackQueries(statements), statements.size());
        });
  }

  @GetMapping(value = "/statements/{statement}", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<CompileResponse> statement(@PathVariable("statement") String statement) {
    return Mono.fromCallable(
        () ->
            new CompileResponse(
                SchemaStatements.show(SchemaStatements.Show.fromPathName(statement))));
  }

  private String compileOne(CompileRequest request) {
    return queryCompiler.compile(QueryRequestMapper.toQueryRequest(request)).orElseThrow();
  }

  private void validateBatchSize(List<CompileRequest> queries) {
    if (queries == null || queries.isEmpty()) {
      throw new IllegalArgumentException("Batch must contain at least one query");
    }
    int maxBatchSize = compilerProperties.getApi().getMaxBatchSize();
    if (queries.size() > maxBatchSize) {
      throw new IllegalArgumentException(
          "Batch contains " + queries.size() + " queries, maximum is " + maxBatchSize);
    }
  }
}
