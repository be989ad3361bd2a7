package com.evoila.influxql.common.config;

import com.evoila.influxql.compiler.model.dto.IntegerRendering;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Compiler and API settings bound from the {@code influxql} configuration prefix.
 *
 * <pre>
 * influxql:
 *   compiler:
 *     integer-rendering: integer-suffix   # or plain
 *   api:
 *     max-batch-size: 100
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "influxql")
public class CompilerProperties {

  private CompilerConfig compiler = new CompilerConfig();
  private ApiConfig api = new ApiConfig();

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class CompilerConfig {
    @Builder.Default private IntegerRendering integerRendering = IntegerRendering.INTEGER_SUFFIX;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ApiConfig {
    @Builder.Default private int maxBatchSize = 100;
  }
}
