package com.evoila.influxql.app.config;

import com.evoila.influxql.common.config.CompilerProperties;
import com.evoila.influxql.compiler.core.QueryCompiler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@ComponentScan(basePackages = {"com.evoila.influxql.api", "com.evoila.influxql.common"})
public class CompilerConfiguration {

  @Bean
  public QueryCompiler queryCompiler(CompilerProperties properties) {
    CompilerProperties.CompilerConfig compiler = properties.getCompiler();
    log.info("Creating query compiler with integer rendering {}", compiler.getIntegerRendering());
    return new QueryCompiler(compiler.getIntegerRendering());
  }
}
