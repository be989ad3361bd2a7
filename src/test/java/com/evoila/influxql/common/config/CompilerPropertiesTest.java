package com.evoila.influxql.common.config;

import static org.junit.jupiter.api.Assertions.*;

import com.evoila.influxql.compiler.model.dto.IntegerRendering;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

@DisplayName("CompilerProperties Tests")
class CompilerPropertiesTest {

  @Test
  @DisplayName("Should default to integer suffix rendering and a batch limit of 100")
  void defaults() {
    CompilerProperties properties = new CompilerProperties();

    assertEquals(IntegerRendering.INTEGER_SUFFIX, properties.getCompiler().getIntegerRendering());
    assertEquals(100, properties.getApi().getMaxBatchSize());
  }

  @Test
  @DisplayName("Should bind kebab-case settings from the influxql prefix")
  void binding() {
    MapConfigurationPropertySource source =
        new MapConfigurationPropertySource(
            Map.of(
                "influxql.compiler.integer-rendering", "plain",
                "influxql.api.max-batch-size", "5"));

    CompilerProperties properties =
        new Binder(source).bind("influxql", CompilerProperties.class).get();

    assertEquals(IntegerRendering.PLAIN, properties.getCompiler().getIntegerRendering());
    assertEquals(5, properties.getApi().getMaxBatchSize());
  }
}
