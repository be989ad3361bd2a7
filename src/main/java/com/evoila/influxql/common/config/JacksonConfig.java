package com.evoila.influxql.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.json.JsonMapper;

/**
 * JSON mapper shared by the request codecs and the error handler. Floating point values are read
 * as {@link java.math.BigDecimal} so decimal literals render exactly as they were written, and
 * misspelled request properties fail instead of silently dropping a clause.
 */
@Configuration
public class JacksonConfig {

  @Bean
  public JsonMapper jsonMapper() {
    return JsonMapper.builder()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
  }
}
