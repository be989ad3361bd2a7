package com.evoila.influxql.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication()
@EnableConfigurationProperties
public class InfluxqlApplication {

  public static void main(String[] args) {
    SpringApplication.run(InfluxqlApplication.class, args);
  }
}
