package com.evoila.influxql.compiler.model.result;

/** The request names no measurement to select from. */
public record MeasurementsRequired() implements CompileError {

  @Override
  public String code() {
    return "MEASUREMENTS_REQUIRED";
  }

  @Override
  public String message() {
    return "At least one measurement is required";
  }
}
