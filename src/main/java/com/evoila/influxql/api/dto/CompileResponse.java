package com.evoila.influxql.api.dto;

/** A compiled statement. */
public record CompileResponse(String query) {}
