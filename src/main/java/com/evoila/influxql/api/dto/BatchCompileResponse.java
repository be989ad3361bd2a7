package com.evoila.influxql.api.dto;

/**
 * Compiled statements joined with ";".
 *
 * @param query The multi-statement query
 * @param statements Number of statements in the query
 */
public record BatchCompileResponse(String query, int statements) {}
