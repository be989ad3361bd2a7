package com.evoila.influxql.compiler.model.result;

/**
 * A rejected GROUP BY directive.
 *
 * @param directive The directive text as supplied
 * @param reason Why it was rejected
 */
public record DirectiveViolation(String directive, String reason) {}
