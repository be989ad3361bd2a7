package com.evoila.influxql.api.dto;

import java.util.List;

/**
 * JSON form of a query request.
 *
 * <pre>
 * {
 *   "measurements": ["cpu"],
 *   "fields": ["mean(usage)"],
 *   "conditions": [[{"field": "host", "comparator": "=", "value": "web-1"}]],
 *   "from": "now() - 1h",
 *   "groupBy": ["time(5m)", "fill(none)"]
 * }
 * </pre>
 */
public record CompileRequest(
    List<String> measurements,
    List<String> fields,
    List<List<ConditionDto>> conditions,
    String from,
    String to,
    List<String> groupBy) {}
