package com.evoila.influxql.api.dto;

import java.util.List;

/** Requests compiled together into one multi-statement query. */
public record BatchCompileRequest(List<CompileRequest> queries) {}
