package com.gocomet.zonerevenue.common.exception;

import java.util.List;

/**
 * A required input column is missing or has an incompatible type. Fatal for
 * the whole aggregation run.
 */
public class SchemaException extends RuntimeException {

    private final List<String> problems;

    public SchemaException(String table, List<String> problems) {
        super(String.format("Table %s does not match the expected schema: %s", table, String.join("; ", problems)));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
