package com.enterprise.querybuilder.core;

/** A statement would carry more bind parameters than the dialect accepts. */
public class ParameterLimitException extends SqlBindException {

    private final int limit;

    public ParameterLimitException(String dialectId, int limit) {
        super("Too many bind parameters for dialect " + dialectId + " (limit " + limit + ")");
        this.limit = limit;
    }

    public int limit() { return limit; }
}
