package com.enterprise.querybuilder.core;

/**
 * A bind argument was refused by the dialect. Recoverable: the builder that
 * raised it is left exactly as it was before the failing call.
 */
public class SqlBindException extends RuntimeException {

    public SqlBindException(String message) {
        super(message);
    }
}
