package com.enterprise.querybuilder.builder;

/**
 * A placeholder emitted by a {@link QueryBuilder}: its character span in the
 * SQL text and the 1-based ordinal of the argument it stands for.
 */
public record Placeholder(int start, int end, int ordinal) {
}
