package com.enterprise.querybuilder.core;

/**
 * Engine-specific binding rules: how a Java value is encoded for the driver,
 * how a placeholder is written into SQL text, and how many bind parameters a
 * single statement may carry.
 *
 * <p>A dialect is fixed per builder at construction. See {@link Dialects} for
 * the shipped implementations.
 */
public interface SqlDialect {

    /** Short lowercase identifier, e.g. {@code "postgres"}. */
    String id();

    /** Highest 1-based placeholder ordinal a statement may use. */
    int maxParameters();

    /**
     * Encodes a value into its wire representation for this dialect.
     *
     * @throws ValueEncodeException if the value has no encoding here
     */
    BoundValue encode(Object value);

    /**
     * Appends the placeholder for the given 1-based ordinal.
     *
     * @throws ParameterLimitException if {@code ordinal > maxParameters()}
     */
    void appendPlaceholder(StringBuilder sql, int ordinal);
}
