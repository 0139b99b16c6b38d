package com.enterprise.querybuilder.core;

import java.sql.JDBCType;
import java.sql.Types;

/**
 * A bind argument already encoded for a dialect, tagged with its
 * {@link Types JDBC type}.
 *
 * <p>Passing a {@code BoundValue} to {@code pushBind} skips encoding, which
 * is how callers bind a typed NULL:
 * <pre>{@code
 * qb.pushBind(BoundValue.nullOf(Types.INTEGER));
 * }</pre>
 */
public record BoundValue(Object value, int sqlType) {

    public static BoundValue of(Object value, int sqlType) {
        return new BoundValue(value, sqlType);
    }

    public static BoundValue nullOf(int sqlType) {
        return new BoundValue(null, sqlType);
    }

    public boolean isNull() {
        return value == null;
    }

    /** JDBC type name, e.g. {@code VARCHAR}. */
    public String typeName() {
        return JDBCType.valueOf(sqlType).getName();
    }
}
