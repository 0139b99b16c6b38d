package com.enterprise.querybuilder.builder;

import com.enterprise.querybuilder.core.BoundValue;
import com.enterprise.querybuilder.core.SqlDialect;
import com.enterprise.querybuilder.param.SqlLiteralFormatter;

import java.util.List;
import java.util.Objects;

/**
 * A finished statement: SQL text plus its positional bind arguments, ready
 * for any API that takes raw SQL and ordered parameters (JDBC, Spring's
 * {@code JdbcTemplate}, ...).
 */
public class SqlResult {

    private final String sql;
    private final List<BoundValue> arguments;
    private final List<Placeholder> placeholders;
    private final SqlDialect dialect;

    public SqlResult(String sql, List<BoundValue> arguments,
                     List<Placeholder> placeholders, SqlDialect dialect) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.arguments = List.copyOf(arguments);
        this.placeholders = List.copyOf(placeholders);
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    public String sql() { return sql; }

    public List<BoundValue> arguments() { return arguments; }

    /** Placeholders emitted by the builder, in text order. */
    public List<Placeholder> placeholders() { return placeholders; }

    public SqlDialect dialect() { return dialect; }

    /** Encoded values in bind order. */
    public Object[] values() {
        return arguments.stream().map(BoundValue::value).toArray();
    }

    /** {@link java.sql.Types} codes in bind order. */
    public int[] sqlTypes() {
        return arguments.stream().mapToInt(BoundValue::sqlType).toArray();
    }

    /** Returns the SQL with builder-emitted placeholders replaced by literals, for debugging. */
    public String toDebugString() {
        StringBuilder out = new StringBuilder(sql.length() + 16 * placeholders.size());
        int cursor = 0;
        for (Placeholder p : placeholders) {
            out.append(sql, cursor, p.start());
            if (p.ordinal() <= arguments.size()) {
                out.append(SqlLiteralFormatter.formatLenient(arguments.get(p.ordinal() - 1)));
            } else {
                out.append(sql, p.start(), p.end());
            }
            cursor = p.end();
        }
        out.append(sql, cursor, sql.length());
        return out.toString();
    }

    /**
     * Verifies every builder-emitted placeholder has a bound value and that
     * ordinals rise with text position.
     */
    public void verify() {
        int previous = 0;
        for (Placeholder p : placeholders) {
            if (p.ordinal() > arguments.size()) {
                throw new IllegalStateException("SQL references argument #" + p.ordinal()
                        + " but only " + arguments.size() + " value(s) were bound");
            }
            if (p.ordinal() <= previous) {
                throw new IllegalStateException("Placeholder #" + p.ordinal()
                        + " at offset " + p.start() + " is out of order");
            }
            previous = p.ordinal();
        }
    }

    @Override
    public String toString() {
        return "SqlResult[sql=" + sql + ", arguments=" + arguments.size() + "]";
    }
}
