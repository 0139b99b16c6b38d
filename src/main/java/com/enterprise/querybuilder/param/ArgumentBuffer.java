package com.enterprise.querybuilder.param;

import com.enterprise.querybuilder.core.BoundValue;
import com.enterprise.querybuilder.core.SqlDialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered bind arguments for one statement, already encoded by the
 * buffer's {@link SqlDialect}. The n-th value matches the n-th placeholder.
 *
 * <p>Not thread-safe. A buffer belongs to one builder at a time.
 */
public final class ArgumentBuffer {

    private final SqlDialect dialect;
    private final ArrayList<BoundValue> values = new ArrayList<>();

    public ArgumentBuffer(SqlDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    /** Buffer pre-filled with {@code values}, encoded in order. */
    public static ArgumentBuffer of(SqlDialect dialect, Object... values) {
        ArgumentBuffer buffer = new ArgumentBuffer(dialect);
        buffer.reserve(values.length);
        for (Object v : values) {
            buffer.add(v);
        }
        return buffer;
    }

    /**
     * Encodes and appends a value. Nothing is appended when encoding fails.
     *
     * @throws com.enterprise.querybuilder.core.ValueEncodeException if the
     *         dialect cannot encode the value
     */
    public ArgumentBuffer add(Object value) {
        values.add(dialect.encode(value));
        return this;
    }

    /**
     * Appends the already-encoded values of {@code other}, in order.
     *
     * @throws IllegalArgumentException if {@code other} uses another dialect
     */
    public ArgumentBuffer addAll(ArgumentBuffer other) {
        Objects.requireNonNull(other, "other");
        if (!other.dialect.equals(dialect)) {
            throw new IllegalArgumentException("Cannot mix dialects: "
                    + dialect.id() + " and " + other.dialect.id());
        }
        values.addAll(other.values);
        return this;
    }

    /** Capacity hint for {@code additional} more values. */
    public void reserve(int additional) {
        values.ensureCapacity(values.size() + additional);
    }

    /**
     * Appends the placeholder matching the most recently added value.
     *
     * @throws com.enterprise.querybuilder.core.ParameterLimitException if the
     *         dialect's parameter limit is exceeded
     * @throws IllegalStateException if no value has been added yet
     */
    public void formatPlaceholder(StringBuilder sql) {
        if (values.isEmpty()) {
            throw new IllegalStateException("No bound value to format a placeholder for");
        }
        dialect.appendPlaceholder(sql, values.size());
    }

    /** Drops every value past {@code length}. */
    public void truncate(int length) {
        if (length < 0 || length > values.size()) {
            throw new IndexOutOfBoundsException("length " + length + ", size " + values.size());
        }
        values.subList(length, values.size()).clear();
    }

    public int length() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public List<BoundValue> values() {
        return Collections.unmodifiableList(values);
    }

    public SqlDialect dialect() {
        return dialect;
    }

    @Override
    public String toString() {
        return "ArgumentBuffer" + values;
    }
}
