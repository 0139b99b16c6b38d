package com.enterprise.querybuilder.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.Temporal;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Table-driven {@link SqlDialect}: a placeholder style, a parameter limit and a
 * handful of encoding switches cover every engine in {@link Dialects}.
 *
 * <p>Encodable types: {@code null}, {@link Optional} (unwrapped),
 * {@link BoundValue} (passed through), String, Character, Byte, Short, Integer,
 * Long, Float, Double, BigDecimal, BigInteger, Boolean, LocalDate, LocalTime,
 * LocalDateTime, OffsetDateTime, Instant, UUID, any Enum (by name) and
 * {@code byte[]}.
 */
public final class StandardDialect implements SqlDialect {

    private final String id;
    private final PlaceholderStyle placeholders;
    private final int maxParameters;
    private final boolean booleansAsNumbers;
    private final boolean temporalAsText;
    private final boolean nativeUuid;

    private StandardDialect(Builder b) {
        this.id = b.id;
        this.placeholders = b.placeholders;
        this.maxParameters = b.maxParameters;
        this.booleansAsNumbers = b.booleansAsNumbers;
        this.temporalAsText = b.temporalAsText;
        this.nativeUuid = b.nativeUuid;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    @Override
    public String id() { return id; }

    @Override
    public int maxParameters() { return maxParameters; }

    public PlaceholderStyle placeholderStyle() { return placeholders; }

    /**
     * Same rules with another parameter limit, e.g. 999 for SQLite before 3.32.
     */
    public StandardDialect withMaxParameters(int limit) {
        return toBuilder().maxParameters(limit).build();
    }

    @Override
    public void appendPlaceholder(StringBuilder sql, int ordinal) {
        if (ordinal < 1) {
            throw new IllegalArgumentException("Placeholder ordinal must be >= 1: " + ordinal);
        }
        if (ordinal > maxParameters) {
            throw new ParameterLimitException(id, maxParameters);
        }
        placeholders.append(sql, ordinal);
    }

    @Override
    public BoundValue encode(Object value) {
        if (value instanceof BoundValue bv) {
            return bv;
        }
        if (value instanceof Optional<?> opt) {
            return encode(opt.orElse(null));
        }
        if (value == null) {
            return BoundValue.nullOf(Types.NULL);
        }
        if (value instanceof String) {
            return BoundValue.of(value, Types.VARCHAR);
        }
        if (value instanceof Character c) {
            return BoundValue.of(c.toString(), Types.CHAR);
        }
        if (value instanceof Boolean b) {
            return booleansAsNumbers
                    ? BoundValue.of(b ? 1 : 0, Types.INTEGER)
                    : BoundValue.of(b, Types.BOOLEAN);
        }
        if (value instanceof Number n) {
            return encodeNumber(n);
        }
        if (value instanceof Temporal t) {
            return encodeTemporal(t);
        }
        if (value instanceof UUID u) {
            return nativeUuid
                    ? BoundValue.of(u, Types.OTHER)
                    : BoundValue.of(u.toString(), Types.VARCHAR);
        }
        if (value instanceof Enum<?> e) {
            return BoundValue.of(e.name(), Types.VARCHAR);
        }
        if (value instanceof byte[] bytes) {
            return BoundValue.of(bytes.clone(), Types.VARBINARY);
        }
        throw new ValueEncodeException(value.getClass(), id);
    }

    private BoundValue encodeNumber(Number n) {
        if (n instanceof Integer) return BoundValue.of(n, Types.INTEGER);
        if (n instanceof Long) return BoundValue.of(n, Types.BIGINT);
        if (n instanceof Short) return BoundValue.of(n, Types.SMALLINT);
        if (n instanceof Byte) return BoundValue.of(n, Types.TINYINT);
        if (n instanceof Double) return BoundValue.of(n, Types.DOUBLE);
        if (n instanceof Float) return BoundValue.of(n, Types.REAL);
        if (n instanceof BigDecimal) return BoundValue.of(n, Types.DECIMAL);
        if (n instanceof BigInteger bi) return BoundValue.of(new BigDecimal(bi), Types.NUMERIC);
        // AtomicLong, DoubleAdder, ... have no stable wire type
        throw new ValueEncodeException(n.getClass(), id);
    }

    private BoundValue encodeTemporal(Temporal t) {
        if (!(t instanceof LocalDate || t instanceof LocalTime || t instanceof LocalDateTime
                || t instanceof OffsetDateTime || t instanceof Instant)) {
            throw new ValueEncodeException(t.getClass(), id);
        }
        if (temporalAsText) {
            return BoundValue.of(t.toString(), Types.VARCHAR);
        }
        if (t instanceof LocalDate) return BoundValue.of(t, Types.DATE);
        if (t instanceof LocalTime) return BoundValue.of(t, Types.TIME);
        if (t instanceof LocalDateTime) return BoundValue.of(t, Types.TIMESTAMP);
        if (t instanceof Instant i) {
            return BoundValue.of(i.atOffset(ZoneOffset.UTC), Types.TIMESTAMP_WITH_TIMEZONE);
        }
        return BoundValue.of(t, Types.TIMESTAMP_WITH_TIMEZONE);
    }

    private Builder toBuilder() {
        return new Builder(id)
                .placeholders(placeholders)
                .maxParameters(maxParameters)
                .booleansAsNumbers(booleansAsNumbers)
                .temporalAsText(temporalAsText)
                .nativeUuid(nativeUuid);
    }

    /** Dialects with the same id, placeholder style, limit and switches are interchangeable. */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StandardDialect other)) return false;
        return id.equals(other.id)
                && placeholders == other.placeholders
                && maxParameters == other.maxParameters
                && booleansAsNumbers == other.booleansAsNumbers
                && temporalAsText == other.temporalAsText
                && nativeUuid == other.nativeUuid;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, placeholders, maxParameters,
                booleansAsNumbers, temporalAsText, nativeUuid);
    }

    @Override
    public String toString() {
        return "SqlDialect[" + id + "]";
    }

    public static final class Builder {

        private final String id;
        private PlaceholderStyle placeholders = PlaceholderStyle.QUESTION_MARK;
        private int maxParameters = 65535;
        private boolean booleansAsNumbers;
        private boolean temporalAsText;
        private boolean nativeUuid;

        private Builder(String id) {
            Objects.requireNonNull(id, "id");
            if (id.isBlank()) {
                throw new IllegalArgumentException("Dialect id must not be blank");
            }
            this.id = id;
        }

        public Builder placeholders(PlaceholderStyle style) {
            this.placeholders = Objects.requireNonNull(style, "style");
            return this;
        }

        public Builder maxParameters(int limit) {
            if (limit < 1) {
                throw new IllegalArgumentException("maxParameters must be >= 1: " + limit);
            }
            this.maxParameters = limit;
            return this;
        }

        /** Bind booleans as 1/0 (engines without a boolean bind type). */
        public Builder booleansAsNumbers(boolean enabled) {
            this.booleansAsNumbers = enabled;
            return this;
        }

        /** Bind dates and times as ISO-8601 text. */
        public Builder temporalAsText(boolean enabled) {
            this.temporalAsText = enabled;
            return this;
        }

        /** Bind UUIDs as driver objects instead of text. */
        public Builder nativeUuid(boolean enabled) {
            this.nativeUuid = enabled;
            return this;
        }

        public StandardDialect build() {
            return new StandardDialect(this);
        }
    }
}
