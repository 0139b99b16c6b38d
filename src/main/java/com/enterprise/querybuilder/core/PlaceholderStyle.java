package com.enterprise.querybuilder.core;

/** How a bind placeholder is spelled in SQL text. */
public enum PlaceholderStyle {

    /** {@code ?}, ordinal implied by position. */
    QUESTION_MARK {
        @Override
        void append(StringBuilder sql, int ordinal) {
            sql.append('?');
        }
    },
    /** {@code $1, $2, ...} (PostgreSQL). */
    DOLLAR_NUMBERED {
        @Override
        void append(StringBuilder sql, int ordinal) {
            sql.append('$').append(ordinal);
        }
    },
    /** {@code @p1, @p2, ...} (SQL Server). */
    AT_P_NUMBERED {
        @Override
        void append(StringBuilder sql, int ordinal) {
            sql.append("@p").append(ordinal);
        }
    },
    /** {@code :1, :2, ...} (Oracle). */
    COLON_NUMBERED {
        @Override
        void append(StringBuilder sql, int ordinal) {
            sql.append(':').append(ordinal);
        }
    };

    abstract void append(StringBuilder sql, int ordinal);

    /** True when the placeholder text carries its ordinal. */
    public boolean isNumbered() {
        return this != QUESTION_MARK;
    }
}
