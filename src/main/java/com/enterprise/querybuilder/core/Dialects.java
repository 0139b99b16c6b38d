package com.enterprise.querybuilder.core;

import java.util.List;
import java.util.Locale;

public final class Dialects {

    private Dialects() {}

    /** Plain JDBC {@code ?} binding; also what H2 and Derby accept. */
    public static final StandardDialect ANSI = StandardDialect.builder("ansi")
            .build();

    // Postgres accepts parameter numbers in [0, 65535)
    public static final StandardDialect POSTGRES = StandardDialect.builder("postgres")
            .placeholders(PlaceholderStyle.DOLLAR_NUMBERED)
            .maxParameters(65535)
            .nativeUuid(true)
            .build();

    public static final StandardDialect MYSQL = StandardDialect.builder("mysql")
            .maxParameters(65535)
            .build();

    // SQLITE_LIMIT_VARIABLE_NUMBER default since 3.32.0; older builds use 999
    public static final StandardDialect SQLITE = StandardDialect.builder("sqlite")
            .maxParameters(32766)
            .booleansAsNumbers(true)
            .temporalAsText(true)
            .build();

    public static final StandardDialect MSSQL = StandardDialect.builder("mssql")
            .placeholders(PlaceholderStyle.AT_P_NUMBERED)
            .maxParameters(2100)
            .build();

    public static final StandardDialect ORACLE = StandardDialect.builder("oracle")
            .placeholders(PlaceholderStyle.COLON_NUMBERED)
            .maxParameters(65535)
            .booleansAsNumbers(true)
            .build();

    private static final List<StandardDialect> ALL =
            List.of(ANSI, POSTGRES, MYSQL, SQLITE, MSSQL, ORACLE);

    /**
     * Looks up a shipped dialect by id, case-insensitively.
     * {@code h2} is accepted as an alias of {@link #ANSI}.
     *
     * @throws IllegalArgumentException for an unknown id
     */
    public static StandardDialect forId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Dialect id must not be blank");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("h2")) {
            return ANSI;
        }
        for (StandardDialect d : ALL) {
            if (d.id().equals(normalized)) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown SQL dialect: " + id);
    }

    public static List<StandardDialect> all() {
        return ALL;
    }
}
