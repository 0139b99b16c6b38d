package com.enterprise.querybuilder.debug;

import com.enterprise.querybuilder.builder.SqlResult;
import com.enterprise.querybuilder.core.BoundValue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Debug utility: formats an {@link SqlResult} showing the SQL as sent,
 * the SQL with values inlined, and the bound arguments with their types.
 */
public final class QueryDebugger {

    private static final Logger log = LoggerFactory.getLogger(QueryDebugger.class);

    private QueryDebugger() {}

    public static String format(SqlResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== SQL Query Debug (").append(result.dialect().id()).append(") ===\n");

        sb.append("SQL:\n  ").append(result.sql()).append("\n");

        sb.append("SQL (values inlined):\n  ").append(result.toDebugString()).append("\n");

        List<BoundValue> args = result.arguments();
        sb.append("Arguments (").append(args.size()).append("):\n");
        for (int i = 0; i < args.size(); i++) {
            BoundValue arg = args.get(i);
            Object val = arg.value();
            String javaType = val != null ? val.getClass().getSimpleName() : "null";
            sb.append("  #").append(i + 1).append(" = ").append(val)
                    .append(" (").append(javaType).append(", ").append(arg.typeName()).append(")\n");
        }
        sb.append("======================");
        return sb.toString();
    }

    /** Writes {@link #format} to the debug log when enabled. */
    public static void log(SqlResult result) {
        if (log.isDebugEnabled()) {
            log.debug("\n{}", format(result));
        }
    }
}
