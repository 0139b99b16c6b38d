package com.enterprise.querybuilder;

import com.enterprise.querybuilder.builder.Placeholder;
import com.enterprise.querybuilder.builder.QueryBuilder;
import com.enterprise.querybuilder.builder.SqlResult;
import com.enterprise.querybuilder.core.BoundValue;
import com.enterprise.querybuilder.core.Dialects;
import com.enterprise.querybuilder.debug.QueryDebugger;

import org.junit.jupiter.api.Test;

import java.sql.Timestamp;
import java.sql.Types;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SqlResultTest {

    // ==================== verify ====================

    @Test
    void verifyDetectsMissingArgument() {
        SqlResult r = new SqlResult("SELECT * FROM t WHERE a = $1 AND b = $2",
                List.of(BoundValue.of(1, Types.INTEGER)),
                List.of(new Placeholder(26, 28, 1), new Placeholder(37, 39, 2)),
                Dialects.POSTGRES);

        assertThatThrownBy(r::verify)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("#2")
                .hasMessageContaining("only 1");
    }

    @Test
    void verifyDetectsOutOfOrderPlaceholders() {
        SqlResult r = new SqlResult("$2 $1",
                List.of(BoundValue.of(1, Types.INTEGER), BoundValue.of(2, Types.INTEGER)),
                List.of(new Placeholder(0, 2, 2), new Placeholder(3, 5, 1)),
                Dialects.POSTGRES);

        assertThatThrownBy(r::verify)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("out of order");
    }

    @Test
    void resultIsImmutableSnapshot() {
        QueryBuilder qb = QueryBuilder.query(Dialects.ANSI, "SELECT ");
        qb.pushBind(1);
        SqlResult r = qb.build();

        qb.reset().pushBind(2);

        assertThat(r.values()).containsExactly(1);
        assertThatThrownBy(() -> r.arguments().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    // ==================== Debug output ====================

    @Test
    void debugInlinesOnlyTrackedPlaceholders() {
        QueryBuilder qb = QueryBuilder.query(Dialects.ANSI, "SELECT '?' AS q, ");
        qb.pushBind("x");
        assertThat(qb.build().toDebugString()).isEqualTo("SELECT '?' AS q, 'x'");
    }

    @Test
    void debugOutputToleratesPassThroughDriverValues() {
        QueryBuilder qb = QueryBuilder.query(Dialects.ANSI, "SELECT * FROM t WHERE ts = ");
        qb.pushBind(BoundValue.of(Timestamp.valueOf("2024-03-15 10:30:05"), Types.TIMESTAMP))
          .push(" AND tag = ").pushBind(BoundValue.of(new StringBuilder("raw"), Types.OTHER));
        SqlResult r = qb.build();

        assertThatCode(r::verify).doesNotThrowAnyException();
        assertThat(r.toDebugString())
                .isEqualTo("SELECT * FROM t WHERE ts = TIMESTAMP '2024-03-15 10:30:05.0' AND tag = 'raw'");
        assertThat(QueryDebugger.format(r)).contains("#2 = raw (StringBuilder, OTHER)");
    }

    @Test
    void debuggerFormat() {
        QueryBuilder qb = QueryBuilder.query(Dialects.POSTGRES, "SELECT * FROM orders WHERE status = ");
        qb.pushBind("PENDING").push(" AND total > ").pushBind(100L);
        SqlResult r = qb.build();

        String out = QueryDebugger.format(r);

        assertThat(out)
                .startsWith("=== SQL Query Debug (postgres) ===")
                .contains("SELECT * FROM orders WHERE status = $1 AND total > $2")
                .contains("SELECT * FROM orders WHERE status = 'PENDING' AND total > 100")
                .contains("Arguments (2):")
                .contains("#1 = PENDING (String, VARCHAR)")
                .contains("#2 = 100 (Long, BIGINT)");
        assertThatCode(() -> QueryDebugger.log(r)).doesNotThrowAnyException();
    }
}
