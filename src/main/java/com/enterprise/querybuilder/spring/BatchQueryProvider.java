package com.enterprise.querybuilder.spring;

import com.enterprise.querybuilder.builder.SqlResult;

import java.util.Map;

/**
 * Contract for Spring Batch query providers.
 *
 * <p>Each call to {@link #buildQuery(Map)} MUST create a fresh
 * {@link com.enterprise.querybuilder.builder.QueryBuilder}; builders are not
 * thread-safe and must never be shared across calls.
 *
 * <p>Register implementations as Spring beans:
 * <pre>{@code
 * @Bean("pendingOrders")
 * public BatchQueryProvider pendingOrdersProvider(SqlDialect dialect) {
 *     return params -> {
 *         QueryBuilder qb = QueryBuilder.query(dialect, "SELECT id, amount FROM orders WHERE 1 = 1");
 *         if (params.get("status") != null) {
 *             qb.push(" AND status = ").pushBind(params.get("status"));
 *         }
 *         return qb.build();
 *     };
 * }
 * }</pre>
 */
@FunctionalInterface
public interface BatchQueryProvider {

    /**
     * Builds a query using the given job parameters.
     *
     * @param jobParams parameters from the Spring Batch job execution context
     * @return finished statement ready for reader consumption
     */
    SqlResult buildQuery(Map<String, Object> jobParams);
}
