package com.enterprise.querybuilder.spring;

import com.enterprise.querybuilder.builder.SqlResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.item.database.JdbcCursorItemReader;
import org.springframework.jdbc.core.ArgumentTypePreparedStatementSetter;
import org.springframework.jdbc.core.PreparedStatementSetter;
import org.springframework.jdbc.core.RowMapper;

import javax.sql.DataSource;
import java.util.Map;
import java.util.Objects;

/**
 * Factory that bridges built queries with Spring Batch readers.
 *
 * <p>Creates fully configured {@link JdbcCursorItemReader} instances from a
 * {@link BatchQueryProvider}. The statement's encoded arguments are bound
 * positionally, each with the JDBC type the dialect chose for it.
 *
 * <p>Typical usage in a {@code @Configuration} class:
 * <pre>{@code
 * @Bean
 * @StepScope
 * public JdbcCursorItemReader<Order> orderReader(
 *         BatchReaderFactory factory,
 *         @Value("#{jobParameters['status']}") String status) {
 *     return factory.cursorReader("orderReader", pendingOrdersProvider(),
 *             orderRowMapper(), Map.of("status", status));
 * }
 * }</pre>
 */
public class BatchReaderFactory {

    private static final Logger log = LoggerFactory.getLogger(BatchReaderFactory.class);

    private final DataSource dataSource;
    private int fetchSize = 1000;
    private int queryTimeout = 0;

    public BatchReaderFactory(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    /**
     * Binds a statement's arguments to a {@link java.sql.PreparedStatement},
     * usable with {@code JdbcTemplate.query(sql, setter, rowMapper)} and friends.
     */
    public static PreparedStatementSetter preparedStatementSetter(SqlResult result) {
        return new ArgumentTypePreparedStatementSetter(result.values(), result.sqlTypes());
    }

    /**
     * Creates a {@link JdbcCursorItemReader} wired with the query from the provider.
     *
     * @param <T>       row type
     * @param name      reader name (used for restart data and logging)
     * @param provider  query provider; must be stateless
     * @param rowMapper maps each ResultSet row to a domain object
     * @param jobParams job execution parameters forwarded to the provider
     * @return configured reader; Spring calls afterPropertiesSet() in managed Steps
     */
    public <T> JdbcCursorItemReader<T> cursorReader(
            String name,
            BatchQueryProvider provider,
            RowMapper<T> rowMapper,
            Map<String, Object> jobParams) {

        SqlResult result = resolveQuery(provider, jobParams);
        log.debug("Creating reader '{}' ({} bound argument(s)): {}",
                name, result.arguments().size(), result.sql());

        JdbcCursorItemReader<T> reader = new JdbcCursorItemReader<>();
        reader.setName(name);
        reader.setDataSource(dataSource);
        reader.setSql(result.sql());
        reader.setRowMapper(rowMapper);
        reader.setFetchSize(fetchSize);
        if (queryTimeout > 0) {
            reader.setQueryTimeout(queryTimeout);
        }
        reader.setPreparedStatementSetter(preparedStatementSetter(result));
        return reader;
    }

    /**
     * Resolves and verifies the query without creating a reader.
     * Useful for logging, testing, and dry-run scenarios.
     */
    public SqlResult resolveQuery(BatchQueryProvider provider,
                                  Map<String, Object> jobParams) {
        SqlResult result = provider.buildQuery(jobParams);
        result.verify();
        return result;
    }

    /** JDBC fetch size hint. Default 1000. */
    public void setFetchSize(int fetchSize) {
        this.fetchSize = fetchSize;
    }

    /** Query timeout in seconds. 0 = no timeout (default). */
    public void setQueryTimeout(int seconds) {
        this.queryTimeout = seconds;
    }

    public int getFetchSize() {
        return fetchSize;
    }

    public int getQueryTimeout() {
        return queryTimeout;
    }
}
