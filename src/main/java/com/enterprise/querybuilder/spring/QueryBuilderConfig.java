package com.enterprise.querybuilder.spring;

import com.enterprise.querybuilder.core.Dialects;
import com.enterprise.querybuilder.core.SqlDialect;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

import javax.sql.DataSource;

/**
 * Spring wiring for the query builder and its Spring Batch bridge.
 *
 * <p>Defaults come from {@code querybuilder-defaults.properties}; any
 * environment property of the same name overrides them:
 * <pre>
 * querybuilder.dialect=postgres
 * querybuilder.reader.fetch-size=5000
 * querybuilder.reader.query-timeout=300
 * </pre>
 *
 * <p>Import it next to a {@link DataSource} bean:
 * <pre>{@code
 * @Import(QueryBuilderConfig.class)
 * @Configuration
 * public class MyBatchConfig { ... }
 * }</pre>
 */
@Configuration
@PropertySource("classpath:querybuilder-defaults.properties")
public class QueryBuilderConfig {

    @Bean
    public SqlDialect sqlDialect(@Value("${querybuilder.dialect}") String dialectId) {
        return Dialects.forId(dialectId);
    }

    @Bean
    public BatchReaderFactory batchReaderFactory(
            DataSource dataSource,
            @Value("${querybuilder.reader.fetch-size}") int fetchSize,
            @Value("${querybuilder.reader.query-timeout}") int queryTimeout) {
        BatchReaderFactory factory = new BatchReaderFactory(dataSource);
        factory.setFetchSize(fetchSize);
        factory.setQueryTimeout(queryTimeout);
        return factory;
    }

    @Bean
    public QueryProviderRegistry queryProviderRegistry() {
        return new QueryProviderRegistry();
    }
}
