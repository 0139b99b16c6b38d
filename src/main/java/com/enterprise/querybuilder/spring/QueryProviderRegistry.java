package com.enterprise.querybuilder.spring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named registry for {@link BatchQueryProvider} instances.
 *
 * <pre>{@code
 * @Bean
 * public QueryProviderRegistry queryProviderRegistry() {
 *     QueryProviderRegistry registry = new QueryProviderRegistry();
 *     registry.register("pendingOrders", pendingOrdersProvider());
 *     return registry;
 * }
 * }</pre>
 */
public class QueryProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(QueryProviderRegistry.class);

    private final Map<String, BatchQueryProvider> providers = new LinkedHashMap<>();

    public void register(String name, BatchQueryProvider provider) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(provider, "provider");
        if (providers.put(name, provider) != null) {
            log.warn("Query provider '{}' was registered twice; the later registration wins", name);
        }
    }

    public BatchQueryProvider get(String name) {
        BatchQueryProvider provider = providers.get(name);
        if (provider == null) {
            throw new IllegalArgumentException("No provider registered: " + name);
        }
        return provider;
    }

    public Map<String, BatchQueryProvider> all() {
        return Collections.unmodifiableMap(providers);
    }
}
