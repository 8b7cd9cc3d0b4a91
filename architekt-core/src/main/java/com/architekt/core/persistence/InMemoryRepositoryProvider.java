package com.architekt.core.persistence;

import com.architekt.core.config.ArchitektConfig.PersistenceConfig;

/**
 * Provider for the {@code memory} driver.
 */
public class InMemoryRepositoryProvider implements AggregateRepositoryProvider {

    @Override
    public String getId() {
        return "memory";
    }

    @Override
    public AggregateRepository create(PersistenceConfig config) {
        return new InMemoryAggregateRepository();
    }
}
