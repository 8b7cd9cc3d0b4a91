package com.architekt.core.persistence;

import com.architekt.core.config.ArchitektConfig.PersistenceConfig;

/**
 * Factory for {@link AggregateRepository} implementations, discovered via Java Service
 * Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.architekt.core.persistence.AggregateRepositoryProvider}
 *
 * @see AggregateRepositories
 */
public interface AggregateRepositoryProvider {

    /**
     * Returns the driver id selecting this provider in {@code persistence.driver}.
     *
     * @return driver id (e.g., "filesystem", "memory")
     */
    String getId();

    /**
     * Creates a repository.
     *
     * @param config persistence settings
     * @return new repository
     */
    AggregateRepository create(PersistenceConfig config);
}
