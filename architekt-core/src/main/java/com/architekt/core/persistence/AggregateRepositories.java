package com.architekt.core.persistence;

import com.architekt.core.config.ArchitektConfig.PersistenceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Resolves the repository configured by {@code persistence.driver}.
 */
public final class AggregateRepositories {

    private static final Logger log = LoggerFactory.getLogger(AggregateRepositories.class);

    private AggregateRepositories() {
        // Utility class
    }

    /**
     * Creates the repository for the configured driver.
     *
     * @param config persistence settings
     * @return repository
     * @throws IllegalStateException if no provider is registered for the driver
     */
    public static AggregateRepository create(PersistenceConfig config) {
        for (AggregateRepositoryProvider provider : ServiceLoader.load(AggregateRepositoryProvider.class)) {
            if (provider.getId().equalsIgnoreCase(config.driver())) {
                log.debug("Using persistence driver: {}", provider.getId());
                return provider.create(config);
            }
        }
        throw new IllegalStateException("Unsupported persistence driver: " + config.driver());
    }

    /**
     * Lists the ids of every registered driver.
     *
     * @return driver ids
     */
    public static List<String> availableDrivers() {
        List<String> drivers = new ArrayList<>();
        ServiceLoader.load(AggregateRepositoryProvider.class).forEach(provider -> drivers.add(provider.getId()));
        return drivers;
    }
}
