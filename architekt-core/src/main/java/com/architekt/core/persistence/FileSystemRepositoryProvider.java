package com.architekt.core.persistence;

import com.architekt.core.config.ArchitektConfig.PersistenceConfig;

/**
 * Provider for the {@code filesystem} driver.
 */
public class FileSystemRepositoryProvider implements AggregateRepositoryProvider {

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public AggregateRepository create(PersistenceConfig config) {
        return new FileSystemAggregateRepository(config.dataFilePath(), config.backupDirPath(), config.maxBackups());
    }
}
