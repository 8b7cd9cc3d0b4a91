package com.architekt.cli;

import com.architekt.core.config.ArchitektConfig;
import com.architekt.core.config.ConfigLoader;
import com.architekt.core.persistence.AggregateRepositories;
import com.architekt.core.persistence.AggregateRepository;
import com.architekt.core.store.ProjectAggregateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Options shared by every command that reads or writes the store.
 */
public class StoreOptions {

    private static final Logger log = LoggerFactory.getLogger(StoreOptions.class);

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: " + ConfigLoader.DEFAULT_FILE_NAME + ")"
    )
    private Path configPath;

    @Option(
        names = {"--data-file"},
        description = "Data file (overrides config)"
    )
    private Path dataFile;

    @Option(
        names = {"--backup-dir"},
        description = "Backup directory (overrides config)"
    )
    private Path backupDir;

    @Option(
        names = {"-u", "--user"},
        description = "User owning the projects (default: ${DEFAULT-VALUE})",
        defaultValue = "local-user"
    )
    private String userId;

    public String userId() {
        return userId;
    }

    /**
     * Opens the store selected by the configuration and the overrides.
     *
     * @return store backed by the configured repository
     */
    public ProjectAggregateStore openStore() {
        ArchitektConfig config = loadConfiguration();
        if (dataFile != null) {
            config = config.withDataFile(dataFile);
        }
        if (backupDir != null) {
            config = config.withBackupDir(backupDir);
        }
        AggregateRepository repository = AggregateRepositories.create(config.persistence());
        log.debug("Opened {} store at {}", config.persistence().driver(), config.persistence().dataFile());
        return new ProjectAggregateStore(repository, config.flows());
    }

    private ArchitektConfig loadConfiguration() {
        if (configPath != null) {
            return ConfigLoader.load(configPath);
        }
        Path defaultPath = Path.of(ConfigLoader.DEFAULT_FILE_NAME);
        if (!Files.exists(defaultPath)) {
            log.debug("No {} found, using default configuration", ConfigLoader.DEFAULT_FILE_NAME);
            return ArchitektConfig.defaults();
        }
        return ConfigLoader.load(defaultPath);
    }
}
