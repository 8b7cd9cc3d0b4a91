package com.architekt.core.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Root configuration of an Architekt installation.
 *
 * <p>Loaded from {@code architekt.yaml}. Missing sections and keys fall back to their defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * persistence:
 *   driver: filesystem
 *   dataFile: "./data/architekt.json"
 *   backupDir: "./data/backups"
 *   maxBackups: 10
 *
 * flows:
 *   alternateFlowCycles: reject
 * }</pre>
 *
 * @param persistence persistence settings
 * @param flows flow rules
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArchitektConfig(
    @JsonProperty("persistence") PersistenceConfig persistence,
    @JsonProperty("flows") FlowConfig flows
) {
    /**
     * Compact constructor with defaults.
     */
    public ArchitektConfig {
        persistence = Objects.requireNonNullElse(persistence, PersistenceConfig.defaults());
        flows = Objects.requireNonNullElse(flows, FlowConfig.defaults());
    }

    /**
     * Creates the default configuration: file-system persistence under {@code ./data} and
     * alternate-flow cycles allowed.
     *
     * @return default configuration
     */
    public static ArchitektConfig defaults() {
        return new ArchitektConfig(PersistenceConfig.defaults(), FlowConfig.defaults());
    }

    /**
     * Returns a copy with a different data file.
     *
     * @param dataFile new data file
     * @return updated configuration
     */
    public ArchitektConfig withDataFile(Path dataFile) {
        return new ArchitektConfig(
            new PersistenceConfig(persistence.driver(), dataFile.toString(), persistence.backupDir(), persistence.maxBackups()),
            flows
        );
    }

    public ArchitektConfig withBackupDir(Path backupDir) {
        return new ArchitektConfig(
            new PersistenceConfig(persistence.driver(), persistence.dataFile(), backupDir.toString(), persistence.maxBackups()),
            flows
        );
    }

    /**
     * Persistence settings.
     *
     * @param driver repository driver id ("filesystem" or "memory")
     * @param dataFile JSON document holding every aggregate
     * @param backupDir directory receiving copies of the previous document
     * @param maxBackups number of backups kept; 0 disables backups
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PersistenceConfig(
        @JsonProperty("driver") String driver,
        @JsonProperty("dataFile") String dataFile,
        @JsonProperty("backupDir") String backupDir,
        @JsonProperty("maxBackups") Integer maxBackups
    ) {
        public static final String DEFAULT_DRIVER = "filesystem";
        public static final String DEFAULT_DATA_FILE = "./data/architekt.json";
        public static final String DEFAULT_BACKUP_DIR = "./data/backups";
        public static final int DEFAULT_MAX_BACKUPS = 10;

        /**
         * Compact constructor with defaults.
         */
        public PersistenceConfig {
            if (driver == null || driver.isBlank()) {
                driver = DEFAULT_DRIVER;
            }
            if (dataFile == null || dataFile.isBlank()) {
                dataFile = DEFAULT_DATA_FILE;
            }
            if (backupDir == null || backupDir.isBlank()) {
                backupDir = DEFAULT_BACKUP_DIR;
            }
            if (maxBackups == null || maxBackups < 0) {
                maxBackups = DEFAULT_MAX_BACKUPS;
            }
        }

        public static PersistenceConfig defaults() {
            return new PersistenceConfig(null, null, null, null);
        }

        /**
         * Returns in-memory settings, mostly for tests.
         *
         * @return settings selecting the memory driver
         */
        public static PersistenceConfig inMemory() {
            return new PersistenceConfig("memory", null, null, null);
        }

        public Path dataFilePath() {
            return Path.of(dataFile);
        }

        public Path backupDirPath() {
            return Path.of(backupDir);
        }
    }

    /**
     * Flow rules.
     *
     * @param alternateFlowCycles whether cycles between alternate flows are accepted
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FlowConfig(
        @JsonProperty("alternateFlowCycles") CyclePolicy alternateFlowCycles
    ) {
        /**
         * Compact constructor with defaults.
         */
        public FlowConfig {
            alternateFlowCycles = Objects.requireNonNullElse(alternateFlowCycles, CyclePolicy.ALLOW);
        }

        public static FlowConfig defaults() {
            return new FlowConfig(CyclePolicy.ALLOW);
        }
    }

    /**
     * Treatment of cycles in the alternate-flow relation.
     */
    public enum CyclePolicy {
        /** Cycles model mutual fallback and are accepted */
        ALLOW,
        /** A save that closes a cycle is rejected */
        REJECT;

        @JsonValue
        public String jsonName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static CyclePolicy fromJson(String value) {
            return value == null ? null : valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
