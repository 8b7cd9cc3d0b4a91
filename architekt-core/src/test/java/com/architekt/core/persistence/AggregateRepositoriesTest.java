package com.architekt.core.persistence;

import com.architekt.core.config.ArchitektConfig.PersistenceConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link AggregateRepositories}.
 */
class AggregateRepositoriesTest {

    @TempDir
    Path tempDir;

    @Test
    void availableDrivers_includesBuiltInDrivers() {
        assertThat(AggregateRepositories.availableDrivers()).contains("filesystem", "memory");
    }

    @Test
    void create_memoryDriver_returnsInMemoryRepository() {
        assertThat(AggregateRepositories.create(PersistenceConfig.inMemory()))
            .isInstanceOf(InMemoryAggregateRepository.class);
    }

    @Test
    void create_filesystemDriver_usesConfiguredDataFile() {
        PersistenceConfig config = new PersistenceConfig("FileSystem",
            tempDir.resolve("store.json").toString(), tempDir.resolve("backups").toString(), 3);

        AggregateRepository repository = AggregateRepositories.create(config);

        assertThat(repository).isInstanceOf(FileSystemAggregateRepository.class);
        assertThat(((FileSystemAggregateRepository) repository).dataFile())
            .isEqualTo(tempDir.resolve("store.json").toAbsolutePath());
    }

    @Test
    void create_unknownDriver_throwsIllegalStateException() {
        PersistenceConfig config = new PersistenceConfig("mongo", null, null, null);

        assertThatThrownBy(() -> AggregateRepositories.create(config))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("Unsupported persistence driver: mongo");
    }
}
