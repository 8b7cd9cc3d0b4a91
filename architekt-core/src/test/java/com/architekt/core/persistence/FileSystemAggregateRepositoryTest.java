package com.architekt.core.persistence;

import com.architekt.core.TestProjects;
import com.architekt.core.model.DomainAggregate;
import com.architekt.core.model.Project;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemAggregateRepository}.
 */
class FileSystemAggregateRepositoryTest {

    @TempDir
    Path tempDir;

    private Path dataFile;
    private Path backupDir;

    @BeforeEach
    void setUp() {
        dataFile = tempDir.resolve("data").resolve("architekt.json");
        backupDir = tempDir.resolve("backups");
    }

    @Test
    void load_missingFile_returnsEmptyAggregate() {
        FileSystemAggregateRepository repository = new FileSystemAggregateRepository(dataFile, backupDir, 5);

        assertThat(repository.load("alice").projects()).isEmpty();
    }

    @Test
    void save_thenLoad_returnsEqualAggregate() {
        // Given
        FileSystemAggregateRepository repository = new FileSystemAggregateRepository(dataFile, backupDir, 5);
        Project project = TestProjects.threeSystems();

        // When
        repository.save("alice", DomainAggregate.empty().withProject(project));

        // Then
        assertThat(Files.exists(dataFile)).isTrue();
        DomainAggregate loaded = new FileSystemAggregateRepository(dataFile, backupDir, 5).load("alice");
        assertThat(loaded.projects()).containsOnlyKeys(project.id());
        assertThat(loaded.projects().get(project.id())).isEqualTo(project);
    }

    @Test
    void save_keepsOtherUsersAggregates() {
        FileSystemAggregateRepository repository = new FileSystemAggregateRepository(dataFile, backupDir, 5);
        repository.save("alice", DomainAggregate.empty().withProject(TestProjects.rootOnly()));

        repository.save("bob", DomainAggregate.empty());

        assertThat(repository.load("alice").projects()).hasSize(1);
        assertThat(repository.load("bob").projects()).isEmpty();
    }

    @Test
    void save_overwritingFile_writesBoundedBackups() throws IOException {
        FileSystemAggregateRepository repository = new FileSystemAggregateRepository(dataFile, backupDir, 2);

        for (int i = 0; i < 5; i++) {
            repository.save("alice", DomainAggregate.empty().withProject(TestProjects.rootOnly()));
        }

        try (Stream<Path> backups = Files.list(backupDir)) {
            assertThat(backups.toList())
                .isNotEmpty()
                .hasSizeLessThanOrEqualTo(2)
                .allSatisfy(path -> assertThat(path.getFileName().toString()).startsWith("architekt-"));
        }
    }

    @Test
    void save_withZeroBackups_writesNoBackup() {
        FileSystemAggregateRepository repository = new FileSystemAggregateRepository(dataFile, backupDir, 0);

        repository.save("alice", DomainAggregate.empty());
        repository.save("alice", DomainAggregate.empty());

        assertThat(Files.exists(backupDir)).isFalse();
    }

    @Test
    void load_corruptFile_throwsIllegalStateException() throws IOException {
        Files.createDirectories(dataFile.getParent());
        Files.writeString(dataFile, "{ not json");
        FileSystemAggregateRepository repository = new FileSystemAggregateRepository(dataFile, backupDir, 5);

        assertThatThrownBy(() -> repository.load("alice"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to read data file");
    }

    @Test
    void writeAtomically_moveFails_removesTemporaryFile() throws IOException {
        // Given a target path occupied by a non-empty directory
        Path target = tempDir.resolve("occupied");
        Files.createDirectories(target);
        Files.writeString(target.resolve("keep.txt"), "x");

        // When / Then
        assertThatThrownBy(() -> FileSystemAggregateRepository.writeAtomically(
                AggregateJson.mapper(), target, StoreDocument.empty()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to write data file");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.map(path -> path.getFileName().toString())).containsExactly("occupied");
        }
    }

    @Test
    void constructor_negativeMaxBackups_throwsException() {
        assertThatThrownBy(() -> new FileSystemAggregateRepository(dataFile, backupDir, -1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
