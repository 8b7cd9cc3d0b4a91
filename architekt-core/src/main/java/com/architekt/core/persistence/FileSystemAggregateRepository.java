package com.architekt.core.persistence;

import com.architekt.core.model.DomainAggregate;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Repository storing every user's aggregate in a single JSON document.
 *
 * <p>Saves write the complete document to a temporary file next to the data file and move it
 * into place. Before the data file is replaced, the previous version is copied to the backup
 * directory, keeping at most {@code maxBackups} copies (newest first).
 *
 * <p><b>Document layout:</b>
 * <pre>{@code
 * {
 *   "aggregates": {
 *     "local-user": { "projects": { "<projectId>": { ... } } }
 *   }
 * }
 * }</pre>
 */
public class FileSystemAggregateRepository implements AggregateRepository {

    private static final Logger log = LoggerFactory.getLogger(FileSystemAggregateRepository.class);
    private static final DateTimeFormatter BACKUP_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSSSSS").withZone(ZoneOffset.UTC);

    private final Path dataFile;
    private final Path backupDir;
    private final int maxBackups;
    private final ObjectMapper mapper = AggregateJson.mapper();
    private final Object fileLock = new Object();

    /**
     * Creates a repository.
     *
     * @param dataFile JSON document path
     * @param backupDir directory for backups
     * @param maxBackups number of backups to keep; 0 disables backups
     */
    public FileSystemAggregateRepository(Path dataFile, Path backupDir, int maxBackups) {
        this.dataFile = Objects.requireNonNull(dataFile, "dataFile must not be null").toAbsolutePath();
        this.backupDir = Objects.requireNonNull(backupDir, "backupDir must not be null").toAbsolutePath();
        if (maxBackups < 0) {
            throw new IllegalArgumentException("maxBackups must not be negative: " + maxBackups);
        }
        this.maxBackups = maxBackups;
    }

    @Override
    public DomainAggregate load(String userId) {
        synchronized (fileLock) {
            DomainAggregate aggregate = readDocument().aggregates().get(userId);
            if (aggregate == null) {
                log.debug("No aggregate stored for user {} in {}", userId, dataFile);
                return DomainAggregate.empty();
            }
            return AggregateSanitizer.sanitize(aggregate);
        }
    }

    @Override
    public void save(String userId, DomainAggregate aggregate) {
        Objects.requireNonNull(aggregate, "aggregate must not be null");
        synchronized (fileLock) {
            StoreDocument document = readDocument().with(userId, aggregate);
            backupCurrentFile();
            writeDocument(document);
            log.debug("Saved {} projects for user {} to {}", aggregate.projects().size(), userId, dataFile);
        }
    }

    public Path dataFile() {
        return dataFile;
    }

    private StoreDocument readDocument() {
        if (!Files.exists(dataFile)) {
            return StoreDocument.empty();
        }
        try {
            StoreDocument document = mapper.readValue(dataFile.toFile(), StoreDocument.class);
            return document == null ? StoreDocument.empty() : document;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read data file: " + dataFile, e);
        }
    }

    private void writeDocument(StoreDocument document) {
        writeAtomically(mapper, dataFile, document);
    }

    /**
     * Writes {@code value} to a temporary file next to {@code target} and moves it into place.
     * The temporary file is removed when writing or moving fails.
     */
    static void writeAtomically(ObjectMapper mapper, Path target, Object value) {
        Path directory = target.getParent();
        Path tempFile = null;
        try {
            Files.createDirectories(directory);
            tempFile = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            mapper.writeValue(tempFile.toFile(), value);
            try {
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, replacing data file directly", directory);
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tempFile);
            throw new IllegalStateException("Failed to write data file: " + target, e);
        }
    }

    private static void deleteQuietly(Path tempFile) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}: {}", tempFile, e.getMessage());
        }
    }

    private void backupCurrentFile() {
        if (maxBackups == 0 || !Files.exists(dataFile)) {
            return;
        }
        String baseName = baseName();
        Path backup = backupDir.resolve(baseName + "-" + BACKUP_TIMESTAMP.format(Instant.now()) + ".json");
        try {
            Files.createDirectories(backupDir);
            Files.copy(dataFile, backup, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Backed up {} to {}", dataFile, backup);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to back up data file: " + dataFile, e);
        }
        pruneBackups(baseName);
    }

    private void pruneBackups(String baseName) {
        List<Path> backups;
        try (Stream<Path> files = Files.list(backupDir)) {
            backups = files
                .filter(path -> path.getFileName().toString().startsWith(baseName + "-"))
                .sorted(Comparator.comparing((Path path) -> path.getFileName().toString()).reversed())
                .toList();
        } catch (IOException e) {
            log.warn("Failed to list backups in {}: {}", backupDir, e.getMessage());
            return;
        }
        for (Path stale : backups.subList(Math.min(maxBackups, backups.size()), backups.size())) {
            try {
                Files.deleteIfExists(stale);
                log.debug("Deleted old backup: {}", stale);
            } catch (IOException e) {
                log.warn("Failed to delete old backup {}: {}", stale, e.getMessage());
            }
        }
    }

    private String baseName() {
        String fileName = dataFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
