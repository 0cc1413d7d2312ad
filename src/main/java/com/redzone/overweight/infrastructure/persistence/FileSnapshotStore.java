package com.redzone.overweight.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.redzone.overweight.domain.exception.SnapshotCorruptException;
import com.redzone.overweight.domain.model.PersistedSnapshot;
import com.redzone.overweight.domain.model.ProductSeries;
import com.redzone.overweight.domain.port.out.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Optional;

/**
 * JSON file implementation of SnapshotStore
 * Every save writes a complete temporary file next to the target and moves it over the target,
 * so a reader only ever sees the previous or the new snapshot
 */
public class FileSnapshotStore implements SnapshotStore {

    private static final Logger logger = LoggerFactory.getLogger(FileSnapshotStore.class);

    private final Path snapshotPath;
    private final ObjectMapper objectMapper;

    public FileSnapshotStore(Path snapshotPath, ObjectMapper objectMapper) {
        this.snapshotPath = snapshotPath.toAbsolutePath();
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void save(ProductSeries series, Instant refreshedAt, int productCount) {
        Path tempFile = null;
        try {
            Path directory = snapshotPath.getParent();
            Files.createDirectories(directory);
            tempFile = Files.createTempFile(directory, snapshotPath.getFileName() + ".", ".tmp");

            byte[] json = objectMapper.writeValueAsBytes(SnapshotDocument.from(series, refreshedAt, productCount));
            Files.write(tempFile, json);
            moveIntoPlace(tempFile);

            logger.debug("Persisted snapshot with {} products to {}", productCount, snapshotPath);
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to persist snapshot to {}", snapshotPath, e);
        } finally {
            deleteLeftover(tempFile);
        }
    }

    @Override
    public Optional<PersistedSnapshot> load() {
        try (InputStream in = Files.newInputStream(snapshotPath)) {
            SnapshotDocument document = objectMapper.readValue(in, SnapshotDocument.class);
            checkShape(document);
            logger.debug("Loaded snapshot from {} refreshed at {}", snapshotPath, document.refreshedAt());
            return Optional.of(document.toPersistedSnapshot());

        } catch (NoSuchFileException e) {
            logger.debug("No snapshot at {}", snapshotPath);
            return Optional.empty();
        } catch (IOException e) {
            throw new SnapshotCorruptException("Snapshot " + snapshotPath + " could not be read", e);
        }
    }

    /**
     * Valid JSON is not enough: every product needs a list of non-null weeks
     */
    private void checkShape(SnapshotDocument document) {
        if (document == null || document.data() == null) {
            throw corrupt("has no data");
        }
        if (document.refreshedAt() == null) {
            throw corrupt("has no refreshed_at");
        }
        document.data().forEach((product, entries) -> {
            if (entries == null || entries.contains(null)) {
                throw corrupt("has a malformed series for " + product);
            }
        });
    }

    private SnapshotCorruptException corrupt(String reason) {
        return new SnapshotCorruptException("Snapshot " + snapshotPath + " " + reason, null);
    }

    private void moveIntoPlace(Path tempFile) throws IOException {
        try {
            Files.move(tempFile, snapshotPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.warn("Atomic move not supported for {}, replacing snapshot non-atomically", snapshotPath);
            Files.move(tempFile, snapshotPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteLeftover(Path tempFile) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            logger.warn("Could not delete temporary snapshot {}: {}", tempFile, e.getMessage());
        }
    }
}
