package com.imageanalysis.shared.store;

import com.imageanalysis.shared.json.Json;
import com.imageanalysis.shared.model.OrchestrationRecord;
import com.imageanalysis.shared.model.OrchestrationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Orchestration state as one JSON file per image under a local directory.
 * Conditional operations are serialized on this instance, so the directory
 * must not be shared between processes.
 */
public class FileOrchestrationStateStore implements OrchestrationStateStore {

    private static final Logger logger = LoggerFactory.getLogger(FileOrchestrationStateStore.class);

    private final Path directory;
    private final Clock clock;

    public FileOrchestrationStateStore(Path directory) {
        this(directory, Clock.systemUTC());
    }

    public FileOrchestrationStateStore(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StoreException("Cannot create state directory " + directory, e);
        }
        logger.info("Using local orchestration state at {}", directory.toAbsolutePath());
    }

    @Override
    public synchronized boolean create(OrchestrationRecord record) {
        Path file = JsonFiles.fileFor(directory, record.getImageId());
        if (Files.exists(file)) {
            return false;
        }
        write(file, record);
        return true;
    }

    @Override
    public synchronized void save(OrchestrationRecord record) {
        Path file = JsonFiles.fileFor(directory, record.getImageId());
        Optional<OrchestrationRecord> stored = readRecord(file);
        // A missing record was finalized or removed by whoever held it last
        if (stored.isEmpty() || !Objects.equals(stored.get().getOwner(), record.getOwner())) {
            throw new LeaseLostException(record.getImageId(), record.getOwner());
        }
        write(file, record);
    }

    @Override
    public synchronized Optional<OrchestrationRecord> load(String imageId) {
        return readRecord(JsonFiles.fileFor(directory, imageId));
    }

    @Override
    public synchronized List<OrchestrationRecord> listIncomplete() {
        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream.filter(JsonFiles::isRecordFile).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new StoreException("Cannot list " + directory, e);
        }

        List<OrchestrationRecord> incomplete = new ArrayList<>();
        for (Path file : files) {
            readRecord(file)
                    .filter(record -> record.getStatus() != OrchestrationStatus.COMPLETED)
                    .ifPresent(incomplete::add);
        }
        return incomplete;
    }

    @Override
    public synchronized boolean claim(String imageId, String owner, Duration lease) {
        Path file = JsonFiles.fileFor(directory, imageId);
        Optional<OrchestrationRecord> stored = readRecord(file);
        if (stored.isEmpty() || stored.get().getStatus() != OrchestrationStatus.RUNNING) {
            return false;
        }
        OrchestrationRecord record = stored.get();
        Instant now = clock.instant();
        if (!owner.equals(record.getOwner()) && !record.isLeaseExpired(now)) {
            logger.debug("Orchestration {} is leased by {} until {}",
                    imageId, record.getOwner(), record.getLeaseExpiresAt());
            return false;
        }
        record.renewLease(owner, now.plus(lease));
        write(file, record);
        return true;
    }

    @Override
    public synchronized void delete(String imageId) {
        try {
            Files.deleteIfExists(JsonFiles.fileFor(directory, imageId));
        } catch (IOException e) {
            throw new StoreException("Cannot delete orchestration " + imageId, e);
        }
    }

    private void write(Path file, OrchestrationRecord record) {
        try {
            JsonFiles.writeAtomically(file, Json.toJson(record));
        } catch (IOException e) {
            throw new StoreException("Cannot write orchestration " + record.getImageId(), e);
        }
    }

    private Optional<OrchestrationRecord> readRecord(Path file) {
        try {
            return JsonFiles.read(file).map(json -> Json.fromJson(json, OrchestrationRecord.class));
        } catch (IOException e) {
            throw new StoreException("Cannot read " + file, e);
        }
    }
}
