package com.imageanalysis;

import com.imageanalysis.shared.model.ImageRef;
import com.imageanalysis.shared.model.OrchestrationRecord;
import com.imageanalysis.shared.model.OrchestrationStatus;
import com.imageanalysis.shared.storage.LocalImageStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Event source for local storage: polls the image directory and starts an
 * orchestration for every file it has not handed over yet.
 * After a restart every file is offered again; already analysed ones are no-ops.
 */
public class LocalImageEventSource implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(LocalImageEventSource.class);

    private final LocalImageStorage storage;
    private final Path watchDir;
    private final Orchestrator orchestrator;
    private final AtomicBoolean running;
    private final long pollMillis;

    // ids already handed to the orchestrator
    private final Set<String> submitted;

    public LocalImageEventSource(LocalImageStorage storage,
            String imagePrefix,
            Orchestrator orchestrator,
            AtomicBoolean running,
            long pollMillis) {
        this.storage = storage;
        this.watchDir = imagePrefix.isEmpty() ? storage.getRoot() : storage.getRoot().resolve(imagePrefix);
        this.orchestrator = orchestrator;
        this.running = running;
        this.pollMillis = pollMillis;
        this.submitted = ConcurrentHashMap.newKeySet();
    }

    @Override
    public void run() {
        logger.info("Started (watching {})", watchDir);

        while (running.get()) {
            try {
                pollOnce();
                sleep(pollMillis);
            } catch (Exception e) {
                logger.error("Error in LocalImageEventSource: {}", e.getMessage());
                sleep(5000);
            }
        }

        logger.info("Stopped");
    }

    /**
     * One scan of the directory.
     *
     * @return number of images handed to the orchestrator
     */
    public int pollOnce() throws IOException {
        if (!Files.isDirectory(watchDir)) {
            return 0;
        }

        List<Path> files;
        try (Stream<Path> stream = Files.walk(watchDir)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(path -> !path.getFileName().toString().startsWith("."))
                    .sorted()
                    .collect(Collectors.toList());
        }

        int started = 0;
        for (Path file : files) {
            ImageRef image = storage.refFor(file);
            if (submitted.contains(image.getId())) {
                continue;
            }
            OrchestrationRecord record = orchestrator.startOrchestration(image);
            if (record.getStatus() == OrchestrationStatus.FAILED) {
                logger.warn("Skipping unreadable file {}: {}", file, record.getFailureReason());
            }
            submitted.add(image.getId());
            started++;
        }
        return started;
    }

    /**
     * Sleep helper
     */
    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
