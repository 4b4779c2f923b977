package com.imageanalysis;

import com.imageanalysis.shared.model.OrchestrationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe registry of orchestrations running in this process.
 * Keeps a second start for the same image from launching a parallel run
 * and lets callers wait for an orchestration to finish.
 */
public class OrchestrationTracker {

    private static final Logger logger = LoggerFactory.getLogger(OrchestrationTracker.class);

    // Map from image id to the in-flight orchestration
    private final ConcurrentHashMap<String, Entry> inFlight;

    private final AtomicInteger completedCount;
    private final AtomicInteger failedCount;

    public OrchestrationTracker() {
        this.inFlight = new ConcurrentHashMap<>();
        this.completedCount = new AtomicInteger(0);
        this.failedCount = new AtomicInteger(0);
    }

    /**
     * Registers an orchestration.
     *
     * @return the new entry, or null if this image is already in flight
     */
    public Entry register(OrchestrationRecord record) {
        Entry entry = new Entry(record);
        Entry existing = inFlight.putIfAbsent(record.getImageId(), entry);
        if (existing != null) {
            logger.debug("Orchestration {} already in flight", record.getImageId());
            return null;
        }
        logger.info("Registered orchestration {} ({} tasks)", record.getImageId(), record.getTasks().size());
        return entry;
    }

    public Entry get(String imageId) {
        return inFlight.get(imageId);
    }

    /**
     * Records a finalized orchestration and wakes up waiters.
     */
    public void complete(String imageId, OrchestrationRecord finalView) {
        Entry entry = inFlight.remove(imageId);
        if (entry == null) {
            logger.warn("Orchestration not found for ID: {}", imageId);
            return;
        }
        completedCount.incrementAndGet();
        entry.completion.complete(finalView);
        logger.info("Orchestration {} complete", imageId);
    }

    /**
     * Drops an orchestration that stopped without finishing. Its persisted record
     * stays behind for recovery.
     */
    public void fail(String imageId, Throwable cause) {
        Entry entry = inFlight.remove(imageId);
        if (entry == null) {
            logger.warn("Orchestration not found for ID: {}", imageId);
            return;
        }
        failedCount.incrementAndGet();
        entry.completion.completeExceptionally(cause);
        logger.info("Removed orchestration {} after failure", imageId);
    }

    /**
     * Drops a registration that turned out to need no run, answering waiters with the given view.
     */
    public void release(String imageId, OrchestrationRecord view) {
        Entry entry = inFlight.remove(imageId);
        if (entry != null) {
            entry.completion.complete(view);
        }
    }

    public boolean hasActive() {
        return !inFlight.isEmpty();
    }

    public int getActiveCount() {
        return inFlight.size();
    }

    public List<String> getActiveIds() {
        return new ArrayList<>(inFlight.keySet());
    }

    public int getCompletedCount() {
        return completedCount.get();
    }

    public int getFailedCount() {
        return failedCount.get();
    }

    /**
     * One in-flight orchestration. The record is the live instance the
     * orchestrator mutates, guarded by its own monitor.
     */
    public static class Entry {
        private final OrchestrationRecord record;
        private final CompletableFuture<OrchestrationRecord> completion;
        private final Instant registeredAt;

        Entry(OrchestrationRecord record) {
            this.record = record;
            this.completion = new CompletableFuture<>();
            this.registeredAt = Instant.now();
        }

        public OrchestrationRecord getRecord() {
            return record;
        }

        public CompletableFuture<OrchestrationRecord> getCompletion() {
            return completion;
        }

        public Instant getRegisteredAt() {
            return registeredAt;
        }

        public OrchestrationRecord snapshot() {
            synchronized (record) {
                return record.snapshot();
            }
        }
    }
}
