package com.imageanalysis;

import com.imageanalysis.analyzer.AnalysisException;
import com.imageanalysis.analyzer.AnalysisOutput;
import com.imageanalysis.analyzer.Analyzer;
import com.imageanalysis.analyzer.AnalyzerRegistry;
import com.imageanalysis.shared.model.AnalysisKind;
import com.imageanalysis.shared.model.AnalysisTask;
import com.imageanalysis.shared.model.ImageRef;
import com.imageanalysis.shared.model.OrchestrationRecord;
import com.imageanalysis.shared.model.OrchestrationStatus;
import com.imageanalysis.shared.model.ResultSummary;
import com.imageanalysis.shared.model.TaskStatus;
import com.imageanalysis.shared.storage.ImageStorage;
import com.imageanalysis.shared.storage.ImageUnreadableException;
import com.imageanalysis.shared.storage.ObjectInfo;
import com.imageanalysis.shared.store.LeaseLostException;
import com.imageanalysis.shared.store.OrchestrationStateStore;
import com.imageanalysis.shared.store.ResultStore;
import com.imageanalysis.shared.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Runs every analyzer of the roster against an image and merges their outputs
 * into one ResultSummary.
 * <p>
 * The orchestration record is persisted before any analyzer runs and after every
 * task transition, so a restarted process can pick up where a dead one stopped.
 * Finalize only happens once all tasks are terminal and writes the result with an
 * upsert keyed by image id, so running it twice is harmless.
 * <p>
 * Three pools: orchestrations, per-task drivers, and the analyzer calls themselves.
 * Analyzer calls run on their own pool so a timed-out attempt can be interrupted.
 * A task's timeout includes the time its attempt waits for a free analyzer thread.
 */
public class Orchestrator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Orchestrator.class);

    private static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(30);

    private final OrchestrationStateStore stateStore;
    private final ResultStore resultStore;
    private final ImageStorage imageStorage;
    private final AnalyzerRegistry registry;
    private final OrchestratorSettings settings;
    private final String ownerId;
    private final Clock clock;
    private final OrchestrationTracker tracker;

    private final ExecutorService orchestrationPool;
    private final ExecutorService taskPool;
    private final ExecutorService analyzerPool;
    private final AtomicBoolean accepting;

    public Orchestrator(OrchestrationStateStore stateStore,
            ResultStore resultStore,
            ImageStorage imageStorage,
            AnalyzerRegistry registry,
            OrchestratorSettings settings,
            String ownerId,
            Clock clock) {
        this.stateStore = stateStore;
        this.resultStore = resultStore;
        this.imageStorage = imageStorage;
        this.registry = registry;
        this.settings = settings;
        this.ownerId = ownerId;
        this.clock = clock;
        this.tracker = new OrchestrationTracker();

        this.orchestrationPool = Executors.newFixedThreadPool(settings.getOrchestrationThreads());
        this.taskPool = Executors.newCachedThreadPool();
        this.analyzerPool = Executors.newFixedThreadPool(settings.getAnalyzerPoolSize());
        this.accepting = new AtomicBoolean(true);

        logger.info("Initialized (owner: {}, roster: {}, analyzer threads: {}, {})",
                ownerId, registry.roster(), settings.getAnalyzerPoolSize(), settings);
    }

    /**
     * Starts analysing an image. Safe to call any number of times for the same image.
     *
     * @return the in-flight or persisted record, a COMPLETED view if the result already
     *         exists, or a FAILED view if the image cannot be read
     * @throws StoreException if a store could not be reached; the caller should retry
     */
    public OrchestrationRecord startOrchestration(ImageRef image) {
        if (!accepting.get()) {
            throw new IllegalStateException("Orchestrator is shutting down");
        }
        String imageId = image.getId();

        OrchestrationTracker.Entry running = tracker.get(imageId);
        if (running != null) {
            logger.debug("Orchestration {} already running here", imageId);
            return running.snapshot();
        }

        OrchestrationRecord record = OrchestrationRecord.create(image, registry.roster(), clock.instant());
        record.renewLease(ownerId, clock.instant().plus(settings.getLease()));

        OrchestrationTracker.Entry entry = tracker.register(record);
        if (entry == null) {
            OrchestrationTracker.Entry other = tracker.get(imageId);
            if (other != null) {
                return other.snapshot();
            }
            return existingView(image).orElseThrow(() ->
                    new StoreException("Orchestration " + imageId + " finished but left no trace"));
        }

        try {
            Optional<OrchestrationRecord> existing = existingView(image);
            if (existing.isPresent()) {
                logger.info("Image {} already {}; nothing to start", imageId, existing.get().getStatus());
                tracker.release(imageId, existing.get());
                return existing.get();
            }

            try {
                ObjectInfo info = imageStorage.probe(image);
                logger.debug("Probed {} ({} bytes, {})", image.getBlobPath(), info.getSizeBytes(), info.getContentType());
            } catch (ImageUnreadableException e) {
                logger.warn("Image {} unreadable: {}", image.getBlobPath(), e.getMessage());
                OrchestrationRecord failed = OrchestrationRecord.failed(image, e.getMessage(), clock.instant());
                tracker.release(imageId, failed);
                return failed;
            }

            if (!stateStore.create(record)) {
                OrchestrationRecord other = existingView(image).orElseThrow(() ->
                        new StoreException("Orchestration " + imageId + " exists but cannot be loaded"));
                tracker.release(imageId, other);
                return other;
            }

            OrchestrationRecord started = entry.snapshot();
            orchestrationPool.submit(() -> run(entry));
            logger.info("Started orchestration {} for {}", imageId, image.getBlobPath());
            return started;

        } catch (RuntimeException e) {
            tracker.fail(imageId, e);
            throw e;
        }
    }

    /**
     * Resumes persisted orchestrations that are not running in this process.
     * Each one is claimed through its lease first, so two processes never drive the same record.
     *
     * @return number of orchestrations resumed
     */
    public int recover() {
        List<OrchestrationRecord> incomplete = stateStore.listIncomplete();
        int resumed = 0;

        for (OrchestrationRecord stored : incomplete) {
            String imageId = stored.getImageId();
            if (!accepting.get()) {
                break;
            }
            if (stored.getStatus() != OrchestrationStatus.RUNNING || tracker.get(imageId) != null) {
                continue;
            }

            try {
                if (!stateStore.claim(imageId, ownerId, settings.getLease())) {
                    logger.debug("Orchestration {} is owned by {}", imageId, stored.getOwner());
                    continue;
                }
                Optional<OrchestrationRecord> claimed = stateStore.load(imageId);
                if (claimed.isEmpty()) {
                    continue;
                }

                OrchestrationTracker.Entry entry = tracker.register(claimed.get());
                if (entry == null) {
                    continue;
                }
                logger.info("Resuming orchestration {} with open tasks {}", imageId,
                        claimed.get().getOpenTasks().stream().map(AnalysisTask::getKind).collect(Collectors.toList()));
                orchestrationPool.submit(() -> run(entry));
                resumed++;

            } catch (StoreException e) {
                logger.warn("Could not resume orchestration {}: {}", imageId, e.getMessage());
            }
        }

        if (!incomplete.isEmpty()) {
            logger.info("Recovery scan: {} incomplete, {} resumed", incomplete.size(), resumed);
        }
        return resumed;
    }

    /**
     * Waits for an orchestration to finish.
     *
     * @return the final record, a COMPLETED view if it finished earlier, or empty if the image is unknown
     */
    public Optional<OrchestrationRecord> awaitCompletion(String imageId, Duration timeout)
            throws InterruptedException, TimeoutException {
        OrchestrationTracker.Entry entry = tracker.get(imageId);
        if (entry != null) {
            try {
                return Optional.of(entry.getCompletion().get(timeout.toMillis(), TimeUnit.MILLISECONDS));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new StoreException("Orchestration " + imageId + " failed", cause);
            }
        }

        Optional<ResultSummary> result = resultStore.get(imageId);
        if (result.isPresent()) {
            return Optional.of(completedView(result.get()));
        }
        return stateStore.load(imageId);
    }

    public OrchestrationTracker getTracker() {
        return tracker;
    }

    public String getOwnerId() {
        return ownerId;
    }

    /**
     * Stops accepting work, lets running orchestrations finish within the timeout, then interrupts the rest.
     * Anything left unfinished stays persisted for recovery.
     */
    public void shutdown(Duration drainTimeout) {
        if (!accepting.getAndSet(false)) {
            return;
        }
        logger.info("Shutting down ({} orchestrations in flight)", tracker.getActiveCount());

        orchestrationPool.shutdown();
        try {
            if (!orchestrationPool.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Orchestrations still running after {}; interrupting", drainTimeout);
                orchestrationPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            orchestrationPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        taskPool.shutdownNow();
        analyzerPool.shutdownNow();

        logger.info("Shutdown complete (completed: {}, failed: {})",
                tracker.getCompletedCount(), tracker.getFailedCount());
    }

    @Override
    public void close() {
        shutdown(DEFAULT_DRAIN_TIMEOUT);
    }

    private void run(OrchestrationTracker.Entry entry) {
        OrchestrationRecord record = entry.getRecord();
        String imageId = record.getImageId();
        try {
            dispatchAll(record);
            finalizeOrchestration(record);
            tracker.complete(imageId, entry.snapshot());

        } catch (LeaseLostException e) {
            logger.warn("Lost lease on orchestration {}; abandoning it", imageId);
            tracker.fail(imageId, e);
        } catch (CancellationException e) {
            logger.warn("Orchestration {} interrupted; left for recovery", imageId);
            tracker.fail(imageId, e);
        } catch (RuntimeException e) {
            logger.error("Orchestration {} stopped: {}. Left for recovery", imageId, e.getMessage());
            tracker.fail(imageId, e);
        }
    }

    /**
     * Fan-out of every open task, then fan-in: returns once all of them are terminal.
     */
    private void dispatchAll(OrchestrationRecord record) {
        List<AnalysisKind> open;
        synchronized (record) {
            open = record.getOpenTasks().stream().map(AnalysisTask::getKind).collect(Collectors.toList());
        }

        CompletableFuture<?>[] drivers = open.stream()
                .map(kind -> CompletableFuture.runAsync(() -> driveTask(record, kind), taskPool))
                .toArray(CompletableFuture[]::new);

        try {
            CompletableFuture.allOf(drivers).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    /**
     * Attempts one task until it succeeds or runs out of attempts. A resumed task keeps
     * its attempt count but always gets at least one more attempt.
     */
    private void driveTask(OrchestrationRecord record, AnalysisKind kind) {
        String imageId = record.getImageId();
        if (!registry.contains(kind)) {
            logger.error("No analyzer registered for {} task of {}", kind, imageId);
            mutate(record, r -> r.getTask(kind).markFailed("No analyzer registered for " + kind, clock.instant()));
            return;
        }
        Analyzer analyzer = registry.get(kind);

        int previousAttempts;
        synchronized (record) {
            previousAttempts = record.getTask(kind).getAttempts();
        }
        int maxAttempts = Math.max(1 + settings.getMaxRetries(), previousAttempts + 1);

        for (int attempt = previousAttempts + 1; attempt <= maxAttempts; attempt++) {
            final int current = attempt;
            boolean lastAttempt = attempt == maxAttempts;
            mutate(record, r -> r.getTask(kind).markRunning(current, clock.instant()));

            String error;
            try {
                AnalysisOutput output = invoke(analyzer, record.getImageRef(), attempt);
                List<String> missing = output.missing(analyzer.requiredFields());
                if (missing.isEmpty()) {
                    mutate(record, r -> r.getTask(kind).markSucceeded(output.getFields(), clock.instant()));
                    logger.info("{} analysis of {} succeeded on attempt {}", kind, imageId, attempt);
                    return;
                }
                error = "Malformed output, missing fields " + missing;
                logger.error("Contract violation by {} analyzer on {} attempt {}: missing fields {}",
                        kind, imageId, attempt, missing);

            } catch (TimeoutException e) {
                error = "Timed out after " + settings.getTaskTimeout().toMillis() + " ms";
                logger.warn("{} analysis of {} timed out on attempt {}", kind, imageId, attempt);
                String timeoutError = error;
                mutate(record, r -> r.getTask(kind).markTimedOut(timeoutError, clock.instant()));

            } catch (AnalysisException e) {
                error = e.getMessage();
                logger.warn("{} analysis of {} failed on attempt {}: {}", kind, imageId, attempt, error);
            }

            String finalError = error;
            if (lastAttempt) {
                mutate(record, r -> r.getTask(kind).markFailed(finalError, clock.instant()));
                logger.error("{} analysis of {} failed after {} attempts: {}", kind, imageId, attempt, error);
                return;
            }
            mutate(record, r -> {
                AnalysisTask task = r.getTask(kind);
                if (task.getStatus() != TaskStatus.TIMED_OUT) {
                    task.markRetryPending(finalError, clock.instant());
                }
            });
            sleep(settings.getRetryBackoff().toMillis() * attempt);
        }
    }

    /**
     * One analyzer call under the task timeout. Runtime faults of the analyzer become
     * AnalysisException; a late result of a timed-out call is dropped.
     */
    private AnalysisOutput invoke(Analyzer analyzer, ImageRef image, int attempt)
            throws AnalysisException, TimeoutException {
        Future<AnalysisOutput> call = analyzerPool.submit(() -> analyzer.run(image, attempt));
        try {
            AnalysisOutput output = call.get(settings.getTaskTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (output == null) {
                throw new AnalysisException("Analyzer returned no output");
            }
            return output;
        } catch (TimeoutException e) {
            call.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AnalysisException) {
                throw (AnalysisException) cause;
            }
            throw new AnalysisException("Analyzer fault: " + cause, cause);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for " + analyzer.kind());
        }
    }

    /**
     * Finalize with a bounded number of attempts. If the stores stay unavailable the
     * record is left as is and recovery finalizes it later.
     */
    private void finalizeOrchestration(OrchestrationRecord record) {
        StoreException lastError = null;
        for (int attempt = 1; attempt <= settings.getFinalizeAttempts(); attempt++) {
            try {
                finalizeOnce(record);
                return;
            } catch (LeaseLostException e) {
                throw e;
            } catch (StoreException e) {
                lastError = e;
                logger.warn("Finalize of {} failed (attempt {}): {}", record.getImageId(), attempt, e.getMessage());
                if (attempt < settings.getFinalizeAttempts()) {
                    sleep(settings.getRetryBackoff().toMillis() * attempt);
                }
            }
        }
        throw lastError;
    }

    private void finalizeOnce(OrchestrationRecord record) {
        ResultSummary summary;
        synchronized (record) {
            record.stampCompletion(clock.instant());
            persist(record);
            summary = ResultSummaryBuilder.build(record);
        }

        resultStore.upsert(summary);
        stateStore.delete(record.getImageId());

        synchronized (record) {
            record.markCompleted();
        }
        logger.info("Finalized {} ({}, failed analyzers: {})",
                record.getImageId(), summary.getStatus(), summary.getFailedAnalyzers());
    }

    private void mutate(OrchestrationRecord record, Consumer<OrchestrationRecord> change) {
        synchronized (record) {
            change.accept(record);
            persist(record);
        }
    }

    // caller holds the record's monitor
    private void persist(OrchestrationRecord record) {
        record.renewLease(ownerId, clock.instant().plus(settings.getLease()));
        stateStore.save(record);
    }

    private Optional<OrchestrationRecord> existingView(ImageRef image) {
        Optional<OrchestrationRecord> persisted = stateStore.load(image.getId());
        if (persisted.isPresent()) {
            return persisted;
        }
        return resultStore.get(image.getId())
                .map(result -> OrchestrationRecord.alreadyCompleted(image, result.getAnalyzedAt()));
    }

    private OrchestrationRecord completedView(ResultSummary result) {
        String blobPath = result.getBlobPath() != null ? result.getBlobPath() : "";
        int slash = blobPath.indexOf('/');
        String bucket = slash > 0 ? blobPath.substring(0, slash) : "";
        String key = slash > 0 ? blobPath.substring(slash + 1) : blobPath;
        ImageRef ref = new ImageRef(result.getId(), bucket, key, result.getFileName(), 0, null);
        return OrchestrationRecord.alreadyCompleted(ref, result.getAnalyzedAt());
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted during backoff");
        }
    }
}
