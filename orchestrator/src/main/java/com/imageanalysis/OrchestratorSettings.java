package com.imageanalysis;

import com.imageanalysis.shared.AppConfig;
import com.imageanalysis.shared.model.AnalysisKind;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tuning knobs of the orchestrator, loaded eagerly so a bad value fails at startup.
 */
public class OrchestratorSettings {

    // Config Keys
    public static final String ANALYZERS_KEY = "ANALYZERS";
    public static final String TASK_TIMEOUT_KEY = "TASK_TIMEOUT_SECONDS";
    public static final String MAX_RETRIES_KEY = "TASK_MAX_RETRIES";
    public static final String RETRY_BACKOFF_KEY = "RETRY_BACKOFF_MILLIS";
    public static final String LEASE_KEY = "LEASE_SECONDS";
    public static final String ORCHESTRATION_THREADS_KEY = "ORCHESTRATION_THREADS";
    public static final String ANALYZER_THREADS_KEY = "ANALYZER_THREADS";

    private static final int FINALIZE_ATTEMPTS = 3;

    private final List<AnalysisKind> roster;
    private final Duration taskTimeout;
    private final int maxRetries;
    private final Duration retryBackoff;
    private final Duration lease;
    private final int orchestrationThreads;
    private final int analyzerThreads;
    private final int finalizeAttempts;

    public OrchestratorSettings(List<AnalysisKind> roster,
            Duration taskTimeout,
            int maxRetries,
            Duration retryBackoff,
            Duration lease,
            int orchestrationThreads,
            int analyzerThreads,
            int finalizeAttempts) {
        if (roster.isEmpty()) {
            throw new IllegalArgumentException("Analyzer roster must not be empty");
        }
        if (taskTimeout.isZero() || taskTimeout.isNegative()) {
            throw new IllegalArgumentException("Task timeout must be positive: " + taskTimeout);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries must not be negative: " + maxRetries);
        }
        if (orchestrationThreads < 1 || analyzerThreads < 1 || finalizeAttempts < 1) {
            throw new IllegalArgumentException("Thread counts and finalize attempts must be at least 1");
        }
        // Every transition renews the lease, and the longest quiet stretch is one
        // attempt plus the largest backoff before the next one
        Duration longestGap = taskTimeout.plus(retryBackoff.multipliedBy(maxRetries));
        if (lease.compareTo(longestGap) <= 0) {
            throw new IllegalArgumentException("Lease " + lease
                    + " must be longer than task timeout plus retry backoff (" + longestGap + ")");
        }
        this.roster = List.copyOf(roster);
        this.taskTimeout = taskTimeout;
        this.maxRetries = maxRetries;
        this.retryBackoff = retryBackoff;
        this.lease = lease;
        this.orchestrationThreads = orchestrationThreads;
        this.analyzerThreads = analyzerThreads;
        this.finalizeAttempts = finalizeAttempts;
    }

    public static OrchestratorSettings fromConfig(AppConfig config) {
        List<AnalysisKind> roster = config.getListOptional(ANALYZERS_KEY, "COLOR,OBJECTS,TEXT,METADATA")
                .stream()
                .map(AnalysisKind::parse)
                .distinct()
                .collect(Collectors.toList());

        return new OrchestratorSettings(
                roster,
                config.getSecondsOptional(TASK_TIMEOUT_KEY, 30),
                config.getIntOptional(MAX_RETRIES_KEY, 2),
                config.getMillisOptional(RETRY_BACKOFF_KEY, 500),
                config.getSecondsOptional(LEASE_KEY, 300),
                config.getIntOptional(ORCHESTRATION_THREADS_KEY, 4),
                config.getIntOptional(ANALYZER_THREADS_KEY, 8),
                FINALIZE_ATTEMPTS);
    }

    public List<AnalysisKind> getRoster() {
        return roster;
    }

    public Duration getTaskTimeout() {
        return taskTimeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public Duration getLease() {
        return lease;
    }

    public int getOrchestrationThreads() {
        return orchestrationThreads;
    }

    public int getAnalyzerThreads() {
        return analyzerThreads;
    }

    /**
     * Analyzer threads actually started. Never fewer than one per task of every
     * concurrent orchestration, so an attempt's timeout is not spent waiting in the queue.
     */
    public int getAnalyzerPoolSize() {
        return Math.max(analyzerThreads, orchestrationThreads * roster.size());
    }

    public int getFinalizeAttempts() {
        return finalizeAttempts;
    }

    @Override
    public String toString() {
        return "OrchestratorSettings{" +
                "roster=" + roster +
                ", taskTimeout=" + taskTimeout +
                ", maxRetries=" + maxRetries +
                ", retryBackoff=" + retryBackoff +
                ", lease=" + lease +
                ", orchestrationThreads=" + orchestrationThreads +
                ", analyzerThreads=" + analyzerThreads +
                '}';
    }
}
