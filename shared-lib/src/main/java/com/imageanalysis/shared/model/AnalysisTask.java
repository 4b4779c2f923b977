package com.imageanalysis.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One analyzer run for one image. Only the orchestrator mutates it.
 */
public class AnalysisTask {

    @JsonProperty("kind")
    private final AnalysisKind kind;

    @JsonProperty("status")
    private TaskStatus status;

    @JsonProperty("attempts")
    private int attempts;

    @JsonProperty("output")
    private Map<String, Object> output;

    @JsonProperty("lastError")
    private String lastError;

    @JsonProperty("updatedAt")
    private Instant updatedAt;

    public AnalysisTask(AnalysisKind kind) {
        this(kind, TaskStatus.PENDING, 0, null, null, null);
    }

    @JsonCreator
    public AnalysisTask(
            @JsonProperty("kind") AnalysisKind kind,
            @JsonProperty("status") TaskStatus status,
            @JsonProperty("attempts") int attempts,
            @JsonProperty("output") Map<String, Object> output,
            @JsonProperty("lastError") String lastError,
            @JsonProperty("updatedAt") Instant updatedAt) {
        this.kind = kind;
        this.status = status != null ? status : TaskStatus.PENDING;
        this.attempts = attempts;
        this.output = output != null ? new LinkedHashMap<>(output) : null;
        this.lastError = lastError;
        this.updatedAt = updatedAt;
    }

    public AnalysisTask copy() {
        return new AnalysisTask(kind, status, attempts, output, lastError, updatedAt);
    }

    public void markRunning(int attempt, Instant now) {
        requireNotTerminal();
        this.status = TaskStatus.RUNNING;
        this.attempts = attempt;
        this.updatedAt = now;
    }

    /**
     * Only the terminal attempt's output is kept; earlier errors are cleared.
     */
    public void markSucceeded(Map<String, Object> fields, Instant now) {
        requireNotTerminal();
        this.status = TaskStatus.SUCCEEDED;
        this.output = new LinkedHashMap<>(fields);
        this.lastError = null;
        this.updatedAt = now;
    }

    public void markTimedOut(String error, Instant now) {
        requireNotTerminal();
        this.status = TaskStatus.TIMED_OUT;
        this.lastError = error;
        this.updatedAt = now;
    }

    /**
     * Failed attempt with retries left.
     */
    public void markRetryPending(String error, Instant now) {
        requireNotTerminal();
        this.status = TaskStatus.PENDING;
        this.lastError = error;
        this.updatedAt = now;
    }

    public void markFailed(String error, Instant now) {
        requireNotTerminal();
        this.status = TaskStatus.FAILED;
        this.output = null;
        this.lastError = error;
        this.updatedAt = now;
    }

    private void requireNotTerminal() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Task " + kind + " is already " + status);
        }
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    public AnalysisKind getKind() {
        return kind;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public int getAttempts() {
        return attempts;
    }

    public Map<String, Object> getOutput() {
        return output == null ? null : Collections.unmodifiableMap(output);
    }

    public String getLastError() {
        return lastError;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "AnalysisTask{" +
                "kind=" + kind +
                ", status=" + status +
                ", attempts=" + attempts +
                (lastError != null ? ", lastError='" + lastError + '\'' : "") +
                '}';
    }
}
