package com.imageanalysis.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Durable progress of one image through the analyzer roster.
 * The task set is fixed when the record is created and never changes afterwards.
 */
public class OrchestrationRecord {

    @JsonProperty("imageRef")
    private final ImageRef imageRef;

    @JsonProperty("tasks")
    private final Map<AnalysisKind, AnalysisTask> tasks;

    @JsonProperty("status")
    private OrchestrationStatus status;

    @JsonProperty("createdAt")
    private final Instant createdAt;

    @JsonProperty("completedAt")
    private Instant completedAt;

    @JsonProperty("failureReason")
    private String failureReason;

    @JsonProperty("owner")
    private String owner;

    @JsonProperty("leaseExpiresAt")
    private Instant leaseExpiresAt;

    @JsonProperty("version")
    private long version;

    @JsonCreator
    public OrchestrationRecord(
            @JsonProperty("imageRef") ImageRef imageRef,
            @JsonProperty("tasks") Map<AnalysisKind, AnalysisTask> tasks,
            @JsonProperty("status") OrchestrationStatus status,
            @JsonProperty("createdAt") Instant createdAt,
            @JsonProperty("completedAt") Instant completedAt,
            @JsonProperty("failureReason") String failureReason,
            @JsonProperty("owner") String owner,
            @JsonProperty("leaseExpiresAt") Instant leaseExpiresAt,
            @JsonProperty("version") long version) {
        this.imageRef = imageRef;
        EnumMap<AnalysisKind, AnalysisTask> taskMap = new EnumMap<>(AnalysisKind.class);
        if (tasks != null) {
            taskMap.putAll(tasks);
        }
        this.tasks = Collections.unmodifiableMap(taskMap);
        this.status = status;
        this.createdAt = createdAt;
        this.completedAt = completedAt;
        this.failureReason = failureReason;
        this.owner = owner;
        this.leaseExpiresAt = leaseExpiresAt;
        this.version = version;
    }

    /**
     * New running record with one pending task per roster kind.
     */
    public static OrchestrationRecord create(ImageRef imageRef, Collection<AnalysisKind> roster, Instant now) {
        if (roster.isEmpty()) {
            throw new IllegalArgumentException("Analyzer roster must not be empty");
        }
        Map<AnalysisKind, AnalysisTask> tasks = new EnumMap<>(AnalysisKind.class);
        for (AnalysisKind kind : roster) {
            tasks.put(kind, new AnalysisTask(kind));
        }
        return new OrchestrationRecord(imageRef, tasks, OrchestrationStatus.RUNNING, now,
                null, null, null, null, 0);
    }

    /**
     * Record for an image that could not be read. Carries no tasks.
     */
    public static OrchestrationRecord failed(ImageRef imageRef, String reason, Instant now) {
        return new OrchestrationRecord(imageRef, Map.of(), OrchestrationStatus.FAILED, now,
                now, reason, null, null, 0);
    }

    /**
     * View of an image whose result is already committed.
     */
    public static OrchestrationRecord alreadyCompleted(ImageRef imageRef, Instant completedAt) {
        return new OrchestrationRecord(imageRef, Map.of(), OrchestrationStatus.COMPLETED, completedAt,
                completedAt, null, null, null, 0);
    }

    public OrchestrationRecord snapshot() {
        Map<AnalysisKind, AnalysisTask> copies = new EnumMap<>(AnalysisKind.class);
        tasks.forEach((kind, task) -> copies.put(kind, task.copy()));
        return new OrchestrationRecord(imageRef, copies, status, createdAt, completedAt,
                failureReason, owner, leaseExpiresAt, version);
    }

    public AnalysisTask getTask(AnalysisKind kind) {
        AnalysisTask task = tasks.get(kind);
        if (task == null) {
            throw new IllegalArgumentException("No " + kind + " task for image " + imageRef.getId());
        }
        return task;
    }

    @JsonIgnore
    public boolean isAllTasksTerminal() {
        return tasks.values().stream().allMatch(AnalysisTask::isTerminal);
    }

    @JsonIgnore
    public List<AnalysisTask> getOpenTasks() {
        return tasks.values().stream()
                .filter(task -> !task.isTerminal())
                .collect(Collectors.toList());
    }

    /**
     * Fixes the completion time used as the result's analyzedAt, so a repeated
     * finalize writes the same result. Keeps the first stamp.
     */
    public void stampCompletion(Instant now) {
        if (!isAllTasksTerminal()) {
            throw new IllegalStateException("Cannot finalize " + imageRef.getId() + " with open tasks");
        }
        if (completedAt == null) {
            completedAt = now;
        }
    }

    public void markCompleted() {
        if (completedAt == null) {
            throw new IllegalStateException("Completion time not stamped for " + imageRef.getId());
        }
        this.status = OrchestrationStatus.COMPLETED;
    }

    /**
     * Called before every save by the owning process.
     */
    public void renewLease(String owner, Instant leaseExpiresAt) {
        this.owner = owner;
        this.leaseExpiresAt = leaseExpiresAt;
        this.version++;
    }

    @JsonIgnore
    public boolean isLeaseExpired(Instant now) {
        return leaseExpiresAt == null || !leaseExpiresAt.isAfter(now);
    }

    @JsonIgnore
    public String getImageId() {
        return imageRef.getId();
    }

    public ImageRef getImageRef() {
        return imageRef;
    }

    public Map<AnalysisKind, AnalysisTask> getTasks() {
        return tasks;
    }

    public OrchestrationStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public String getOwner() {
        return owner;
    }

    public Instant getLeaseExpiresAt() {
        return leaseExpiresAt;
    }

    public long getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "OrchestrationRecord{" +
                "imageId='" + imageRef.getId() + '\'' +
                ", status=" + status +
                ", tasks=" + tasks.values() +
                ", version=" + version +
                '}';
    }
}
