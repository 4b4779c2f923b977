package com.imageanalysis.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The committed, externally visible result for one image. Immutable.
 * Summary fields of failed analyzers are present with a null value.
 */
public final class ResultSummary {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("fileName")
    private final String fileName;

    @JsonProperty("blobPath")
    private final String blobPath;

    @JsonProperty("analyzedAt")
    private final Instant analyzedAt;

    @JsonProperty("status")
    private final ResultStatus status;

    @JsonProperty("summary")
    private final Map<String, Object> summary;

    @JsonProperty("analyses")
    private final Map<String, Map<String, Object>> analyses;

    @JsonProperty("failedAnalyzers")
    private final List<AnalysisKind> failedAnalyzers;

    @JsonCreator
    public ResultSummary(
            @JsonProperty("id") String id,
            @JsonProperty("fileName") String fileName,
            @JsonProperty("blobPath") String blobPath,
            @JsonProperty("analyzedAt") Instant analyzedAt,
            @JsonProperty("status") ResultStatus status,
            @JsonProperty("summary") Map<String, Object> summary,
            @JsonProperty("analyses") Map<String, Map<String, Object>> analyses,
            @JsonProperty("failedAnalyzers") List<AnalysisKind> failedAnalyzers) {
        this.id = Objects.requireNonNull(id, "id");
        this.fileName = fileName;
        this.blobPath = blobPath;
        this.analyzedAt = analyzedAt;
        this.status = status;
        this.summary = Collections.unmodifiableMap(
                summary != null ? new LinkedHashMap<>(summary) : new LinkedHashMap<>());
        this.analyses = Collections.unmodifiableMap(
                analyses != null ? new LinkedHashMap<>(analyses) : new LinkedHashMap<>());
        this.failedAnalyzers = failedAnalyzers != null ? List.copyOf(failedAnalyzers) : List.of();
    }

    public String getId() {
        return id;
    }

    public String getFileName() {
        return fileName;
    }

    public String getBlobPath() {
        return blobPath;
    }

    public Instant getAnalyzedAt() {
        return analyzedAt;
    }

    public ResultStatus getStatus() {
        return status;
    }

    public Map<String, Object> getSummary() {
        return summary;
    }

    public Map<String, Map<String, Object>> getAnalyses() {
        return analyses;
    }

    public List<AnalysisKind> getFailedAnalyzers() {
        return failedAnalyzers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResultSummary)) {
            return false;
        }
        ResultSummary other = (ResultSummary) o;
        return id.equals(other.id)
                && Objects.equals(fileName, other.fileName)
                && Objects.equals(blobPath, other.blobPath)
                && Objects.equals(analyzedAt, other.analyzedAt)
                && status == other.status
                && summary.equals(other.summary)
                && analyses.equals(other.analyses)
                && failedAnalyzers.equals(other.failedAnalyzers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, fileName, blobPath, analyzedAt, status, summary, analyses, failedAnalyzers);
    }

    @Override
    public String toString() {
        return "ResultSummary{" +
                "id='" + id + '\'' +
                ", fileName='" + fileName + '\'' +
                ", status=" + status +
                ", summary=" + summary +
                '}';
    }
}
