package com.imageanalysis.shared.model;

import java.time.Instant;
import java.util.Locale;

/**
 * Optional criteria for listing results. Null fields match everything.
 */
public class ResultFilter {

    private static final ResultFilter NONE = new ResultFilter(null, null, null);

    private final String fileNameContains;
    private final Instant analyzedAfter;
    private final ResultStatus status;

    public ResultFilter(String fileNameContains, Instant analyzedAfter, ResultStatus status) {
        this.fileNameContains = fileNameContains == null || fileNameContains.isBlank()
                ? null
                : fileNameContains.toLowerCase(Locale.ROOT);
        this.analyzedAfter = analyzedAfter;
        this.status = status;
    }

    public static ResultFilter none() {
        return NONE;
    }

    public boolean matches(ResultSummary summary) {
        if (fileNameContains != null) {
            String fileName = summary.getFileName();
            if (fileName == null || !fileName.toLowerCase(Locale.ROOT).contains(fileNameContains)) {
                return false;
            }
        }
        if (analyzedAfter != null
                && (summary.getAnalyzedAt() == null || !summary.getAnalyzedAt().isAfter(analyzedAfter))) {
            return false;
        }
        return status == null || status == summary.getStatus();
    }

    public String getFileNameContains() {
        return fileNameContains;
    }

    public Instant getAnalyzedAfter() {
        return analyzedAfter;
    }

    public ResultStatus getStatus() {
        return status;
    }
}
