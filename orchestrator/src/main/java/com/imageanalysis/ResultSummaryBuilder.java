package com.imageanalysis;

import com.imageanalysis.shared.model.AnalysisKind;
import com.imageanalysis.shared.model.AnalysisTask;
import com.imageanalysis.shared.model.OrchestrationRecord;
import com.imageanalysis.shared.model.ResultStatus;
import com.imageanalysis.shared.model.ResultSummary;
import com.imageanalysis.shared.model.TaskStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the terminal task outputs of a record into its ResultSummary.
 * Works only from the record, so building twice yields the same summary.
 */
public final class ResultSummaryBuilder {

    static final String NO_COLOR = "N/A";

    private ResultSummaryBuilder() {
    }

    public static ResultSummary build(OrchestrationRecord record) {
        if (record.getCompletedAt() == null) {
            throw new IllegalStateException("Record " + record.getImageId() + " has no completion time");
        }

        Map<String, Object> metadata = outputOf(record, AnalysisKind.METADATA);
        Map<String, Object> colors = outputOf(record, AnalysisKind.COLOR);
        Map<String, Object> objects = outputOf(record, AnalysisKind.OBJECTS);
        Map<String, Object> text = outputOf(record, AnalysisKind.TEXT);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("imageSize", metadata == null ? null : metadata.get("width") + "x" + metadata.get("height"));
        summary.put("format", metadata == null ? null : metadata.get("format"));
        summary.put("dominantColor", colors == null ? null : dominantColor(colors));
        summary.put("objectsDetected", objects == null ? null : objects.get("objectCount"));
        summary.put("hasText", text == null ? null : text.get("hasText"));
        summary.put("isGrayscale", colors == null ? null : colors.get("isGrayscale"));

        Map<String, Map<String, Object>> analyses = new LinkedHashMap<>();
        List<AnalysisKind> failed = new ArrayList<>();
        for (AnalysisTask task : record.getTasks().values()) {
            analyses.put(task.getKind().analysisKey(), task.getOutput());
            if (task.getStatus() == TaskStatus.FAILED) {
                failed.add(task.getKind());
            }
        }

        ResultStatus status;
        if (failed.isEmpty()) {
            status = ResultStatus.COMPLETE;
        } else if (failed.size() == record.getTasks().size()) {
            status = ResultStatus.FAILED;
        } else {
            status = ResultStatus.PARTIAL;
        }

        return new ResultSummary(
                record.getImageId(),
                record.getImageRef().getFileName(),
                record.getImageRef().getBlobPath(),
                record.getCompletedAt(),
                status,
                summary,
                analyses,
                failed);
    }

    private static Map<String, Object> outputOf(OrchestrationRecord record, AnalysisKind kind) {
        AnalysisTask task = record.getTasks().get(kind);
        if (task == null || task.getStatus() != TaskStatus.SUCCEEDED) {
            return null;
        }
        return task.getOutput();
    }

    private static Object dominantColor(Map<String, Object> colors) {
        Object dominant = colors.get("dominantColors");
        if (dominant instanceof List && !((List<?>) dominant).isEmpty()) {
            Object first = ((List<?>) dominant).get(0);
            if (first instanceof Map) {
                Object hex = ((Map<?, ?>) first).get("hex");
                if (hex != null) {
                    return hex;
                }
            }
        }
        return NO_COLOR;
    }
}
