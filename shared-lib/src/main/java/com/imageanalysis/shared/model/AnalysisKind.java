package com.imageanalysis.shared.model;

import java.util.Locale;

/**
 * The fixed set of analysis steps an image goes through.
 */
public enum AnalysisKind {
    COLOR,
    OBJECTS,
    TEXT,
    METADATA;

    /**
     * Key used for this kind in the per-analysis section of a result.
     */
    public String analysisKey() {
        switch (this) {
            case COLOR:
                return "colors";
            case OBJECTS:
                return "objects";
            case TEXT:
                return "text";
            default:
                return "metadata";
        }
    }

    public static AnalysisKind parse(String value) {
        try {
            return AnalysisKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown analyzer kind: " + value, e);
        }
    }
}
