package com.imageanalysis.analyzer;

/**
 * An analyzer could not produce a result for this attempt.
 */
public class AnalysisException extends Exception {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
