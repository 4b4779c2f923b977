package com.imageanalysis.analyzer;

import com.imageanalysis.shared.model.AnalysisKind;
import com.imageanalysis.shared.model.ImageRef;

import java.util.Set;

/**
 * One analysis step. Implementations read the image themselves, return their
 * fields and never touch orchestration state, so a retry is always safe.
 */
public interface Analyzer {

    AnalysisKind kind();

    /**
     * Fields the result merge relies on. An output missing any of them is rejected.
     */
    Set<String> requiredFields();

    AnalysisOutput run(ImageRef image, int attempt) throws AnalysisException;
}
