package com.imageanalysis.analyzer;

import com.imageanalysis.shared.model.AnalysisKind;
import com.imageanalysis.shared.model.ImageRef;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Placeholder OCR: reports no text. Swap in a real engine behind the same interface.
 */
public class TextAnalyzer implements Analyzer {

    @Override
    public AnalysisKind kind() {
        return AnalysisKind.TEXT;
    }

    @Override
    public Set<String> requiredFields() {
        return Set.of("hasText");
    }

    @Override
    public AnalysisOutput run(ImageRef image, int attempt) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("hasText", false);
        fields.put("extractedText", "");
        fields.put("confidence", 0.0);
        fields.put("language", "unknown");
        fields.put("note", "Placeholder OCR");
        return AnalysisOutput.of(fields);
    }
}
