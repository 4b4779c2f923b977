package com.imageanalysis.analyzer;

import com.imageanalysis.shared.model.AnalysisKind;
import com.imageanalysis.shared.storage.ImageStorage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static roster of analyzers, one per kind. Every orchestration gets one task
 * per kind in the roster, in enum order.
 */
public class AnalyzerRegistry {

    private final Map<AnalysisKind, Analyzer> analyzers = new EnumMap<>(AnalysisKind.class);

    /**
     * The reference analyzers for all four kinds.
     */
    public static AnalyzerRegistry standard(ImageStorage imageStorage) {
        ImageDecoder decoder = new ImageDecoder(imageStorage);
        return new AnalyzerRegistry()
                .register(new ColorAnalyzer(decoder))
                .register(new ObjectAnalyzer(decoder))
                .register(new TextAnalyzer())
                .register(new MetadataAnalyzer(decoder));
    }

    /**
     * Adds or replaces the analyzer for its kind.
     */
    public AnalyzerRegistry register(Analyzer analyzer) {
        analyzers.put(analyzer.kind(), analyzer);
        return this;
    }

    /**
     * Keeps only the given kinds. Fails if one of them has no analyzer.
     */
    public AnalyzerRegistry retainOnly(List<AnalysisKind> kinds) {
        for (AnalysisKind kind : kinds) {
            if (!analyzers.containsKey(kind)) {
                throw new IllegalArgumentException("No analyzer registered for " + kind);
            }
        }
        analyzers.keySet().retainAll(kinds);
        return this;
    }

    public boolean contains(AnalysisKind kind) {
        return analyzers.containsKey(kind);
    }

    public Analyzer get(AnalysisKind kind) {
        Analyzer analyzer = analyzers.get(kind);
        if (analyzer == null) {
            throw new IllegalArgumentException("No analyzer registered for " + kind);
        }
        return analyzer;
    }

    public List<AnalysisKind> roster() {
        return Collections.unmodifiableList(new ArrayList<>(analyzers.keySet()));
    }
}
