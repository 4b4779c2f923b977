package com.imageanalysis.analyzer;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Named result fields produced by one analyzer run.
 */
public class AnalysisOutput {

    private final Map<String, Object> fields;

    private AnalysisOutput(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static AnalysisOutput of(Map<String, Object> fields) {
        return new AnalysisOutput(fields);
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    /**
     * Required fields that are absent or null.
     */
    public List<String> missing(Collection<String> required) {
        return required.stream()
                .filter(name -> fields.get(name) == null)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "AnalysisOutput" + fields;
    }
}
