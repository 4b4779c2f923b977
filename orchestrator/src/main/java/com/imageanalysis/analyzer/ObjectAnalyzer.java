package com.imageanalysis.analyzer;

import com.imageanalysis.shared.model.AnalysisKind;
import com.imageanalysis.shared.model.ImageRef;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Heuristic object labels from the image geometry. Stands in for a real detector.
 */
public class ObjectAnalyzer implements Analyzer {

    static final long HIGH_RESOLUTION_PIXELS = 1_000_000L;

    private final ImageDecoder decoder;

    public ObjectAnalyzer(ImageDecoder decoder) {
        this.decoder = decoder;
    }

    @Override
    public AnalysisKind kind() {
        return AnalysisKind.OBJECTS;
    }

    @Override
    public Set<String> requiredFields() {
        return Set.of("objects", "objectCount");
    }

    @Override
    public AnalysisOutput run(ImageRef image, int attempt) throws AnalysisException {
        ImageDecoder.DecodedImage decoded = decoder.decode(image);
        int width = decoded.getWidth();
        int height = decoded.getHeight();

        List<Map<String, Object>> objects = new ArrayList<>();
        if (width > height) {
            objects.add(label("landscape", 0.85));
        } else if (height > width) {
            objects.add(label("portrait", 0.82));
        } else {
            objects.add(label("square composition", 0.90));
        }
        if ((long) width * height > HIGH_RESOLUTION_PIXELS) {
            objects.add(label("high-resolution scene", 0.78));
        }
        objects.add(label("digital image", 0.99));

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("objects", objects);
        fields.put("objectCount", objects.size());
        fields.put("note", "Heuristic analysis");
        return AnalysisOutput.of(fields);
    }

    private static Map<String, Object> label(String name, double confidence) {
        Map<String, Object> object = new LinkedHashMap<>();
        object.put("name", name);
        object.put("confidence", confidence);
        return object;
    }
}
