package com.imageanalysis.analyzer;

import com.imageanalysis.shared.model.AnalysisKind;
import com.imageanalysis.shared.model.ImageRef;

import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Dimensions, container format and colour layout.
 */
public class MetadataAnalyzer implements Analyzer {

    private final ImageDecoder decoder;

    public MetadataAnalyzer(ImageDecoder decoder) {
        this.decoder = decoder;
    }

    @Override
    public AnalysisKind kind() {
        return AnalysisKind.METADATA;
    }

    @Override
    public Set<String> requiredFields() {
        return Set.of("width", "height", "format");
    }

    @Override
    public AnalysisOutput run(ImageRef image, int attempt) throws AnalysisException {
        ImageDecoder.DecodedImage decoded = decoder.decode(image);
        int width = decoded.getWidth();
        int height = decoded.getHeight();
        long totalPixels = (long) width * height;

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("width", width);
        fields.put("height", height);
        fields.put("format", decoded.getFormat());
        fields.put("mode", colorMode(decoded.getImage().getColorModel()));
        fields.put("totalPixels", totalPixels);
        fields.put("megapixels", Math.round(totalPixels / 10_000.0) / 100.0);
        fields.put("sizeKB", Math.round(decoded.getSizeBytes() * 100.0 / 1024) / 100.0);
        return AnalysisOutput.of(fields);
    }

    static String colorMode(ColorModel model) {
        if (model instanceof IndexColorModel) {
            return "P";
        }
        int colorComponents = model.getNumColorComponents();
        if (colorComponents == 1) {
            return model.hasAlpha() ? "LA" : "L";
        }
        if (colorComponents == 4) {
            return "CMYK";
        }
        return model.hasAlpha() ? "RGBA" : "RGB";
    }
}
