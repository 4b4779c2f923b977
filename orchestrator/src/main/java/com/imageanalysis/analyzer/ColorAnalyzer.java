package com.imageanalysis.analyzer;

import com.imageanalysis.shared.model.AnalysisKind;
import com.imageanalysis.shared.model.ImageRef;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Dominant colours from a 50x50 downsample, channels quantised to steps of 32.
 */
public class ColorAnalyzer implements Analyzer {

    static final int SAMPLE_SIZE = 50;
    static final int BUCKET = 32;
    static final int TOP_COLORS = 5;
    static final int GRAY_TOLERANCE = 30;
    static final double GRAYSCALE_RATIO = 0.9;

    private final ImageDecoder decoder;

    public ColorAnalyzer(ImageDecoder decoder) {
        this.decoder = decoder;
    }

    @Override
    public AnalysisKind kind() {
        return AnalysisKind.COLOR;
    }

    @Override
    public Set<String> requiredFields() {
        return Set.of("dominantColors", "isGrayscale");
    }

    @Override
    public AnalysisOutput run(ImageRef image, int attempt) throws AnalysisException {
        BufferedImage sample = downsample(decoder.decode(image).getImage());

        int total = SAMPLE_SIZE * SAMPLE_SIZE;
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        int grayPixels = 0;
        for (int y = 0; y < SAMPLE_SIZE; y++) {
            for (int x = 0; x < SAMPLE_SIZE; x++) {
                int rgb = sample.getRGB(x, y);
                int r = (rgb >> 16) & 0xff;
                int g = (rgb >> 8) & 0xff;
                int b = rgb & 0xff;
                int bucket = (quantise(r) << 16) | (quantise(g) << 8) | quantise(b);
                counts.merge(bucket, 1, Integer::sum);
                if (Math.abs(r - g) < GRAY_TOLERANCE && Math.abs(g - b) < GRAY_TOLERANCE) {
                    grayPixels++;
                }
            }
        }

        // stable sort keeps first-seen order between equal counts
        List<Map.Entry<Integer, Integer>> ranked = counts.entrySet().stream()
                .sorted(Map.Entry.<Integer, Integer>comparingByValue().reversed())
                .limit(TOP_COLORS)
                .collect(Collectors.toList());

        List<Map<String, Object>> topColors = new ArrayList<>();
        for (Map.Entry<Integer, Integer> entry : ranked) {
            int packed = entry.getKey();
            int r = (packed >> 16) & 0xff;
            int g = (packed >> 8) & 0xff;
            int b = packed & 0xff;

            Map<String, Object> rgb = new LinkedHashMap<>();
            rgb.put("r", r);
            rgb.put("g", g);
            rgb.put("b", b);

            Map<String, Object> color = new LinkedHashMap<>();
            color.put("hex", String.format("#%02x%02x%02x", r, g, b));
            color.put("rgb", rgb);
            color.put("percentage", Math.round(entry.getValue() * 1000.0 / total) / 10.0);
            topColors.add(color);
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("dominantColors", topColors);
        fields.put("isGrayscale", (double) grayPixels / total > GRAYSCALE_RATIO);
        fields.put("totalPixelsSampled", total);
        return AnalysisOutput.of(fields);
    }

    private static int quantise(int channel) {
        return channel / BUCKET * BUCKET;
    }

    private static BufferedImage downsample(BufferedImage source) {
        BufferedImage sample = new BufferedImage(SAMPLE_SIZE, SAMPLE_SIZE, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = sample.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.drawImage(source, 0, 0, SAMPLE_SIZE, SAMPLE_SIZE, null);
        } finally {
            graphics.dispose();
        }
        return sample;
    }
}
