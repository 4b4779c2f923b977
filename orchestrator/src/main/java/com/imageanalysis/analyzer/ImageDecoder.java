package com.imageanalysis.analyzer;

import com.imageanalysis.shared.model.ImageRef;
import com.imageanalysis.shared.storage.ImageStorage;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;

/**
 * Fetches image bytes from storage and decodes them with ImageIO.
 */
public class ImageDecoder {

    private final ImageStorage imageStorage;

    public ImageDecoder(ImageStorage imageStorage) {
        this.imageStorage = imageStorage;
    }

    public DecodedImage decode(ImageRef ref) throws AnalysisException {
        byte[] bytes;
        try {
            bytes = imageStorage.read(ref);
        } catch (IOException e) {
            throw new AnalysisException("Failed to read " + ref.getBlobPath() + ": " + e.getMessage(), e);
        }

        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            Iterator<ImageReader> readers = input != null ? ImageIO.getImageReaders(input) : null;
            if (readers == null || !readers.hasNext()) {
                throw new AnalysisException("Unsupported image format: " + ref.getBlobPath());
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                BufferedImage image = reader.read(0);
                return new DecodedImage(image, normalizeFormat(reader.getFormatName()), bytes.length);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new AnalysisException("Failed to decode " + ref.getBlobPath() + ": " + e.getMessage(), e);
        }
    }

    static String normalizeFormat(String formatName) {
        if (formatName == null) {
            return "Unknown";
        }
        String upper = formatName.toUpperCase(Locale.ROOT);
        return upper.equals("JPG") ? "JPEG" : upper;
    }

    /**
     * Decoded pixels plus what the container told us.
     */
    public static class DecodedImage {
        private final BufferedImage image;
        private final String format;
        private final long sizeBytes;

        public DecodedImage(BufferedImage image, String format, long sizeBytes) {
            this.image = image;
            this.format = format;
            this.sizeBytes = sizeBytes;
        }

        public BufferedImage getImage() {
            return image;
        }

        public String getFormat() {
            return format;
        }

        public long getSizeBytes() {
            return sizeBytes;
        }

        public int getWidth() {
            return image.getWidth();
        }

        public int getHeight() {
            return image.getHeight();
        }
    }
}
