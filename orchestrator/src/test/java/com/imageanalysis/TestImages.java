package com.imageanalysis;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes small synthetic images for tests.
 */
public final class TestImages {

    private TestImages() {
    }

    /**
     * Left part black, the rest pure red.
     */
    public static Path writeBlackAndRed(Path root, String key, String format,
            int width, int height, double blackFraction) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        try {
            int split = (int) Math.round(width * blackFraction);
            graphics.setColor(Color.BLACK);
            graphics.fillRect(0, 0, split, height);
            graphics.setColor(Color.RED);
            graphics.fillRect(split, 0, width - split, height);
        } finally {
            graphics.dispose();
        }
        return write(root, key, format, image);
    }

    public static Path writeSolid(Path root, String key, String format,
            int width, int height, Color color) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setColor(color);
            graphics.fillRect(0, 0, width, height);
        } finally {
            graphics.dispose();
        }
        return write(root, key, format, image);
    }

    public static Path write(Path root, String key, String format, BufferedImage image) throws IOException {
        Path file = root.resolve(key);
        Files.createDirectories(file.getParent());
        if (!ImageIO.write(image, format, file.toFile())) {
            throw new IOException("No ImageIO writer for " + format);
        }
        return file;
    }
}
