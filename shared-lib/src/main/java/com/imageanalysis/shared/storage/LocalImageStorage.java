package com.imageanalysis.shared.storage;

import com.imageanalysis.shared.model.ImageRef;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;

/**
 * Images kept under a local directory; the key is the path relative to it.
 */
public class LocalImageStorage implements ImageStorage {

    public static final String LOCAL_BUCKET = "local";

    private final Path root;

    public LocalImageStorage(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    /**
     * Ref for a file below the root. The file's size and modification time stand in for an ETag.
     */
    public ImageRef refFor(Path file) throws IOException {
        Path absolute = file.toAbsolutePath().normalize();
        if (!absolute.startsWith(root)) {
            throw new IOException(file + " is not below " + root);
        }
        String key = root.relativize(absolute).toString().replace('\\', '/');
        BasicFileAttributes attributes = Files.readAttributes(absolute, BasicFileAttributes.class);
        String eTag = attributes.size() + "-" + attributes.lastModifiedTime().toMillis();
        return ImageRef.of(LOCAL_BUCKET, key, eTag, attributes.size(), Instant.now());
    }

    @Override
    public ObjectInfo probe(ImageRef image) throws ImageUnreadableException {
        Path path = resolve(image);
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new ImageUnreadableException("Image not found: " + image.getBlobPath());
        }
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            return new ObjectInfo(attributes.size(),
                    attributes.size() + "-" + attributes.lastModifiedTime().toMillis(),
                    Files.probeContentType(path));
        } catch (IOException e) {
            throw new ImageUnreadableException("Image not readable: " + image.getBlobPath(), e);
        }
    }

    @Override
    public byte[] read(ImageRef image) throws IOException {
        return Files.readAllBytes(resolve(image));
    }

    public Path getRoot() {
        return root;
    }

    private Path resolve(ImageRef image) {
        Path path = root.resolve(image.getKey()).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("Key escapes storage root: " + image.getKey());
        }
        return path;
    }
}
