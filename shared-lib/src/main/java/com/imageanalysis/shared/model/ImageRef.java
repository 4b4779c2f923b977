package com.imageanalysis.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Identifies a source image in storage. Immutable.
 */
public final class ImageRef {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("bucket")
    private final String bucket;

    @JsonProperty("key")
    private final String key;

    @JsonProperty("fileName")
    private final String fileName;

    @JsonProperty("sizeBytes")
    private final long sizeBytes;

    @JsonProperty("discoveredAt")
    private final Instant discoveredAt;

    @JsonCreator
    public ImageRef(
            @JsonProperty("id") String id,
            @JsonProperty("bucket") String bucket,
            @JsonProperty("key") String key,
            @JsonProperty("fileName") String fileName,
            @JsonProperty("sizeBytes") long sizeBytes,
            @JsonProperty("discoveredAt") Instant discoveredAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        this.key = Objects.requireNonNull(key, "key");
        this.fileName = fileName != null ? fileName : fileNameOf(key);
        this.sizeBytes = sizeBytes;
        this.discoveredAt = discoveredAt;
    }

    /**
     * Builds a ref whose id is derived from the object location and its ETag, so
     * a redelivered notification for the same upload maps to the same id.
     */
    public static ImageRef of(String bucket, String key, String eTag, long sizeBytes, Instant discoveredAt) {
        return new ImageRef(idFor(bucket, key, eTag), bucket, key, fileNameOf(key), sizeBytes, discoveredAt);
    }

    public static String idFor(String bucket, String key, String eTag) {
        String normalizedTag = eTag == null ? "" : eTag.replace("\"", "");
        String name = bucket + "/" + key + "#" + normalizedTag;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }

    static String fileNameOf(String key) {
        int slash = key.lastIndexOf('/');
        return slash >= 0 ? key.substring(slash + 1) : key;
    }

    public String getId() {
        return id;
    }

    public String getBucket() {
        return bucket;
    }

    public String getKey() {
        return key;
    }

    public String getFileName() {
        return fileName;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public Instant getDiscoveredAt() {
        return discoveredAt;
    }

    @JsonIgnore
    public String getBlobPath() {
        return bucket + "/" + key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ImageRef)) {
            return false;
        }
        ImageRef other = (ImageRef) o;
        return sizeBytes == other.sizeBytes
                && id.equals(other.id)
                && bucket.equals(other.bucket)
                && key.equals(other.key)
                && Objects.equals(fileName, other.fileName)
                && Objects.equals(discoveredAt, other.discoveredAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, bucket, key, fileName, sizeBytes, discoveredAt);
    }

    @Override
    public String toString() {
        return "ImageRef{" +
                "id='" + id + '\'' +
                ", blobPath='" + getBlobPath() + '\'' +
                ", sizeBytes=" + sizeBytes +
                '}';
    }
}
