package com.imageanalysis.shared.storage;

/**
 * Result of a metadata probe.
 */
public class ObjectInfo {

    private final long sizeBytes;
    private final String eTag;
    private final String contentType;

    public ObjectInfo(long sizeBytes, String eTag, String contentType) {
        this.sizeBytes = sizeBytes;
        this.eTag = eTag;
        this.contentType = contentType;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public String getETag() {
        return eTag;
    }

    public String getContentType() {
        return contentType;
    }
}
