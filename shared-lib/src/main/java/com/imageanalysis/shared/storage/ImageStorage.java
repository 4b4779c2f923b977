package com.imageanalysis.shared.storage;

import com.imageanalysis.shared.model.ImageRef;

import java.io.IOException;

/**
 * Where raw image bytes live. The orchestrator only probes; analyzers read.
 */
public interface ImageStorage {

    /**
     * Lightweight existence/metadata check, never downloads the object.
     */
    ObjectInfo probe(ImageRef image) throws ImageUnreadableException;

    byte[] read(ImageRef image) throws IOException;
}
