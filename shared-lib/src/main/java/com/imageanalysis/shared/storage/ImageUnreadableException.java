package com.imageanalysis.shared.storage;

/**
 * The referenced image is missing or cannot be read. Not retried by the orchestrator.
 */
public class ImageUnreadableException extends Exception {

    public ImageUnreadableException(String message) {
        super(message);
    }

    public ImageUnreadableException(String message, Throwable cause) {
        super(message, cause);
    }
}
