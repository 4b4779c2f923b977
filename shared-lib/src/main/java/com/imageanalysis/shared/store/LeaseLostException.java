package com.imageanalysis.shared.store;

/**
 * Another process has claimed the orchestration this process was saving.
 */
public class LeaseLostException extends StoreException {

    public LeaseLostException(String imageId, String owner) {
        super("Lease on orchestration " + imageId + " is no longer held by " + owner);
    }
}
