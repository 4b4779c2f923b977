package com.imageanalysis.shared.store;

import com.imageanalysis.shared.model.OrchestrationRecord;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable home of in-flight orchestrations, keyed by image id.
 * Every write replaces a whole record atomically.
 */
public interface OrchestrationStateStore {

    /**
     * Persists a new record unless one already exists for the image.
     *
     * @return false if a record was already present
     */
    boolean create(OrchestrationRecord record);

    /**
     * Replaces the stored record. Fails with {@link LeaseLostException} when the
     * stored copy is owned by someone other than {@code record.getOwner()} or no
     * longer exists. Never recreates a deleted record.
     */
    void save(OrchestrationRecord record);

    Optional<OrchestrationRecord> load(String imageId);

    /**
     * Every record not yet COMPLETED. Used by the recovery scan only.
     */
    List<OrchestrationRecord> listIncomplete();

    /**
     * Takes ownership of a running record if it is already ours or its lease has expired.
     *
     * @return true if the caller now owns the record
     */
    boolean claim(String imageId, String owner, Duration lease);

    void delete(String imageId);
}
