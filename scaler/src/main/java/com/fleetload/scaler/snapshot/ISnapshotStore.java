package com.fleetload.scaler.snapshot;

import com.fleetload.core.model.LoadSnapshot;

import java.util.Optional;

/**
 * Single-slot holder of the latest load snapshot.
 * <p>
 * One writer (the refresh loop) publishes, any number of readers (scaler queries) read.
 * Readers observe either nothing or one complete snapshot, never a mix of two.
 * </p>
 */
public interface ISnapshotStore {

    /**
     * Replaces the stored snapshot.
     *
     * @param snapshot fully built snapshot, never null
     */
    void publish(LoadSnapshot snapshot);

    /**
     * @return the latest published snapshot, or empty if nothing was published yet
     */
    Optional<LoadSnapshot> read();
}
