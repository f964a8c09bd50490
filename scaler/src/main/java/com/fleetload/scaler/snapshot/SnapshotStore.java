package com.fleetload.scaler.snapshot;

import com.fleetload.core.model.LoadSnapshot;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lock-free snapshot store: publishing swaps a reference to an immutable snapshot.
 */
public class SnapshotStore implements ISnapshotStore {

    private final AtomicReference<LoadSnapshot> current = new AtomicReference<>();

    @Override
    public void publish(LoadSnapshot snapshot) {
        current.set(Objects.requireNonNull(snapshot, "snapshot"));
    }

    @Override
    public Optional<LoadSnapshot> read() {
        return Optional.ofNullable(current.get());
    }
}
