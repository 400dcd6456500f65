package com.identity.resolution.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link ResolutionStore} backed by a single atomic reference.
 */
public class InMemoryResolutionStore implements ResolutionStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryResolutionStore.class);

    private final AtomicReference<ResolutionSnapshot> current = new AtomicReference<>();

    @Override
    public Optional<ResolutionSnapshot> current() {
        return Optional.ofNullable(current.get());
    }

    @Override
    public ResolutionSnapshot commit(ResolutionSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot is required");
        ResolutionSnapshot previous = current.getAndSet(snapshot);
        log.debug("snapshot.swapped runId={} previousRunId={}",
                snapshot.getRunId(), previous != null ? previous.getRunId() : null);
        return previous;
    }
}
