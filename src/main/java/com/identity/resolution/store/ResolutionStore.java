package com.identity.resolution.store;

import java.util.Optional;

/**
 * Holds the current committed resolution snapshot. Readers always see a complete snapshot.
 */
public interface ResolutionStore {

    Optional<ResolutionSnapshot> current();

    /**
     * Atomically replaces the current snapshot.
     *
     * @return the snapshot that was replaced, or null if none
     */
    ResolutionSnapshot commit(ResolutionSnapshot snapshot);
}
