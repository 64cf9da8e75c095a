package org.broadinstitute.refloci.refloci;

/**
 * Lifecycle of a {@link RefLoci}.
 */
public enum RefLociState {
    /**
     * In memory and mutable; nothing has been written yet, or the collection was reopened.
     */
    BUILDING,

    /**
     * A durable snapshot exists under the collection's name; the in-memory copy is read-only.
     */
    FROZEN,

    /**
     * Rehydrated from a snapshot; read-only until reopened.
     */
    LOADED;

    public boolean isReadOnly() {
        return this != BUILDING;
    }
}
