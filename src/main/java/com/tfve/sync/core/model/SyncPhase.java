package com.tfve.sync.core.model;

/**
 * Phases of one sync run.
 *
 * <pre>
 *   LISTING -> PARTITIONING -> CREATING -> UPDATING | SKIPPING_UPDATE -> DONE
 * </pre>
 *
 * A run-level fault in any phase moves the run to {@link #FAILED}.
 */
public enum SyncPhase {
    LISTING,
    PARTITIONING,
    CREATING,
    UPDATING,
    SKIPPING_UPDATE,
    DONE,
    FAILED
}
