package com.tfve.sync.core.model;

import com.tfve.sync.core.value.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of one sync run against one workspace.
 *
 * <p>Lists keep the order in which items were processed, which is the export-list order within each
 * phase. A run with a non-empty {@link #failures()} list still returns normally; callers decide whether
 * to re-run.</p>
 *
 * @param created variables created, with the id and value the server echoed
 * @param updated variables updated, with the id and value the server echoed
 * @param ignoredExisting names that already existed while updates were not allowed
 * @param failures items whose create or update failed
 * @param notAttempted names left untouched after the run stopped on a failure
 */
public record SyncResult(
        List<Applied> created,
        List<Applied> updated,
        Set<String> ignoredExisting,
        List<Failure> failures,
        List<String> notAttempted
) {

    public SyncResult {
        created = List.copyOf(created);
        updated = List.copyOf(updated);
        ignoredExisting = Collections.unmodifiableSet(new LinkedHashSet<>(ignoredExisting));
        failures = List.copyOf(failures);
        notAttempted = List.copyOf(notAttempted);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A variable the server accepted.
     */
    public record Applied(String name, String remoteId, Value value) {
    }

    /**
     * A variable the server did not accept, or whose echo could not be decoded.
     */
    public record Failure(String name, SyncOperation operation, String message) {
    }

    /**
     * Accumulates outcomes while a run progresses. Not thread-safe; a run is sequential.
     */
    public static final class Builder {

        private final List<Applied> created = new ArrayList<>();
        private final List<Applied> updated = new ArrayList<>();
        private final Set<String> ignoredExisting = new LinkedHashSet<>();
        private final List<Failure> failures = new ArrayList<>();
        private final List<String> notAttempted = new ArrayList<>();
        private boolean halted;

        public Builder applied(SyncOperation operation, Applied applied) {
            if (operation == SyncOperation.CREATE) {
                created.add(applied);
            } else {
                updated.add(applied);
            }
            return this;
        }

        public Builder ignored(String name) {
            ignoredExisting.add(name);
            return this;
        }

        public Builder failed(Failure failure) {
            failures.add(failure);
            return this;
        }

        public Builder notAttempted(String name) {
            notAttempted.add(name);
            return this;
        }

        /** Marks the run as stopped; later items are recorded as not attempted. */
        public Builder halt() {
            halted = true;
            return this;
        }

        public boolean halted() {
            return halted;
        }

        public SyncResult build() {
            return new SyncResult(created, updated, ignoredExisting, failures, notAttempted);
        }
    }
}
