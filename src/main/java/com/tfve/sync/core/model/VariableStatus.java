package com.tfve.sync.core.model;

import java.util.Optional;

/**
 * Whether a target name already exists in the remote snapshot taken at the start of a run.
 *
 * @param target the target being matched
 * @param remoteId id of the existing variable, empty when absent remotely
 */
public record VariableStatus(VariableTarget target, Optional<String> remoteId) {

    public String name() {
        return target.name();
    }

    public boolean exists() {
        return remoteId.isPresent();
    }
}
