package com.tfve.sync.core.model;

import com.tfve.sync.core.value.Value;

import java.util.Objects;

/**
 * A variable the current run wants to exist in the target workspace.
 *
 * Built by merging one export-list entry with the output value it names.
 * Lives for a single run only.
 *
 * @param name variable key in the workspace, unique within one run
 * @param description optional description, {@code null} when the export list gives none
 * @param value value to export
 */
public record VariableTarget(String name, String description, Value value) {

    public VariableTarget {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
    }
}
