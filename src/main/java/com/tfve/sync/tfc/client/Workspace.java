package com.tfve.sync.tfc.client;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A workspace of the organization together with the project it belongs to.
 */
public record Workspace(
        @JsonProperty("workspace_id") String id,
        @JsonProperty("workspace_name") String name,
        Project project
) {

    public record Project(
            @JsonProperty("project_id") String id,
            @JsonProperty("project_name") String name
    ) {
    }
}
