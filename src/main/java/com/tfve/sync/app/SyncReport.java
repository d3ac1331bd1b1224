package com.tfve.sync.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.tfve.sync.core.model.SyncResult;
import com.tfve.sync.core.value.ValueCodec;

import java.time.Instant;
import java.util.List;

/**
 * Printed summary of one workspace run. Values are rendered as JSON, strings included.
 */
public record SyncReport(
        String workspaceName,
        String workspaceId,
        Instant finishedAt,
        List<Entry> created,
        List<Entry> updated,
        List<String> ignoredExisting,
        List<SyncResult.Failure> failures,
        List<String> notAttempted
) {

    public record Entry(String name, String id, JsonNode value) {
    }

    public static SyncReport of(String workspaceName, String workspaceId, SyncResult result,
                                ValueCodec codec, Instant finishedAt) {
        return new SyncReport(
                workspaceName,
                workspaceId,
                finishedAt,
                entries(result.created(), codec),
                entries(result.updated(), codec),
                List.copyOf(result.ignoredExisting()),
                result.failures(),
                result.notAttempted());
    }

    private static List<Entry> entries(List<SyncResult.Applied> applied, ValueCodec codec) {
        return applied.stream()
                .map(a -> new Entry(a.name(), a.remoteId(), codec.toJsonNode(a.value())))
                .toList();
    }
}
