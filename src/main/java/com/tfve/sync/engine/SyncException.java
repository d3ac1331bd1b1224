package com.tfve.sync.engine;

import com.tfve.sync.core.model.SyncPhase;

import java.util.Locale;

/**
 * A sync run could not complete, for example because the remote variables could not be listed.
 *
 * Items applied before the failure stay applied.
 */
public class SyncException extends RuntimeException {

    private final SyncPhase phase;
    private final String workspaceId;

    public SyncException(SyncPhase phase, String workspaceId, Throwable cause) {
        super("Sync of workspace " + workspaceId + " failed while " + phase.name().toLowerCase(Locale.ROOT) + ": "
                + cause.getMessage(), cause);
        this.phase = phase;
        this.workspaceId = workspaceId;
    }

    public SyncPhase getPhase() { return phase; }

    public String getWorkspaceId() { return workspaceId; }
}
