package com.tfve.sync.core.client;

import com.tfve.sync.core.model.RemoteVariable;
import com.tfve.sync.core.model.VariableTarget;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * =====================================================================
 * RemoteVariableClient
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Transport-facing contract for reading and writing the variables of
 * one workspace.
 *
 * The production implementation talks to the HCP Terraform JSON:API,
 * but the sync engine only sees this interface, which keeps it:
 *  - Transport-agnostic
 *  - Test-friendly
 *
 * ROLE IN ARCHITECTURE
 * --------------------
 *
 *   [ SyncEngine ]
 *          │
 *          ▼
 *   [ RemoteVariableClient ]  ← YOU ARE HERE
 *          │
 *          ▼
 *   [ Rate limiter → HTTP API ]
 *
 * It knows NOTHING about:
 *  - Which targets exist remotely (the engine decides)
 *  - Failure policy (the engine decides whether to go on)
 *
 * RATE LIMITING
 * -------------
 * Implementations MUST take a rate-limiter permit before EVERY HTTP
 * request, pagination requests included. A rejected permit delays the
 * request; it never fails or skips it.
 *
 * FAILURE SEMANTICS
 * -----------------
 * - Mono completes with a value:
 *     → the server answered with the expected status
 * - Mono errors:
 *     → unexpected status, transport fault or unreadable body
 *
 * Errors are NOT retried at this layer.
 */
public interface RemoteVariableClient {

    /**
     * Lists the terraform-category variables of a workspace, keyed by name, in server order.
     */
    Mono<Map<String, RemoteVariable>> list(String workspaceId);

    /**
     * Creates a variable. The returned variable is the one the server echoed (201 Created).
     */
    Mono<RemoteVariable> create(String workspaceId, VariableTarget target);

    /**
     * Overwrites an existing variable (200 OK).
     */
    Mono<RemoteVariable> update(String workspaceId, String variableId, VariableTarget target);

    /**
     * Deletes a variable (204 No Content). Not used by the sync flow.
     */
    Mono<Void> delete(String workspaceId, String variableId);

    /**
     * Convenience for maintenance: deletes variables one after another.
     */
    default Mono<Void> deleteAll(String workspaceId, Iterable<String> variableIds) {
        return Flux.fromIterable(variableIds)
                .concatMap(id -> delete(workspaceId, id))
                .then();
    }
}
