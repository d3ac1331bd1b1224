package com.tfve.sync.engine;

import com.tfve.sync.core.client.RemoteVariableClient;
import com.tfve.sync.core.model.FailurePolicy;
import com.tfve.sync.core.model.RemoteVariable;
import com.tfve.sync.core.model.SyncOperation;
import com.tfve.sync.core.model.SyncPhase;
import com.tfve.sync.core.model.SyncResult;
import com.tfve.sync.core.model.VariableStatus;
import com.tfve.sync.core.model.VariableTarget;
import com.tfve.sync.core.value.Value;
import com.tfve.sync.core.value.ValueCodec;
import com.tfve.sync.input.InputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Runs one sync pass of export targets against one workspace.
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>List the workspace's variables once. This snapshot decides, for the whole run, which targets
 *       exist; it is never queried again.</li>
 *   <li>Partition targets by name into "to create" and "existing".</li>
 *   <li>Create, one call at a time, in target order.</li>
 *   <li>Update existing targets the same way when updates are allowed; otherwise report them as ignored
 *       without calling the API.</li>
 * </ol>
 *
 * <h2>Failures</h2>
 * A failed create or update is recorded in the {@link SyncResult}; the returned Mono does not error for
 * it. With {@link FailurePolicy#STOP} every later item is recorded as not attempted. Only run-level faults
 * (duplicate target names, listing failure) error the Mono.
 */
public class SyncEngine {

    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    private final RemoteVariableClient client;
    private final ValueCodec codec;
    private final boolean allowUpdate;
    private final FailurePolicy failurePolicy;

    public SyncEngine(RemoteVariableClient client, ValueCodec codec, boolean allowUpdate, FailurePolicy failurePolicy) {
        this.client = client;
        this.codec = codec;
        this.allowUpdate = allowUpdate;
        this.failurePolicy = failurePolicy;
    }

    public Mono<SyncResult> sync(String workspaceId, List<VariableTarget> targets) {
        return Mono.defer(() -> {
            requireUniqueNames(targets);

            log.debug("Workspace {}: {}", workspaceId, SyncPhase.LISTING);
            return client.list(workspaceId)
                    .onErrorMap(e -> new SyncException(SyncPhase.LISTING, workspaceId, e))
                    .flatMap(remote -> {
                        log.debug("Workspace {}: {}", workspaceId, SyncPhase.PARTITIONING);
                        return apply(workspaceId, partition(targets, remote));
                    })
                    .doOnNext(result -> log.info("Workspace {}: {} (created={}, updated={}, ignored={}, failed={})",
                            workspaceId, SyncPhase.DONE, result.created().size(), result.updated().size(),
                            result.ignoredExisting().size(), result.failures().size()))
                    .doOnError(e -> log.error("Workspace {}: {}", workspaceId, SyncPhase.FAILED, e));
        });
    }

    /**
     * Splits targets by name membership in the remote snapshot. Every target lands in exactly one list and
     * both lists keep target order.
     */
    public static Partition partition(List<VariableTarget> targets, Map<String, RemoteVariable> remote) {
        List<VariableTarget> toCreate = new ArrayList<>();
        List<VariableStatus> existing = new ArrayList<>();
        for (VariableTarget target : targets) {
            VariableStatus status = new VariableStatus(target,
                    Optional.ofNullable(remote.get(target.name())).map(RemoteVariable::id));
            if (status.exists()) {
                existing.add(status);
            } else {
                toCreate.add(target);
            }
        }
        return new Partition(toCreate, existing);
    }

    private Mono<SyncResult> apply(String workspaceId, Partition partition) {
        SyncResult.Builder result = SyncResult.builder();

        Mono<Void> creates = Flux.fromIterable(partition.toCreate())
                .doOnSubscribe(s -> log.debug("Workspace {}: {} {} variables",
                        workspaceId, SyncPhase.CREATING, partition.toCreate().size()))
                .concatMap(t -> applyOne(SyncOperation.CREATE, t, result, () -> client.create(workspaceId, t)))
                .then();

        Mono<Void> updates = Mono.defer(() -> {
            if (!allowUpdate) {
                skipUpdates(workspaceId, partition.existing(), result);
                return Mono.empty();
            }
            log.debug("Workspace {}: {} {} variables", workspaceId, SyncPhase.UPDATING, partition.existing().size());
            return Flux.fromIterable(partition.existing())
                    .concatMap(s -> applyOne(SyncOperation.UPDATE, s.target(), result,
                            () -> client.update(workspaceId, s.remoteId().orElseThrow(), s.target())))
                    .then();
        });

        return creates.then(updates).then(Mono.fromCallable(result::build));
    }

    private void skipUpdates(String workspaceId, List<VariableStatus> existing, SyncResult.Builder result) {
        log.debug("Workspace {}: {}", workspaceId, SyncPhase.SKIPPING_UPDATE);
        if (existing.isEmpty()) {
            return;
        }
        List<String> names = existing.stream().map(VariableStatus::name).toList();
        names.forEach(result::ignored);
        log.warn("Workspace {}: {} variables already exist and were left unchanged (updates not allowed): {}",
                workspaceId, names.size(), names);
    }

    private Mono<Void> applyOne(SyncOperation operation, VariableTarget target, SyncResult.Builder result,
                                Supplier<Mono<RemoteVariable>> call) {
        return Mono.defer(() -> {
            if (result.halted()) {
                result.notAttempted(target.name());
                return Mono.empty();
            }
            return call.get()
                    .map(remote -> new SyncResult.Applied(target.name(), remote.id(), echoedValue(target, remote)))
                    .doOnNext(applied -> {
                        result.applied(operation, applied);
                        log.info("{} {} id={} value={}", operation, applied.name(), applied.remoteId(),
                                codec.toJsonNode(applied.value()));
                    })
                    .onErrorResume(Exception.class, e -> {
                        result.failed(new SyncResult.Failure(target.name(), operation, e.getMessage()));
                        log.error("{} {} failed: {}", operation, target.name(), e.getMessage());
                        if (failurePolicy == FailurePolicy.STOP) {
                            result.halt();
                        }
                        return Mono.empty();
                    })
                    .then();
        });
    }

    /**
     * Value the server stored. Sensitive variables are echoed without a value; the write was still
     * accepted, so the submitted value stands in for it.
     */
    private Value echoedValue(VariableTarget target, RemoteVariable remote) {
        if (remote.rawValue() == null) {
            log.debug("{} echoed without a value, keeping the submitted one", target.name());
            return target.value();
        }
        return codec.decode(codec.classify(target.value()), remote.rawValue());
    }

    private static void requireUniqueNames(List<VariableTarget> targets) {
        Set<String> seen = new HashSet<>();
        for (VariableTarget target : targets) {
            if (!seen.add(target.name())) {
                throw new InputException("Variable '" + target.name() + "' is targeted more than once");
            }
        }
    }

    /**
     * Targets split by whether their name already exists remotely.
     */
    public record Partition(List<VariableTarget> toCreate, List<VariableStatus> existing) {
    }
}
