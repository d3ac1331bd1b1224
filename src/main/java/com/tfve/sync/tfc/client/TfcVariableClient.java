package com.tfve.sync.tfc.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.tfve.sync.core.client.RemoteVariableClient;
import com.tfve.sync.core.model.RemoteVariable;
import com.tfve.sync.core.model.VariableTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link RemoteVariableClient} for the HCP Terraform workspace-variables API.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>{@code GET    /workspaces/{ws}/vars}: list, expects 200</li>
 *   <li>{@code POST   /workspaces/{ws}/vars}: create, expects 201</li>
 *   <li>{@code PATCH  /workspaces/{ws}/vars/{id}}: update, expects 200</li>
 *   <li>{@code DELETE /workspaces/{ws}/vars/{id}}: delete, expects 204</li>
 * </ul>
 *
 * <p>Results of create and update are built from the server's echo, so callers see what was actually
 * stored. Every request is paced by the shared rate limiter inside {@link JsonApiTransport}.</p>
 */
public class TfcVariableClient implements RemoteVariableClient {

    private static final Logger log = LoggerFactory.getLogger(TfcVariableClient.class);

    static final String VARS_PATH = "/workspaces/{workspaceId}/vars";
    static final String VAR_PATH = "/workspaces/{workspaceId}/vars/{variableId}";

    private final JsonApiTransport transport;
    private final VariablePayloads payloads;

    public TfcVariableClient(JsonApiTransport transport, VariablePayloads payloads) {
        this.transport = transport;
        this.payloads = payloads;
    }

    @Override
    public Mono<Map<String, RemoteVariable>> list(String workspaceId) {
        return transport.getAll(VARS_PATH, workspaceId)
                .map(payloads::read)
                .filter(RemoteVariable::isTerraformVariable)
                .collect(LinkedHashMap<String, RemoteVariable>::new, (m, v) -> m.put(v.name(), v))
                .<Map<String, RemoteVariable>>map(m -> m)
                .doOnNext(m -> log.info("Workspace {} has {} terraform variables", workspaceId, m.size()))
                .onErrorMap(IllegalArgumentException.class,
                        e -> new TfcApiException(HttpMethod.GET, VARS_PATH, e.getMessage(), e));
    }

    @Override
    public Mono<RemoteVariable> create(String workspaceId, VariableTarget target) {
        return Mono.fromCallable(() -> payloads.write(null, target))
                .flatMap(body -> transport.exchange(HttpMethod.POST, VARS_PATH,
                        new Object[]{workspaceId}, body, HttpStatus.CREATED))
                .switchIfEmpty(emptyBody(HttpMethod.POST, VARS_PATH))
                .flatMap(doc -> echoed(HttpMethod.POST, VARS_PATH, doc))
                .doOnNext(v -> log.debug("Created variable key={} id={} hcl={}", v.name(), v.id(), v.hcl()));
    }

    @Override
    public Mono<RemoteVariable> update(String workspaceId, String variableId, VariableTarget target) {
        return Mono.fromCallable(() -> payloads.write(variableId, target))
                .flatMap(body -> transport.exchange(HttpMethod.PATCH, VAR_PATH,
                        new Object[]{workspaceId, variableId}, body, HttpStatus.OK))
                .switchIfEmpty(emptyBody(HttpMethod.PATCH, VAR_PATH))
                .flatMap(doc -> echoed(HttpMethod.PATCH, VAR_PATH, doc))
                .doOnNext(v -> log.debug("Updated variable key={} id={} hcl={}", v.name(), v.id(), v.hcl()));
    }

    @Override
    public Mono<Void> delete(String workspaceId, String variableId) {
        return transport.exchange(HttpMethod.DELETE, VAR_PATH,
                        new Object[]{workspaceId, variableId}, null, HttpStatus.NO_CONTENT)
                .doOnSuccess(x -> log.info("Deleted variable id={} from workspace {}", variableId, workspaceId))
                .then();
    }

    private static Mono<JsonNode> emptyBody(HttpMethod method, String path) {
        return Mono.error(() -> new TfcApiException(method, path, "response body is empty", null));
    }

    private Mono<RemoteVariable> echoed(HttpMethod method, String path, JsonNode doc) {
        JsonNode data = doc.path("data");
        if (!data.isObject()) {
            return Mono.error(new TfcApiException(method, path, "response has no data object", null));
        }
        try {
            return Mono.just(payloads.read(data));
        } catch (IllegalArgumentException e) {
            return Mono.error(new TfcApiException(method, path, e.getMessage(), e));
        }
    }
}
