package com.tfve.sync.tfc.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.tfve.sync.input.InputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the workspaces and projects of one organization.
 *
 * <p>Both listings are paginated; every page request is rate limited like any other API call.
 * Workspaces are joined to their project through {@code relationships.project.data.id}.</p>
 */
public class TfcWorkspaceDirectory {

    private static final Logger log = LoggerFactory.getLogger(TfcWorkspaceDirectory.class);

    static final String PROJECTS_PATH = "/organizations/{organization}/projects";
    static final String WORKSPACES_PATH = "/organizations/{organization}/workspaces";

    private final JsonApiTransport transport;
    private final String organization;

    public TfcWorkspaceDirectory(JsonApiTransport transport, String organization) {
        this.transport = transport;
        this.organization = organization;
    }

    /**
     * Project id to project name.
     */
    public Mono<Map<String, String>> listProjects() {
        return transport.getAll(PROJECTS_PATH, organization)
                .collectMap(p -> p.path("id").asText(), p -> p.path("attributes").path("name").asText())
                .doOnNext(m -> log.info("{} projects found.", m.size()));
    }

    public Flux<Workspace> listWorkspaces() {
        return listProjects().flatMapMany(projects -> transport.getAll(WORKSPACES_PATH, organization)
                .map(w -> toWorkspace(w, projects)));
    }

    /**
     * Resolves a workspace name to its id.
     *
     * @throws InputException (as the Mono's error) when no workspace has that name
     */
    public Mono<String> resolveWorkspaceId(String name) {
        return resolveWorkspaceIds(List.of(name)).map(ids -> ids.get(name));
    }

    /**
     * Resolves several workspace names from a single listing of the organization.
     *
     * @return name to id, in the order of {@code names}
     * @throws InputException (as the Mono's error) naming every name that matches no workspace
     */
    public Mono<Map<String, String>> resolveWorkspaceIds(Collection<String> names) {
        return listWorkspaces()
                .collectMap(Workspace::name, Workspace::id)
                .flatMap(all -> {
                    Map<String, String> resolved = new LinkedHashMap<>();
                    List<String> unknown = new ArrayList<>();
                    for (String name : names) {
                        String id = all.get(name);
                        if (id == null) {
                            unknown.add(name);
                        } else {
                            resolved.put(name, id);
                        }
                    }
                    if (!unknown.isEmpty()) {
                        return Mono.error(new InputException("Workspace(s) " + unknown
                                + " not found in organization '" + organization + "'"));
                    }
                    resolved.forEach((name, id) -> log.info("Workspace {} resolved to {}", name, id));
                    return Mono.just(resolved);
                });
    }

    private static Workspace toWorkspace(JsonNode w, Map<String, String> projects) {
        String projectId = w.path("relationships").path("project").path("data").path("id").asText(null);
        String projectName = projectId == null ? null : projects.get(projectId);
        return new Workspace(
                w.path("id").asText(),
                w.path("attributes").path("name").asText(),
                new Workspace.Project(projectId, projectName));
    }
}
