package com.tfve.sync.tfc.client;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * In-process stand-in for the HCP Terraform API: records every request and answers through a handler.
 */
class FakeTfcApi implements ExchangeFunction {

    static final String BASE_URL = "http://tfc.test/api/v2";
    static final String TOKEN = "test-token";

    record Request(HttpMethod method, URI url, HttpHeaders headers, String body) {

        /** Path below the API base, e.g. {@code /workspaces/ws-1/vars}. */
        String path() {
            return url.getPath().substring("/api/v2".length());
        }

        String query() {
            return url.getQuery();
        }
    }

    private final List<Request> requests = new CopyOnWriteArrayList<>();
    private final Function<Request, ClientResponse> handler;

    FakeTfcApi(Function<Request, ClientResponse> handler) {
        this.handler = handler;
    }

    @Override
    public Mono<ClientResponse> exchange(ClientRequest request) {
        MockClientHttpRequest captured = new MockClientHttpRequest(request.method(), request.url());
        return request.writeTo(captured, ExchangeStrategies.withDefaults())
                .then(Mono.defer(() -> captured.getBodyAsString().defaultIfEmpty("")))
                .map(body -> {
                    Request recorded = new Request(request.method(), request.url(), request.headers(), body);
                    requests.add(recorded);
                    return handler.apply(recorded);
                });
    }

    WebClient webClient() {
        return JsonApiTransport.configure(WebClient.builder(), BASE_URL, TOKEN)
                .exchangeFunction(this)
                .build();
    }

    List<Request> requests() {
        return requests;
    }

    static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status, ExchangeStrategies.withDefaults())
                .header(HttpHeaders.CONTENT_TYPE, JsonApiTransport.JSON_API.toString())
                .body(body)
                .build();
    }

    static ClientResponse noContent() {
        return ClientResponse.create(HttpStatus.NO_CONTENT, ExchangeStrategies.withDefaults()).build();
    }
}
