package com.tfve.sync.tfc.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tfve.sync.core.model.RemoteVariable;
import com.tfve.sync.core.model.VariableTarget;
import com.tfve.sync.core.ratelimit.Decision;
import com.tfve.sync.core.ratelimit.RateLimitResult;
import com.tfve.sync.core.ratelimit.RateLimiter;
import com.tfve.sync.core.ratelimit.TokenBucket;
import com.tfve.sync.core.value.Value;
import com.tfve.sync.core.value.ValueCodec;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class TfcVariableClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ValueCodec codec = new ValueCodec(mapper);
    private final VariablePayloads payloads = new VariablePayloads(mapper, codec);
    private final AtomicInteger ids = new AtomicInteger();

    private TfcVariableClient client(FakeTfcApi api) {
        JsonApiTransport transport = new JsonApiTransport(api.webClient(), RateLimitResult::allow, mapper,
                Schedulers.parallel(), Duration.ofSeconds(5), 100);
        return new TfcVariableClient(transport, payloads);
    }

    /** Answers like the API: the submitted variable, with an id. */
    private ClientResponse echo(FakeTfcApi.Request request, HttpStatus status) {
        ObjectNode doc = (ObjectNode) readTree(request.body());
        ObjectNode data = (ObjectNode) doc.get("data");
        if (!data.has("id")) {
            data.put("id", "var-" + ids.incrementAndGet());
        }
        return FakeTfcApi.json(status, doc.toString());
    }

    private JsonNode readTree(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    void createSendsHclVariableForTuple() {
        FakeTfcApi api = new FakeTfcApi(r -> echo(r, HttpStatus.CREATED));
        VariableTarget target = new VariableTarget("tuple_out", null,
                Value.array(Value.string("aaa"), Value.string("bbb")));

        StepVerifier.create(client(api).create("ws-1", target))
                .assertNext(v -> {
                    assertThat(v.id()).isEqualTo("var-1");
                    assertThat(v.name()).isEqualTo("tuple_out");
                    assertThat(v.hcl()).isTrue();
                    assertThat(v.rawValue()).isEqualTo("[\"aaa\",\"bbb\"]");
                })
                .verifyComplete();

        FakeTfcApi.Request request = api.requests().get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.path()).isEqualTo("/workspaces/ws-1/vars");

        JsonNode data = readTree(request.body()).get("data");
        assertThat(data.get("type").asText()).isEqualTo("vars");
        assertThat(data.has("id")).isFalse();
        JsonNode attributes = data.get("attributes");
        assertThat(attributes.get("key").asText()).isEqualTo("tuple_out");
        assertThat(attributes.get("value").asText()).isEqualTo("[\"aaa\",\"bbb\"]");
        assertThat(attributes.get("description").asText()).isEmpty();
        assertThat(attributes.get("category").asText()).isEqualTo("terraform");
        assertThat(attributes.get("hcl").asBoolean()).isTrue();
    }

    @Test
    void createSendsPlainVariableForNumber() {
        FakeTfcApi api = new FakeTfcApi(r -> echo(r, HttpStatus.CREATED));
        VariableTarget target = new VariableTarget("n_out", "a number", Value.integer(0));

        StepVerifier.create(client(api).create("ws-1", target))
                .expectNextMatches(v -> !v.hcl() && "0".equals(v.rawValue()))
                .verifyComplete();

        JsonNode attributes = readTree(api.requests().get(0).body()).path("data").path("attributes");
        assertThat(attributes.get("value").isTextual()).isTrue();
        assertThat(attributes.get("value").asText()).isEqualTo("0");
        assertThat(attributes.get("hcl").asBoolean()).isFalse();
        assertThat(attributes.get("description").asText()).isEqualTo("a number");
    }

    @Test
    void updatePatchesTheVariableById() {
        FakeTfcApi api = new FakeTfcApi(r -> echo(r, HttpStatus.OK));
        VariableTarget target = new VariableTarget("s_out", null, Value.string("aaa\"bbb"));

        StepVerifier.create(client(api).update("ws-1", "var-9", target))
                .expectNextMatches(v -> v.id().equals("var-9") && v.rawValue().equals("aaa\"bbb"))
                .verifyComplete();

        FakeTfcApi.Request request = api.requests().get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.PATCH);
        assertThat(request.path()).isEqualTo("/workspaces/ws-1/vars/var-9");
        assertThat(readTree(request.body()).path("data").path("id").asText()).isEqualTo("var-9");
    }

    @Test
    void createFailsOnUnexpectedStatus() {
        FakeTfcApi api = new FakeTfcApi(r -> FakeTfcApi.json(HttpStatus.UNPROCESSABLE_ENTITY, "{\"errors\":[]}"));

        StepVerifier.create(client(api).create("ws-1", new VariableTarget("x", null, Value.bool(true))))
                .expectErrorMatches(e -> e instanceof TfcApiException api422 && api422.getStatus() == 422)
                .verify();
    }

    @Test
    void createFailsWhenResponseHasNoVariable() {
        FakeTfcApi api = new FakeTfcApi(r -> FakeTfcApi.json(HttpStatus.CREATED, "{\"data\":{\"type\":\"vars\"}}"));

        StepVerifier.create(client(api).create("ws-1", new VariableTarget("x", null, Value.bool(true))))
                .expectError(TfcApiException.class)
                .verify();
    }

    @Test
    void listKeepsTerraformVariablesKeyedByName() {
        FakeTfcApi api = new FakeTfcApi(r -> FakeTfcApi.json(HttpStatus.OK, "{\"data\":["
                + "{\"id\":\"var-1\",\"type\":\"vars\",\"attributes\":{\"key\":\"n_out\",\"value\":\"0\","
                + "\"category\":\"terraform\",\"hcl\":false}},"
                + "{\"id\":\"var-2\",\"type\":\"vars\",\"attributes\":{\"key\":\"n_out\",\"value\":\"x\","
                + "\"category\":\"env\",\"hcl\":false}},"
                + "{\"id\":\"var-3\",\"type\":\"vars\",\"attributes\":{\"key\":\"t_out\",\"value\":\"[1]\","
                + "\"category\":\"terraform\",\"hcl\":true,\"description\":null}}]}"));

        Map<String, RemoteVariable> remote = client(api).list("ws-1").block(Duration.ofSeconds(5));

        assertThat(remote).containsOnlyKeys("n_out", "t_out");
        assertThat(remote.get("n_out").id()).isEqualTo("var-1");
        assertThat(remote.get("t_out").hcl()).isTrue();
        assertThat(remote.get("t_out").description()).isNull();
        assertThat(api.requests().get(0).method()).isEqualTo(HttpMethod.GET);
        assertThat(api.requests().get(0).path()).isEqualTo("/workspaces/ws-1/vars");
    }

    @Test
    void deleteExpectsNoContent() {
        FakeTfcApi api = new FakeTfcApi(r -> FakeTfcApi.noContent());

        StepVerifier.create(client(api).deleteAll("ws-1", List.of("var-1", "var-2")))
                .verifyComplete();

        assertThat(api.requests()).extracting(FakeTfcApi.Request::path)
                .containsExactly("/workspaces/ws-1/vars/var-1", "/workspaces/ws-1/vars/var-2");
        assertThat(api.requests()).allMatch(r -> r.method() == HttpMethod.DELETE);
    }

    @Test
    void createsWaitForRateLimitAndKeepOrder() {
        VirtualTimeScheduler vts = VirtualTimeScheduler.create();
        RecordingLimiter limiter = new RecordingLimiter(
                new TokenBucket(() -> vts.now(TimeUnit.NANOSECONDS), 1, Duration.ofMillis(100)));
        List<Long> sentAtMillis = Collections.synchronizedList(new ArrayList<>());
        // calls run one after another, so the decisions made since the previous request belong to this one
        List<List<Decision>> decisionsPerCall = Collections.synchronizedList(new ArrayList<>());
        FakeTfcApi api = new FakeTfcApi(r -> {
            sentAtMillis.add(vts.now(TimeUnit.MILLISECONDS));
            decisionsPerCall.add(limiter.drain());
            return echo(r, HttpStatus.CREATED);
        });
        JsonApiTransport transport = new JsonApiTransport(api.webClient(), limiter, mapper, vts,
                Duration.ofSeconds(30), 100);
        TfcVariableClient client = new TfcVariableClient(transport, payloads);
        List<VariableTarget> targets = List.of(
                new VariableTarget("a", null, Value.integer(1)),
                new VariableTarget("b", null, Value.integer(2)),
                new VariableTarget("c", null, Value.integer(3)));

        StepVerifier.withVirtualTime(
                        () -> Flux.fromIterable(targets).concatMap(t -> client.create("ws-1", t)),
                        () -> vts, Long.MAX_VALUE)
                .expectNextMatches(v -> v.name().equals("a"))
                .thenAwait(Duration.ofSeconds(1))
                .expectNextMatches(v -> v.name().equals("b"))
                .expectNextMatches(v -> v.name().equals("c"))
                .verifyComplete();

        assertThat(decisionsPerCall).hasSize(3);
        assertThat(decisionsPerCall.get(0)).containsExactly(Decision.ALLOW);
        for (List<Decision> later : decisionsPerCall.subList(1, 3)) {
            assertThat(later).contains(Decision.REJECT).endsWith(Decision.ALLOW);
            assertThat(later).filteredOn(d -> d == Decision.ALLOW).hasSize(1);
        }
        assertThat(limiter.drain()).isEmpty();

        assertThat(api.requests()).extracting(r -> readTree(r.body()).path("data").path("attributes").path("key").asText())
                .containsExactly("a", "b", "c");
        assertThat(sentAtMillis.get(0)).isZero();
        assertThat(sentAtMillis.get(1)).isGreaterThanOrEqualTo(99L);
        assertThat(sentAtMillis.get(2)).isGreaterThanOrEqualTo(199L);
    }

    /** Delegates to a real limiter and remembers its answers until drained. */
    private static final class RecordingLimiter implements RateLimiter {

        private final RateLimiter delegate;
        private final List<Decision> decisions = Collections.synchronizedList(new ArrayList<>());

        RecordingLimiter(RateLimiter delegate) {
            this.delegate = delegate;
        }

        @Override
        public RateLimitResult tryAcquire() {
            RateLimitResult result = delegate.tryAcquire();
            decisions.add(result.decision());
            return result;
        }

        /** Decisions made since the last drain, oldest first. */
        List<Decision> drain() {
            synchronized (decisions) {
                List<Decision> made = new ArrayList<>(decisions);
                decisions.clear();
                return made;
            }
        }
    }
}
