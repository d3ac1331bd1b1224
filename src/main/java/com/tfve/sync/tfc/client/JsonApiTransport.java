package com.tfve.sync.tfc.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tfve.sync.core.ratelimit.RateLimitResult;
import com.tfve.sync.core.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Rate-limited JSON:API access to HCP Terraform.
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Take a {@link RateLimiter} permit before every request, waiting (never failing) when the
 *       limiter says so.</li>
 *   <li>Check the response status against the one the endpoint promises.</li>
 *   <li>Parse bodies into Jackson trees and walk {@code meta.pagination} for list endpoints.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Requests go through the non-blocking {@link WebClient}. Rate-limit waits use {@code Mono.delay} on the
 * injected {@link Scheduler}, so nothing here blocks a thread.
 */
public class JsonApiTransport {

    private static final Logger log = LoggerFactory.getLogger(JsonApiTransport.class);

    public static final MediaType JSON_API = MediaType.parseMediaType("application/vnd.api+json");

    private final WebClient webClient;
    private final RateLimiter rateLimiter;
    private final ObjectMapper mapper;
    private final Scheduler scheduler;
    private final Duration requestTimeout;
    private final int pageSize;

    public JsonApiTransport(WebClient webClient, RateLimiter rateLimiter, ObjectMapper mapper,
                            Scheduler scheduler, Duration requestTimeout, int pageSize) {
        this.webClient = webClient;
        this.rateLimiter = rateLimiter;
        this.mapper = mapper;
        this.scheduler = scheduler;
        this.requestTimeout = requestTimeout;
        this.pageSize = pageSize;
    }

    /**
     * Configures a {@link WebClient.Builder} for the API: base URL, bearer token and JSON:API content type.
     */
    public static WebClient.Builder configure(WebClient.Builder builder, String baseUrl, String token) {
        return builder
                .baseUrl(baseUrl)
                .defaultHeaders(h -> {
                    if (token != null && !token.isBlank()) {
                        h.setBearerAuth(token);
                    }
                    h.setContentType(JSON_API);
                    h.set(HttpHeaders.ACCEPT, JSON_API.toString());
                });
    }

    /**
     * Sends one request and emits the parsed body, or completes empty when the body is empty.
     *
     * @param expected the only status accepted as success
     */
    public Mono<JsonNode> exchange(HttpMethod method, String path, Object[] uriVariables,
                                   String body, HttpStatus expected) {
        return exchange(method, path, uriVariables, new LinkedMultiValueMap<>(), body, expected);
    }

    /**
     * Streams every element of {@code data} across all pages of a list endpoint.
     *
     * <p>Pages are requested one after another, following {@code meta.pagination.next-page}. Endpoints that
     * do not paginate answer with a single page and no pagination block.</p>
     */
    public Flux<JsonNode> getAll(String path, Object... uriVariables) {
        return fetchPage(path, uriVariables, 1)
                .expand(page -> nextPage(page)
                        .map(next -> fetchPage(path, uriVariables, next))
                        .orElse(Mono.empty()))
                .flatMapIterable(page -> page.path("data"));
    }

    private Mono<JsonNode> fetchPage(String path, Object[] uriVariables, int pageNumber) {
        MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        query.add("page[number]", Integer.toString(pageNumber));
        query.add("page[size]", Integer.toString(pageSize));
        return exchange(HttpMethod.GET, path, uriVariables, query, null, HttpStatus.OK)
                .doOnNext(page -> log.debug("Fetched {} page {}", path, pageNumber));
    }

    static Optional<Integer> nextPage(JsonNode page) {
        JsonNode pagination = page.path("meta").path("pagination");
        JsonNode next = pagination.path("next-page");
        if (!next.canConvertToInt()) {
            return Optional.empty();
        }
        int current = pagination.path("current-page").asInt(0);
        return next.asInt() > current ? Optional.of(next.asInt()) : Optional.empty();
    }

    private Mono<JsonNode> exchange(HttpMethod method, String path, Object[] uriVariables,
                                    MultiValueMap<String, String> query, String body, HttpStatus expected) {
        return paced(() -> {
            WebClient.RequestBodySpec request = webClient.method(method)
                    .uri(b -> b.path(path).queryParams(query).build(uriVariables));
            WebClient.RequestHeadersSpec<?> ready = (body == null) ? request : request.bodyValue(body);

            return ready.exchangeToMono(response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(text -> handle(method, path, response.statusCode().value(), expected, text)))
                    .timeout(requestTimeout)
                    .onErrorMap(e -> !(e instanceof TfcApiException),
                            e -> new TfcApiException(method, path, String.valueOf(e.getMessage()), e));
        });
    }

    private Mono<JsonNode> handle(HttpMethod method, String path, int status, HttpStatus expected, String text) {
        if (status != expected.value()) {
            return Mono.error(new TfcApiException(method, path, status, text));
        }
        if (text.isBlank()) {
            return Mono.empty();
        }
        try {
            return Mono.just(mapper.readTree(text));
        } catch (JsonProcessingException e) {
            return Mono.error(new TfcApiException(method, path, "response body is not JSON", e));
        }
    }

    /**
     * Runs {@code call} once a rate-limit permit is available. A rejected permit suspends for the
     * advertised wait and then asks again for the same call.
     */
    <T> Mono<T> paced(Supplier<Mono<T>> call) {
        return Mono.defer(() -> {
            RateLimitResult permit = rateLimiter.tryAcquire();
            if (permit.allowed()) {
                return call.get();
            }
            log.debug("Rate limit reached, waiting {} ms", permit.retryAfter().toMillis());
            return Mono.delay(permit.retryAfter(), scheduler).then(paced(call));
        });
    }
}
