package com.tfve.sync.tfc.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tfve.sync.core.client.RemoteVariableClient;
import com.tfve.sync.core.ratelimit.RateLimiter;
import com.tfve.sync.core.ratelimit.SystemClock;
import com.tfve.sync.core.ratelimit.TokenBucket;
import com.tfve.sync.core.value.ValueCodec;
import com.tfve.sync.input.ExportListReader;
import com.tfve.sync.input.OutputDocumentReader;
import com.tfve.sync.input.TargetAssembler;
import com.tfve.sync.tfc.client.JsonApiTransport;
import com.tfve.sync.tfc.client.TfcVariableClient;
import com.tfve.sync.tfc.client.TfcWorkspaceDirectory;
import com.tfve.sync.tfc.client.VariablePayloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Schedulers;

/**
 * Spring configuration that wires up:
 * - the process-wide {@link RateLimiter}
 * - the rate-limited JSON:API transport over {@link WebClient}
 * - the variable client and workspace directory built on it
 * - the local input readers
 *
 * <h2>Rate limiting</h2>
 * Exactly one limiter exists per process and every API component receives it, so pagination, lookups
 * and variable writes all draw from the same permits.
 */
@Configuration
@EnableConfigurationProperties(TfvarExportProperties.class)
public class TfcClientConfig {

    private static final Logger log = LoggerFactory.getLogger(TfcClientConfig.class);

    @Bean
    public ValueCodec valueCodec(ObjectMapper mapper) {
        return new ValueCodec(mapper);
    }

    @Bean
    public RateLimiter apiRateLimiter(TfvarExportProperties props) {
        TfvarExportProperties.RateLimit limit = props.getRateLimit();
        log.debug("API rate limit: {} requests per {}", limit.getPermits(), limit.getWindow());
        return new TokenBucket(SystemClock.instance(), limit.getPermits(), limit.getWindow());
    }

    @Bean
    public JsonApiTransport jsonApiTransport(WebClient.Builder builder, TfvarExportProperties props,
                                             RateLimiter apiRateLimiter, ObjectMapper mapper) {
        WebClient webClient = JsonApiTransport.configure(builder, props.getBaseUrl(), props.getToken()).build();
        return new JsonApiTransport(webClient, apiRateLimiter, mapper, Schedulers.parallel(),
                props.getRequestTimeout(), props.getPageSize());
    }

    @Bean
    public VariablePayloads variablePayloads(ObjectMapper mapper, ValueCodec valueCodec) {
        return new VariablePayloads(mapper, valueCodec);
    }

    @Bean
    public RemoteVariableClient remoteVariableClient(JsonApiTransport transport, VariablePayloads payloads) {
        return new TfcVariableClient(transport, payloads);
    }

    @Bean
    public TfcWorkspaceDirectory workspaceDirectory(JsonApiTransport transport, TfvarExportProperties props) {
        return new TfcWorkspaceDirectory(transport, props.getOrganizationName());
    }

    @Bean
    public OutputDocumentReader outputDocumentReader(ValueCodec valueCodec) {
        return new OutputDocumentReader(valueCodec);
    }

    @Bean
    public ExportListReader exportListReader() {
        return new ExportListReader();
    }

    @Bean
    public TargetAssembler targetAssembler() {
        return new TargetAssembler();
    }
}
