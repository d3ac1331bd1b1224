package com.tfve.sync.tfc.config;

import com.tfve.sync.core.model.FailurePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration of the exporter, bound from the {@code tfve} prefix.
 *
 * <h2>Binding</h2>
 * <pre>
 * tfve:
 *   base-url: https://app.terraform.io/api/v2
 *   organization-name: ${TFVE_ORGANIZATION_NAME:}
 *   token: ${TFVE_TOKEN:}
 *   allow-update: false
 *   failure-policy: STOP
 *   page-size: 100
 *   request-timeout: 30s
 *   rate-limit:
 *     permits: 20
 *     window: 1s
 * </pre>
 *
 * <h2>Operational notes</h2>
 * <ul>
 *   <li>The token is a secret: it is read from the environment and never logged.</li>
 *   <li>The API allows 20 requests per second per token; lower the limit when several exporters share
 *       a token.</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "tfve")
public class TfvarExportProperties {

    /** Base URL of the API, including the {@code /api/v2} path. */
    @NotBlank
    private String baseUrl = "https://app.terraform.io/api/v2";

    /** Organization owning the target workspaces. */
    private String organizationName;

    /** API token sent as a bearer token. */
    private String token;

    /** Overwrite variables that already exist. Also enabled by the {@code --allow-update} flag. */
    private boolean allowUpdate = false;

    /** What to do after a variable fails to be created or updated. */
    @NotNull
    private FailurePolicy failurePolicy = FailurePolicy.STOP;

    /** Page size for list endpoints; the API caps it at 100. */
    @Min(1)
    @Max(100)
    private int pageSize = 100;

    /** Timeout of a single HTTP request, rate-limit waits excluded. */
    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(30);

    @Valid
    private RateLimit rateLimit = new RateLimit();

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getOrganizationName() { return organizationName; }
    public void setOrganizationName(String organizationName) { this.organizationName = organizationName; }

    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }

    public boolean isAllowUpdate() { return allowUpdate; }
    public void setAllowUpdate(boolean allowUpdate) { this.allowUpdate = allowUpdate; }

    public FailurePolicy getFailurePolicy() { return failurePolicy; }
    public void setFailurePolicy(FailurePolicy failurePolicy) { this.failurePolicy = failurePolicy; }

    public int getPageSize() { return pageSize; }
    public void setPageSize(int pageSize) { this.pageSize = pageSize; }

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

    public RateLimit getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimit rateLimit) { this.rateLimit = rateLimit; }

    /**
     * Requests allowed per window, shared by every API call of the process.
     */
    public static class RateLimit {

        @Min(1)
        private long permits = 20;

        @NotNull
        private Duration window = Duration.ofSeconds(1);

        public long getPermits() { return permits; }
        public void setPermits(long permits) { this.permits = permits; }

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
    }
}
