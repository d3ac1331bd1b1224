package com.tfve.sync.tfc.client;

import org.springframework.http.HttpMethod;

/**
 * A call to the HCP Terraform API did not produce the expected answer.
 *
 * <p>Covers unexpected HTTP status, transport faults (status {@code 0}) and bodies that are not JSON.
 * Never retried by the client; the sync engine records it against the variable being processed.</p>
 */
public class TfcApiException extends RuntimeException {

    private static final int MAX_BODY_CHARS = 500;

    private final HttpMethod method;
    private final String path;
    private final int status;
    private final String responseBody;

    public TfcApiException(HttpMethod method, String path, int status, String responseBody) {
        super(method + " " + path + " returned status " + status + bodySuffix(responseBody));
        this.method = method;
        this.path = path;
        this.status = status;
        this.responseBody = truncate(responseBody);
    }

    public TfcApiException(HttpMethod method, String path, String message, Throwable cause) {
        super(method + " " + path + " failed: " + message, cause);
        this.method = method;
        this.path = path;
        this.status = 0;
        this.responseBody = null;
    }

    public HttpMethod getMethod() { return method; }

    public String getPath() { return path; }

    public int getStatus() { return status; }

    public String getResponseBody() { return responseBody; }

    private static String bodySuffix(String body) {
        return (body == null || body.isBlank()) ? "" : ": " + truncate(body);
    }

    private static String truncate(String body) {
        if (body == null || body.length() <= MAX_BODY_CHARS) {
            return body;
        }
        return body.substring(0, MAX_BODY_CHARS) + "...";
    }
}
