package org.permsync.main.http;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import org.permsync.api.GatewayException;

/**
 * A fully-read HTTP response.  The body and headers are captured when the
 * request completes, so there's nothing to close.
 */
public class ApiResponse {
    private final String requestId;
    private final int statusCode;
    private final String body;
    private final Map<String, String> headers;

    public ApiResponse(String requestId, int statusCode, String body, Map<String, String> headers) {
        this.requestId = requestId;
        this.statusCode = statusCode;
        this.body = (body == null) ? "" : body;

        Map<String, String> normalized = new TreeMap<>();
        if (headers != null) {
            headers.forEach((k, v) -> normalized.put(k.toLowerCase(Locale.ROOT), v));
        }
        this.headers = Collections.unmodifiableMap(normalized);
    }

    public String getRequestId() {
        return requestId;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String body() {
        return body;
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public void successOrDie() throws GatewayException {
        if (isSuccess()) {
            return;
        }

        throw new GatewayException(failureDescription());
    }

    public JSON json() throws GatewayException {
        successOrDie();

        try {
            return JSON.parse(body);
        } catch (IllegalArgumentException e) {
            throw new GatewayException(String.format("Unreadable response to %s", requestId), e);
        }
    }

    public String failureDescription() {
        return String.format("Failed request %s: %d (%s)", requestId, statusCode, body);
    }
}
