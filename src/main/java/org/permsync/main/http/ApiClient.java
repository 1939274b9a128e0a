package org.permsync.main.http;

import java.io.Closeable;
import java.io.IOException;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.http.Header;
import org.apache.http.NameValuePair;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.entity.UrlEncodedFormEntity;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpDelete;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.message.BasicNameValuePair;
import org.apache.http.util.EntityUtils;
import org.permsync.api.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues authenticated REST calls against one system.  Requests that are
 * rate limited (429) are retried with a random backoff until the attempts
 * run out, after which the last response is returned for the caller to
 * judge.  Server errors and transport failures are retried the same way,
 * except for POSTs.
 */
public class ApiClient implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(ApiClient.class);

    private static final long MAX_BACKOFF_MS = 60000;

    private final String systemName;
    private final String baseUrl;
    private final String authHeader;
    private final String authValue;
    private final int maxRetries;
    private final CloseableHttpClient client;

    public ApiClient(String systemName, String baseUrl, String authHeader, String authValue, int timeoutMs, int maxRetries) {
        this.systemName = systemName;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.authHeader = authHeader;
        this.authValue = authValue;
        this.maxRetries = Math.max(0, maxRetries);

        RequestConfig config = RequestConfig
            .custom()
            .setConnectTimeout(timeoutMs)
            .setConnectionRequestTimeout(timeoutMs)
            .setSocketTimeout(timeoutMs)
            .build();

        this.client = HttpClients
            .custom()
            .setDefaultRequestConfig(config)
            .build();
    }

    public String getSystemName() {
        return systemName;
    }

    public String endpoint(String path) {
        return baseUrl + path;
    }

    public ApiResponse get(String path, String... params) throws GatewayException {
        return getUrl(endpoint(path), params);
    }

    // For following pagination links, which arrive as absolute URLs.
    public ApiResponse getUrl(String url, String... params) throws GatewayException {
        try {
            URIBuilder builder = new URIBuilder(url);

            for (int i = 0; i < params.length; i += 2) {
                builder.setParameter(params[i], params[i + 1]);
            }

            return execute("GET " + url, new HttpGet(builder.build()));
        } catch (URISyntaxException e) {
            throw new GatewayException("Invalid URL: " + url, e);
        }
    }

    public ApiResponse postForm(String path, String... params) throws GatewayException {
        try {
            HttpPost request = new HttpPost(new URIBuilder(endpoint(path)).build());

            List<NameValuePair> form = new ArrayList<>();
            for (int i = 0; i < params.length; i += 2) {
                form.add(new BasicNameValuePair(params[i], params[i + 1]));
            }

            request.setEntity(new UrlEncodedFormEntity(form, "UTF-8"));

            return execute("POST " + path, request);
        } catch (URISyntaxException | IOException e) {
            throw new GatewayException("Couldn't build request for " + path, e);
        }
    }

    public ApiResponse delete(String path) throws GatewayException {
        try {
            return execute("DELETE " + path, new HttpDelete(new URIBuilder(endpoint(path)).build()));
        } catch (URISyntaxException e) {
            throw new GatewayException("Invalid URL: " + path, e);
        }
    }

    private ApiResponse execute(String requestId, HttpRequestBase request) throws GatewayException {
        request.setHeader(authHeader, authValue);
        request.setHeader("Accept", "application/json");

        for (int attempt = 0; ; attempt++) {
            ApiResponse response;

            try (CloseableHttpResponse httpResponse = client.execute(request)) {
                Map<String, String> headers = new HashMap<>();
                for (Header header : httpResponse.getAllHeaders()) {
                    // Repeated headers (Okta sends several Link headers) are folded together.
                    headers.merge(header.getName(), header.getValue(), (a, b) -> a + ", " + b);
                }

                String body = (httpResponse.getEntity() == null) ? "" : EntityUtils.toString(httpResponse.getEntity(), "UTF-8");

                response = new ApiResponse(requestId, httpResponse.getStatusLine().getStatusCode(), body, headers);
            } catch (IOException e) {
                if (attempt < maxRetries && isIdempotent(request.getMethod())) {
                    LOG.warn("{} request {} failed ({}).  Retrying", systemName, requestId, e.getMessage());
                    backoff(attempt, null);
                    continue;
                }

                throw new GatewayException(String.format("%s request %s failed", systemName, requestId), e);
            }

            if (isRetryable(request.getMethod(), response.getStatusCode()) && attempt < maxRetries) {
                LOG.warn("{} request {} returned {}.  Retrying", systemName, requestId, response.getStatusCode());
                backoff(attempt, response.header("Retry-After"));
                continue;
            }

            return response;
        }
    }

    // A POST that failed midway may already have taken effect, so it is only
    // resent when the server turned it away with a 429.
    static boolean isRetryable(String method, int statusCode) {
        if (statusCode == 429) {
            return true;
        }

        return statusCode >= 500 && isIdempotent(method);
    }

    static boolean isIdempotent(String method) {
        return !"POST".equalsIgnoreCase(method);
    }

    private void backoff(int attempt, String retryAfter) throws GatewayException {
        long delayMs = (long) Math.floor(1000 + (5000 * Math.random())) * (attempt + 1);

        if (retryAfter != null && retryAfter.trim().matches("[0-9]+")) {
            delayMs = Long.parseLong(retryAfter.trim()) * 1000;
        }

        try {
            Thread.sleep(Math.min(delayMs, MAX_BACKOFF_MS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException(String.format("Interrupted while waiting to retry a %s request", systemName), e);
        }
    }

    public void close() throws IOException {
        client.close();
    }
}
