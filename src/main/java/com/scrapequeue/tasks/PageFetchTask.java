package com.scrapequeue.tasks;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.json.JSONException;
import org.json.JSONObject;

import com.scrapequeue.core.BaseTask;
import com.scrapequeue.core.RateLimitedException;
import com.scrapequeue.core.TaskContext;
import com.scrapequeue.core.TerminalValidationException;
import com.scrapequeue.core.TransientNetworkException;

/**
 * Fetches one page over HTTP.
 *
 * <p>The response status decides how the scheduler treats the attempt:</p>
 * <ul>
 *   <li>2xx: success, a {@link Page}</li>
 *   <li>429 and 503: {@link RateLimitedException}, honoring {@code Retry-After} seconds</li>
 *   <li>408 and other 5xx: {@link TransientNetworkException}, retried</li>
 *   <li>other 4xx, and URLs that are not absolute http(s): {@link TerminalValidationException}</li>
 * </ul>
 * Connection failures and timeouts surface as {@link java.io.IOException} and are retried.
 */
public class PageFetchTask extends BaseTask<PageFetchTask.Page> {
    private static final Logger logger = Logger.getLogger(PageFetchTask.class.getName());

    public static final String DEFAULT_USER_AGENT = "scrape-queue-scheduler/1.0";
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    // Shared client; HttpClient is thread-safe and pools connections
    private static final HttpClient sharedClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(10))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();

    public PageFetchTask(String url) {
        this(url, DEFAULT_USER_AGENT);
    }

    public PageFetchTask(String url, String userAgent) {
        super();
        JSONObject json = new JSONObject();
        json.put("url", url);
        json.put("userAgent", userAgent);
        setPayload(json.toString());
    }

    public String getUrl() {
        return readPayload().optString("url", null);
    }

    public String getUserAgent() {
        return readPayload().optString("userAgent", DEFAULT_USER_AGENT);
    }

    @Override
    public String getHost() {
        try {
            return URI.create(getUrl()).getHost();
        } catch (RuntimeException e) {
            return null;
        }
    }

    @Override
    public CompletableFuture<Page> execute(TaskContext context) {
        String url = getUrl();
        URI uri = parseTarget(url);
        context.throwIfCancelled();

        Duration timeout = getTimeoutMillis() > 0 ? Duration.ofMillis(getTimeoutMillis()) : DEFAULT_REQUEST_TIMEOUT;
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", getUserAgent())
                .GET()
                .build();

        context.log(Level.FINE, "GET " + url + " (attempt " + context.getAttempt() + ")");
        CompletableFuture<HttpResponse<String>> response = sharedClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        Runnable unregister = context.getCancellation().onCancel(() -> response.cancel(true));

        return response
                .whenComplete((ignored, error) -> unregister.run())
                .thenApply(this::toPage);
    }

    private Page toPage(HttpResponse<String> response) {
        int status = response.statusCode();
        String url = response.uri().toString();

        if (status >= 200 && status < 300) {
            String body = response.body() == null ? "" : response.body();
            String contentType = response.headers().firstValue("Content-Type").orElse(null);
            logger.fine("Fetched " + url + " (" + status + ", " + body.length() + " chars)");
            return new Page(url, status, body.length(), contentType);
        }
        if (status == 429 || status == 503) {
            long retryAfterMillis = response.headers().firstValue("Retry-After")
                    .map(PageFetchTask::parseRetryAfter)
                    .orElse(0L);
            throw new RateLimitedException("Rate limited by " + url + " (HTTP " + status + ")", status, retryAfterMillis);
        }
        if (status == 408 || status >= 500) {
            throw new TransientNetworkException("HTTP " + status + " from " + url, status, null);
        }
        if (status >= 400) {
            throw new TerminalValidationException("HTTP " + status + " from " + url);
        }
        throw new TransientNetworkException("Unexpected HTTP " + status + " from " + url, status, null);
    }

    private URI parseTarget(String url) {
        if (url == null || url.isEmpty()) {
            throw new TerminalValidationException("Task " + getId() + " has no URL");
        }
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            throw new TerminalValidationException("Malformed URL: " + url, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!(scheme.equals("http") || scheme.equals("https")) || uri.getHost() == null) {
            throw new TerminalValidationException("Not an absolute http(s) URL: " + url);
        }
        return uri;
    }

    private JSONObject readPayload() {
        try {
            return new JSONObject(getPayload());
        } catch (JSONException e) {
            throw new TerminalValidationException("Invalid JSON payload for page fetch task " + getId(), e);
        }
    }

    // Retry-After in delta-seconds; HTTP dates are ignored
    static long parseRetryAfter(String value) {
        try {
            long seconds = Long.parseLong(value.trim());
            return Math.max(0L, seconds) * 1000L;
        } catch (NumberFormatException e) {
            logger.fine("Ignoring non-numeric Retry-After: " + value);
            return 0L;
        }
    }

    /**
     * What a successful fetch returns.
     */
    public static final class Page {
        private final String url;
        private final int statusCode;
        private final int bodyLength;
        private final String contentType;

        public Page(String url, int statusCode, int bodyLength, String contentType) {
            this.url = url;
            this.statusCode = statusCode;
            this.bodyLength = bodyLength;
            this.contentType = contentType;
        }

        public String getUrl() {
            return url;
        }

        public int getStatusCode() {
            return statusCode;
        }

        public int getBodyLength() {
            return bodyLength;
        }

        public String getContentType() {
            return contentType;
        }

        @Override
        public String toString() {
            return "Page{url='" + url + "', status=" + statusCode + ", length=" + bodyLength + "}";
        }
    }
}
