package reqpool.pool.transport;

import reqpool.pool.config.PoolConfig;
import reqpool.pool.model.RequestMethod;
import reqpool.pool.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Default {@link Transport} backed by the JDK {@link HttpClient}.
 *
 * I/O errors and timeouts are retried up to {@code maxRetries} times with a fixed delay.
 * Non-2xx responses are not retried; they fail with the response attached.
 * Never throws: every problem becomes a failed {@link TransportOutcome}.
 */
public class HttpClientTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(HttpClientTransport.class);

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final int maxRetries;
    private final Duration retryDelay;
    private final String userAgent;
    private final String postContentType;
    private final Map<String, String> defaultHeaders;

    public HttpClientTransport(PoolConfig config) {
        this(HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), config);
    }

    public HttpClientTransport(HttpClient httpClient, PoolConfig config) {
        this.httpClient = httpClient;
        this.requestTimeout = config.requestTimeout();
        this.maxRetries = config.maxRetries();
        this.retryDelay = config.retryDelay();
        this.userAgent = config.userAgent();
        this.postContentType = config.postContentType();
        this.defaultHeaders = config.defaultHeaders();
    }

    @Override
    public TransportOutcome execute(String endpoint, RequestMethod method, String body) {
        HttpRequest request;
        try {
            request = buildRequest(endpoint, method, body);
        } catch (IllegalArgumentException e) {
            return TransportOutcome.failure(new TransportException("Invalid request URL: " + endpoint, e));
        }

        int attempt = 0;
        while (true) {
            try {
                HttpResponse<String> response = httpClient.send(request,
                        HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
                TaskResult result = TaskResult.success(response.statusCode(), response.body(),
                        response.headers().map());
                if (response.statusCode() / 100 != 2) {
                    String message = "HTTP " + response.statusCode() + " from " + endpoint;
                    return TransportOutcome.failure(
                            new TransportException(message, response.statusCode(), null),
                            result.withError(message));
                }
                return TransportOutcome.success(result);
            } catch (HttpTimeoutException e) {
                attempt++;
                if (attempt > maxRetries) {
                    return TransportOutcome.failure(new TransportException(
                            "Request timed out after " + maxRetries + " retries: " + endpoint, e));
                }
                log.debug("Timeout on {} {}, retry {}/{}", method, endpoint, attempt, maxRetries);
            } catch (IOException e) {
                attempt++;
                if (attempt > maxRetries) {
                    return TransportOutcome.failure(new TransportException(
                            "Request failed after " + maxRetries + " retries: " + e.getMessage(), e));
                }
                log.debug("I/O error on {} {} ({}), retry {}/{}", method, endpoint, e.getMessage(), attempt,
                        maxRetries);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return TransportOutcome.failure(new TransportException("Request interrupted: " + endpoint, e));
            }

            if (!sleepBeforeRetry()) {
                return TransportOutcome.failure(new TransportException("Request interrupted: " + endpoint));
            }
        }
    }

    private HttpRequest buildRequest(String endpoint, RequestMethod method, String body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(endpoint))
                .timeout(requestTimeout)
                .header("User-Agent", userAgent);

        defaultHeaders.forEach(builder::header);

        return switch (method) {
            case GET -> builder.GET().build();
            case POST -> builder
                    .header("Content-Type", postContentType)
                    .POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8))
                    .build();
        };
    }

    private boolean sleepBeforeRetry() {
        try {
            Thread.sleep(retryDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
