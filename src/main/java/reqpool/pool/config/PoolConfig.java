package reqpool.pool.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration holder for the request pool, its default transport and the status server.
 * All settings have sensible defaults.
 */
public final class PoolConfig {

    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/71.0.3578.98 Safari/537.36";

    // Pool settings
    private int maxConcurrency = 5;
    private Duration idlePollInterval = Duration.ofMillis(100);
    private Duration stopTimeout = Duration.ofSeconds(30);

    // Transport settings
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration requestTimeout = Duration.ofSeconds(50);
    private int maxRetries = 1;
    private Duration retryDelay = Duration.ofSeconds(1);
    private String userAgent = DEFAULT_USER_AGENT;
    private String postContentType = "application/x-www-form-urlencoded";
    private final Map<String, String> defaultHeaders = new LinkedHashMap<>();

    // Status server settings
    private boolean statusServerEnabled = false;
    private String statusHost = "0.0.0.0";
    private int statusPort = 8081;

    private PoolConfig() {
    }

    public static PoolConfig defaults() {
        return new PoolConfig();
    }

    public static PoolConfig fromEnv() {
        PoolConfig config = new PoolConfig();

        // Override from environment variables
        String maxConcurrency = System.getenv("REQPOOL_MAX_CONCURRENCY");
        if (maxConcurrency != null && !maxConcurrency.isBlank()) {
            config.maxConcurrency = Integer.parseInt(maxConcurrency.trim());
        }

        String pollMs = System.getenv("REQPOOL_IDLE_POLL_MS");
        if (pollMs != null && !pollMs.isBlank()) {
            config.idlePollInterval = Duration.ofMillis(Long.parseLong(pollMs.trim()));
        }

        String port = System.getenv("REQPOOL_STATUS_PORT");
        if (port != null && !port.isBlank()) {
            config.statusPort = Integer.parseInt(port.trim());
            config.statusServerEnabled = true;
        }

        String connectMs = System.getenv("REQPOOL_CONNECT_TIMEOUT_MS");
        if (connectMs != null && !connectMs.isBlank()) {
            config.connectTimeout = Duration.ofMillis(Long.parseLong(connectMs.trim()));
        }

        String requestMs = System.getenv("REQPOOL_REQUEST_TIMEOUT_MS");
        if (requestMs != null && !requestMs.isBlank()) {
            config.requestTimeout = Duration.ofMillis(Long.parseLong(requestMs.trim()));
        }

        String retries = System.getenv("REQPOOL_MAX_RETRIES");
        if (retries != null && !retries.isBlank()) {
            config.maxRetries = Integer.parseInt(retries.trim());
        }

        return config;
    }

    // Getters
    public int maxConcurrency() {
        return maxConcurrency;
    }

    public Duration idlePollInterval() {
        return idlePollInterval;
    }

    public Duration stopTimeout() {
        return stopTimeout;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration retryDelay() {
        return retryDelay;
    }

    public String userAgent() {
        return userAgent;
    }

    public String postContentType() {
        return postContentType;
    }

    public Map<String, String> defaultHeaders() {
        return Map.copyOf(defaultHeaders);
    }

    public boolean statusServerEnabled() {
        return statusServerEnabled;
    }

    public String statusHost() {
        return statusHost;
    }

    public int statusPort() {
        return statusPort;
    }

    // Fluent setters for testing/customization
    public PoolConfig withMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
        return this;
    }

    public PoolConfig withIdlePollInterval(Duration interval) {
        this.idlePollInterval = interval;
        return this;
    }

    public PoolConfig withStopTimeout(Duration timeout) {
        this.stopTimeout = timeout;
        return this;
    }

    public PoolConfig withConnectTimeout(Duration timeout) {
        this.connectTimeout = timeout;
        return this;
    }

    public PoolConfig withRequestTimeout(Duration timeout) {
        this.requestTimeout = timeout;
        return this;
    }

    public PoolConfig withMaxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.maxRetries = maxRetries;
        return this;
    }

    public PoolConfig withRetryDelay(Duration delay) {
        this.retryDelay = delay;
        return this;
    }

    public PoolConfig withUserAgent(String userAgent) {
        this.userAgent = userAgent;
        return this;
    }

    public PoolConfig withPostContentType(String contentType) {
        this.postContentType = contentType;
        return this;
    }

    public PoolConfig withDefaultHeader(String name, String value) {
        this.defaultHeaders.put(name, value);
        return this;
    }

    public PoolConfig withStatusServer(String host, int port) {
        this.statusServerEnabled = true;
        this.statusHost = host;
        this.statusPort = port;
        return this;
    }

    public PoolConfig withStatusServerEnabled(boolean enabled) {
        this.statusServerEnabled = enabled;
        return this;
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "maxConcurrency=" + maxConcurrency +
                ", idlePollInterval=" + idlePollInterval.toMillis() + "ms" +
                ", requestTimeout=" + requestTimeout.toMillis() + "ms" +
                ", maxRetries=" + maxRetries +
                ", statusServer=" + (statusServerEnabled ? statusHost + ":" + statusPort : "off") +
                '}';
    }
}
