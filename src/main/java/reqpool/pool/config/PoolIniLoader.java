package reqpool.pool.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Loads pool settings from an INI file.
 * Supports sections [POOL] (required), [TRANSPORT], [HEADERS] and [SERVER] (optional).
 * Keys that are absent keep their defaults.
 *
 * <pre>
 * [POOL]
 * max_concurrency = 8
 * idle_poll_ms    = 100
 *
 * [TRANSPORT]
 * request_timeout_ms = 20000
 * max_retries        = 2
 *
 * [HEADERS]
 * Accept = application/json
 *
 * [SERVER]
 * enabled = true
 * port    = 8081
 * </pre>
 */
public final class PoolIniLoader {

    private static final Logger log = LoggerFactory.getLogger(PoolIniLoader.class);

    private PoolIniLoader() {
    }

    /**
     * Load a config from the given file.
     *
     * @return the config, or empty when the file has no [POOL] section
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static Optional<PoolConfig> load(File file) throws IOException {
        Ini ini = new Ini(file);

        Profile.Section pool = ini.get("POOL");
        Profile.Section transport = ini.get("TRANSPORT");
        Profile.Section headers = ini.get("HEADERS");
        Profile.Section server = ini.get("SERVER");

        if (pool == null) {
            log.warn("No [POOL] section in {}", file);
            return Optional.empty();
        }

        PoolConfig cfg = PoolConfig.defaults();

        // POOL
        String max = opt(pool, "max_concurrency");
        if (max != null) cfg.withMaxConcurrency(toInt("max_concurrency", max));
        String poll = opt(pool, "idle_poll_ms");
        if (poll != null) cfg.withIdlePollInterval(toMillis("idle_poll_ms", poll));
        String stop = opt(pool, "stop_timeout_ms");
        if (stop != null) cfg.withStopTimeout(toMillis("stop_timeout_ms", stop));

        // TRANSPORT
        if (transport != null) {
            String connect = opt(transport, "connect_timeout_ms");
            if (connect != null) cfg.withConnectTimeout(toMillis("connect_timeout_ms", connect));
            String request = opt(transport, "request_timeout_ms");
            if (request != null) cfg.withRequestTimeout(toMillis("request_timeout_ms", request));
            String retries = opt(transport, "max_retries");
            if (retries != null) cfg.withMaxRetries(toInt("max_retries", retries));
            String delay = opt(transport, "retry_delay_ms");
            if (delay != null) cfg.withRetryDelay(toMillis("retry_delay_ms", delay));
            String agent = opt(transport, "user_agent");
            if (agent != null) cfg.withUserAgent(agent);
            String contentType = opt(transport, "post_content_type");
            if (contentType != null) cfg.withPostContentType(contentType);
        }

        // HEADERS
        if (headers != null) {
            for (String name : headers.keySet()) {
                String value = opt(headers, name);
                if (value != null) cfg.withDefaultHeader(name, value);
            }
        }

        // SERVER
        if (server != null) {
            cfg.withStatusServerEnabled(Boolean.parseBoolean(opt(server, "enabled", "false")));
            String host = opt(server, "host", cfg.statusHost());
            int port = toInt("port", opt(server, "port", String.valueOf(cfg.statusPort())));
            if (cfg.statusServerEnabled()) {
                cfg.withStatusServer(host, port);
            }
        }

        log.info("Loaded {} from {}", cfg, file);
        return Optional.of(cfg);
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        String v = s == null ? null : s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = opt(s, key);
        return v == null ? def : v;
    }

    private static int toInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static Duration toMillis(String key, String value) {
        try {
            return Duration.ofMillis(Long.parseLong(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid milliseconds for " + key + ": " + value, e);
        }
    }
}
