package reqpool;

import reqpool.pool.config.Dependencies;
import reqpool.pool.config.PoolConfig;
import reqpool.pool.config.PoolIniLoader;
import reqpool.pool.model.PoolStatus;
import reqpool.pool.service.RequestPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Command-line entry point: fetches every URL given as an argument through the pool.
 *
 * <pre>
 * java -jar reqpool.jar [--config pool.ini] url...
 * </pre>
 *
 * Exit code 0 when every request succeeded, 1 when some failed or the config could not be
 * read, 2 on a usage error.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private App() {
    }

    public static void main(String[] args) {
        int code = run(args);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        String configPath = null;
        List<String> urls = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg)) {
                if (i + 1 >= args.length) {
                    log.error("--config needs a file argument");
                    return usage();
                }
                configPath = args[++i];
            } else if (arg.startsWith("--")) {
                log.error("Unknown option: {}", arg);
                return usage();
            } else {
                urls.add(arg);
            }
        }

        if (urls.isEmpty()) {
            return usage();
        }

        PoolConfig config;
        try {
            config = loadConfig(configPath);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Cannot load config {}: {}", configPath, e.getMessage());
            return EXIT_FAILED;
        }

        try (Dependencies deps = Dependencies.create(config)) {
            if (config.statusServerEnabled() && !deps.startStatusServer()) {
                log.warn("Status server did not start, continuing without it");
            }

            RequestPool pool = deps.requestPool();
            for (String url : urls) {
                try {
                    pool.submitGet(url,
                            task -> log.info("OK   {} -> HTTP {} ({} chars)", task.endpoint(),
                                    task.result().statusCode(), task.result().body().length()),
                            (task, error) -> log.warn("FAIL {} -> {}", task.endpoint(), error.getMessage()));
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping {}: {}", url, e.getMessage());
                }
            }

            pool.awaitCompletion();
            PoolStatus status = pool.status();
            log.info("Done: {} completed, {} failed, {} cancelled of {} task(s)",
                    status.completedTasks(), status.failedTasks(), status.cancelledTasks(), status.totalTasks());

            pool.stop();
            return status.completedTasks() == urls.size() ? EXIT_OK : EXIT_FAILED;
        }
    }

    private static PoolConfig loadConfig(String path) throws IOException {
        PoolConfig config;
        if (path == null) {
            config = PoolConfig.fromEnv();
        } else {
            Optional<PoolConfig> loaded = PoolIniLoader.load(new File(path));
            if (loaded.isEmpty()) {
                log.warn("Falling back to environment config");
            }
            config = loaded.orElseGet(PoolConfig::fromEnv);
        }
        if (config.maxConcurrency() <= 0) {
            throw new IllegalArgumentException("max_concurrency must be positive, got " + config.maxConcurrency());
        }
        return config;
    }

    private static int usage() {
        log.error("Usage: reqpool [--config pool.ini] url...");
        return EXIT_USAGE;
    }
}
