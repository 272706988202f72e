package reqpool.pool.config;

import reqpool.pool.api.v1.HealthController;
import reqpool.pool.api.v1.PoolController;
import reqpool.pool.api.v1.TaskController;
import reqpool.pool.server.PoolStatusServer;
import reqpool.pool.server.RouterHandler;
import reqpool.pool.service.RequestPool;
import reqpool.pool.transport.HttpClientTransport;
import reqpool.pool.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires the pool, its transport and the status API.
 *
 * Usage:
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(PoolConfig.fromEnv())) {
 *     deps.startStatusServer(); // optional
 *     deps.requestPool().submitGet("https://example.org");
 *     deps.requestPool().awaitCompletion();
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final PoolConfig config;
    private final Transport transport;
    private final RequestPool requestPool;

    // Controllers
    private final HealthController healthController;
    private final PoolController poolController;
    private final TaskController taskController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Status server (lazy-initialized)
    private PoolStatusServer statusServer;

    private Dependencies(PoolConfig config, Transport transport) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        this.transport = transport;
        this.requestPool = new RequestPool(config, transport);

        this.healthController = new HealthController(requestPool);
        this.poolController = new PoolController(requestPool);
        this.taskController = new TaskController(requestPool);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and the JDK HTTP client transport.
     */
    public static Dependencies create(PoolConfig config) {
        return new Dependencies(config, new HttpClientTransport(config));
    }

    /**
     * Create dependencies with a custom transport.
     */
    public static Dependencies create(PoolConfig config, Transport transport) {
        return new Dependencies(config, transport);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(PoolConfig.fromEnv());
    }

    // Getters
    public PoolConfig config() {
        return config;
    }

    public Transport transport() {
        return transport;
    }

    public RequestPool requestPool() {
        return requestPool;
    }

    public HealthController healthController() {
        return healthController;
    }

    public PoolController poolController() {
        return poolController;
    }

    public TaskController taskController() {
        return taskController;
    }

    /**
     * Get a RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(poolController)
                    .registerController(taskController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    public synchronized PoolStatusServer statusServer() {
        if (statusServer == null) {
            statusServer = new PoolStatusServer(routerHandler());
        }
        return statusServer;
    }

    /**
     * Start the status server on the configured host and port.
     *
     * @return true if the server is running
     */
    public boolean startStatusServer() {
        return statusServer().start(config.statusHost(), config.statusPort());
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop status server first
        synchronized (this) {
            if (statusServer != null) {
                try {
                    statusServer.stop();
                } catch (Exception e) {
                    log.warn("Error stopping status server: {}", e.getMessage());
                }
            }
        }

        try {
            requestPool.close();
        } catch (Exception e) {
            log.warn("Error closing request pool: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
