package reqpool.pool.model;

/**
 * HTTP method of a request task.
 */
public enum RequestMethod {
    GET,
    POST
}
