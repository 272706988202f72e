package reqpool.pool.transport;

import reqpool.pool.model.RequestMethod;

/**
 * Executes one outbound request on behalf of the pool.
 *
 * Implementations report failures through {@link TransportOutcome#failure} instead of
 * throwing; the pool still contains any runtime exception that escapes.
 * Connection handling, retries and timeouts are the implementation's concern.
 */
@FunctionalInterface
public interface Transport {

    /**
     * Execute the request.
     *
     * @param endpoint target URL
     * @param method   HTTP method
     * @param body     request body for POST, otherwise null
     * @return the response or the error describing why there is none
     */
    TransportOutcome execute(String endpoint, RequestMethod method, String body);
}
