package reqpool.pool.api;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * A read-only endpoint of the status API.
 * The router asks each registered controller in turn whether it serves a request.
 */
public interface Controller {

    /**
     * @param method HTTP method
     * @param path   request path without the query string
     * @return true if {@link #handle} should serve this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Serve a request this controller matched. An {@link IllegalArgumentException} escaping
     * from here becomes a 400, anything else a 500.
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Status and JSON body to send back.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        private static final String JSON = "application/json";

        public static ControllerResponse json(String body) {
            return json(HttpResponseStatus.OK, body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, JSON, body);
        }

        /** {@code {"error": message}} with the given status. */
        public static ControllerResponse error(HttpResponseStatus status, String message) {
            String body = JsonNodeFactory.instance.objectNode()
                    .put("error", message == null ? "" : message)
                    .toString();
            return json(status, body);
        }

        public static ControllerResponse notFound(String message) {
            return error(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return error(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse internalError(String message) {
            return error(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }
    }
}
