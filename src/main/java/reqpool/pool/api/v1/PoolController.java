package reqpool.pool.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import reqpool.pool.api.Controller;
import reqpool.pool.api.v1.dto.PoolStatusResponse;
import reqpool.pool.server.RouterHandler;
import reqpool.pool.service.RequestPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * GET /api/v1/pool/status - Pool counters
 */
public class PoolController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(PoolController.class);

    private final RequestPool pool;

    public PoolController(RequestPool pool) {
        this.pool = pool;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/pool/status".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            PoolStatusResponse response = PoolStatusResponse.from(
                    pool.status(),
                    pool.dispatchState().name(),
                    pool.maxConcurrency(),
                    pool.availableSlots());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (Exception e) {
            log.error("Pool status failed", e);
            return ControllerResponse.internalError("internal error");
        }
    }
}
