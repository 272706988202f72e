package reqpool.pool.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.QueryStringDecoder;
import reqpool.pool.api.Controller;
import reqpool.pool.api.Controller.ControllerResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Dispatches status API requests to the first registered controller that matches.
 * Unmatched routes get a JSON 404.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new CopyOnWriteArrayList<>();

    /**
     * Controllers are matched in registration order.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String path = new QueryStringDecoder(req.uri()).path();
        write(ctx, route(ctx, req, path));
    }

    private ControllerResponse route(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            for (Controller controller : controllers) {
                if (controller.matches(req.method(), path)) {
                    return controller.handle(ctx, req, path);
                }
            }
            log.debug("No handler for: {} {}", req.method(), path);
            return ControllerResponse.notFound("not found");
        } catch (IllegalArgumentException e) {
            log.warn("Bad request {} {}: {}", req.method(), path, e.getMessage());
            return ControllerResponse.badRequest(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Handler error: {} {}", req.method(), path, e);
            return ControllerResponse.internalError(e.toString());
        }
    }

    private ChannelFuture write(ChannelHandlerContext ctx, ControllerResponse response) {
        byte[] bytes = response.body() == null ? new byte[0] : response.body().getBytes(StandardCharsets.UTF_8);
        FullHttpResponse http = new DefaultFullHttpResponse(HTTP_1_1, response.status(), Unpooled.wrappedBuffer(bytes));
        http.headers().set(HttpHeaderNames.CONTENT_TYPE, response.contentType() + "; charset=utf-8");
        HttpUtil.setContentLength(http, bytes.length);
        return ctx.writeAndFlush(http).addListener(future -> {
            if (!future.isSuccess()) {
                log.warn("Failed to write {} response: {}", response.status().code(), future.cause().toString());
            }
        });
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        write(ctx, ControllerResponse.error(HttpResponseStatus.INTERNAL_SERVER_ERROR,
                "channel error: " + cause.getMessage()))
                .addListener(ChannelFutureListener.CLOSE);
    }

    /**
     * Shared mapper for DTO serialization, with ISO-8601 dates.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
