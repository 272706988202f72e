package reqpool.pool.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import reqpool.pool.api.Controller;
import reqpool.pool.api.v1.dto.TaskResponse;
import reqpool.pool.model.RequestTask;
import reqpool.pool.model.TaskStatus;
import reqpool.pool.server.RouterHandler;
import reqpool.pool.service.RequestPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only task queries.
 *
 * GET /api/v1/tasks - All tasks, oldest first (optional ?status=FAILED filter)
 * GET /api/v1/tasks/{taskId} - One task including its response body
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");

    private final RequestPool pool;

    public TaskController(RequestPool pool) {
        this.pool = pool;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.GET)) {
            return false;
        }
        return TASKS_PATTERN.matcher(path).matches() || TASK_BY_ID_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (TASKS_PATTERN.matcher(path).matches()) {
                return handleList(req);
            }

            Matcher taskMatcher = TASK_BY_ID_PATTERN.matcher(path);
            if (taskMatcher.matches()) {
                return handleGetTask(taskMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Task controller error", e);
            return ControllerResponse.internalError("internal error");
        }
    }

    /**
     * GET /api/v1/tasks[?status=...]
     */
    private ControllerResponse handleList(FullHttpRequest req) throws Exception {
        TaskStatus filter = parseStatus(new QueryStringDecoder(req.uri()));

        List<TaskResponse> tasks = pool.listTasks().stream()
                .filter(t -> filter == null || t.status() == filter)
                .sorted(Comparator.comparing(RequestTask::createdAt))
                .map(t -> TaskResponse.from(t).compact())
                .toList();

        Map<String, Object> response = Map.of(
                "count", tasks.size(),
                "tasks", tasks);

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/tasks/{taskId}
     */
    private ControllerResponse handleGetTask(String taskId) throws Exception {
        Optional<RequestTask> task = pool.getTask(taskId);
        if (task.isEmpty()) {
            return ControllerResponse.notFound("task not found: " + taskId);
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(task.get())));
    }

    private static TaskStatus parseStatus(QueryStringDecoder query) {
        List<String> values = query.parameters().get("status");
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        String value = values.get(0).trim().toUpperCase(Locale.ROOT);
        try {
            return TaskStatus.valueOf(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown task status: " + values.get(0), e);
        }
    }
}
