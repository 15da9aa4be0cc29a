package taskforge.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import taskforge.coordinator.api.Controller;
import taskforge.coordinator.api.v1.dto.SubmissionReceipt;
import taskforge.coordinator.api.v1.dto.SubmitTaskRequest;
import taskforge.coordinator.api.v1.dto.TaskListQuery;
import taskforge.coordinator.api.v1.dto.TaskResponse;
import taskforge.coordinator.api.v1.dto.TaskStatsResponse;
import taskforge.coordinator.server.RouterHandler;
import taskforge.coordinator.service.MonitoringService;
import taskforge.coordinator.service.SubmissionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for task submission and lookup (public API).
 *
 * POST /api/v1/tasks - Submit a task
 * GET /api/v1/tasks?status=&page=&limit= - List tasks, newest first
 * GET /api/v1/tasks/stats - Task and queue counts
 * GET /api/v1/tasks/{id} - Get a task
 * DELETE /api/v1/tasks/{id} - Delete a finished task
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern STATS_PATTERN = Pattern.compile("^/api/v1/tasks/stats$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");

    private final SubmissionService submissionService;
    private final MonitoringService monitoringService;

    public TaskController(SubmissionService submissionService, MonitoringService monitoringService) {
        this.submissionService = submissionService;
        this.monitoringService = monitoringService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return TASKS_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return TASKS_PATTERN.matcher(path).matches() || TASK_BY_ID_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.DELETE)) {
            return TASK_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST)) {
                return handleSubmit(req);
            }

            if (req.method().equals(HttpMethod.GET) && TASKS_PATTERN.matcher(path).matches()) {
                return handleList(req);
            }

            if (req.method().equals(HttpMethod.GET) && STATS_PATTERN.matcher(path).matches()) {
                return handleStats();
            }

            Matcher taskMatcher = TASK_BY_ID_PATTERN.matcher(path);
            if (!taskMatcher.matches()) {
                return ControllerResponse.notFound("unknown task endpoint");
            }
            String taskId = taskMatcher.group(1);

            if (req.method().equals(HttpMethod.DELETE)) {
                submissionService.delete(taskId);
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                        Map.of("deleted", true, "id", taskId)));
            }

            TaskResponse response = TaskResponse.from(submissionService.get(taskId));
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (JsonProcessingException e) {
            log.error("Task controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/tasks - Submit a task
     */
    private ControllerResponse handleSubmit(FullHttpRequest req) throws JsonProcessingException {
        SubmitTaskRequest request = RouterHandler.readJson(req, SubmitTaskRequest.class);

        SubmissionReceipt receipt = submissionService.submit(request);

        return ControllerResponse.json(
                HttpResponseStatus.ACCEPTED,
                RouterHandler.mapper().writeValueAsString(receipt));
    }

    /**
     * GET /api/v1/tasks - List tasks
     */
    private ControllerResponse handleList(FullHttpRequest req) throws JsonProcessingException {
        TaskListQuery query = TaskListQuery.fromParameters(new QueryStringDecoder(req.uri()).parameters());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(submissionService.list(query)));
    }

    /**
     * GET /api/v1/tasks/stats - Task counts from the store and the broker
     */
    private ControllerResponse handleStats() throws JsonProcessingException {
        TaskStatsResponse response = new TaskStatsResponse(
                monitoringService.getTaskStats(),
                monitoringService.getQueueStats());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }
}
