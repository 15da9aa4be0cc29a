package taskforge.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import taskforge.coordinator.api.Controller;
import taskforge.coordinator.server.RouterHandler;
import taskforge.coordinator.service.MonitoringService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Controller for worker and queue monitoring (public API).
 *
 * GET /api/v1/workers - Workers with a recent heartbeat
 * GET /api/v1/queue/stats - Broker record counts
 */
public class MonitoringController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(MonitoringController.class);

    private static final String WORKERS_PATH = "/api/v1/workers";
    private static final String QUEUE_STATS_PATH = "/api/v1/queue/stats";

    private final MonitoringService monitoringService;

    public MonitoringController(MonitoringService monitoringService) {
        this.monitoringService = monitoringService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && (WORKERS_PATH.equals(path) || QUEUE_STATS_PATH.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Object response = WORKERS_PATH.equals(path)
                    ? monitoringService.getWorkerList()
                    : monitoringService.getQueueStats();
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (JsonProcessingException e) {
            log.error("Monitoring controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
