package taskforge.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import taskforge.coordinator.api.Controller;
import taskforge.coordinator.api.v1.dto.HealthResponse;
import taskforge.coordinator.server.RouterHandler;
import taskforge.coordinator.service.MonitoringService;
import taskforge.coordinator.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final MonitoringService monitoringService;

    public HealthController(Database database, MonitoringService monitoringService) {
        this.database = database;
        this.monitoringService = monitoringService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return unhealthy(HealthResponse.unhealthy("connection failed", "unknown"));
            }

            try {
                monitoringService.getQueueStats();
            } catch (RuntimeException e) {
                log.warn("Queue health check failed: {}", e.getMessage());
                return unhealthy(HealthResponse.unhealthy("ok", "unreachable"));
            }

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(), VERSION, monitoringService.getWorkerList().size());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (JsonProcessingException e) {
            log.error("Health check failed", e);
            return ControllerResponse.error("health check failed");
        }
    }

    private ControllerResponse unhealthy(HealthResponse response) throws JsonProcessingException {
        return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                RouterHandler.mapper().writeValueAsString(response));
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
