package taskforge.coordinator.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import taskforge.coordinator.api.Controller;
import taskforge.coordinator.api.internal.v1.dto.HeartbeatRequest;
import taskforge.coordinator.api.internal.v1.dto.OperationResponse;
import taskforge.coordinator.liveness.LivenessRegistry;
import taskforge.coordinator.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Controller for worker heartbeats (internal API).
 * POST /internal/v1/heartbeat - Worker heartbeat
 */
public class HeartbeatController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatController.class);

    private final LivenessRegistry registry;

    public HeartbeatController(LivenessRegistry registry) {
        this.registry = registry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/internal/v1/heartbeat".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        HeartbeatRequest request = RouterHandler.readJson(req, HeartbeatRequest.class);
        request.validate();

        registry.heartbeat(request.workerId(), request.type());
        log.trace("Heartbeat from {}", request.workerId());

        try {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success()));
        } catch (JsonProcessingException e) {
            log.error("Heartbeat controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
