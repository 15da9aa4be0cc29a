package taskforge.coordinator.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import taskforge.coordinator.api.Controller;
import taskforge.coordinator.api.internal.v1.dto.OperationResponse;
import taskforge.coordinator.reconcile.ReconcileOutcome;
import taskforge.coordinator.reconcile.ResultReconciler;
import taskforge.coordinator.server.RouterHandler;
import taskforge.protocol.ResultMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Controller for worker results (internal API).
 * POST /internal/v1/results - Apply a result message (idempotent)
 */
public class ResultController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(ResultController.class);

    private final ResultReconciler reconciler;

    public ResultController(ResultReconciler reconciler) {
        this.reconciler = reconciler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/internal/v1/results".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        ResultMessage message = RouterHandler.readJson(req, ResultMessage.class);

        ReconcileOutcome outcome = reconciler.apply(message);

        try {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    OperationResponse.success(outcome.name())));
        } catch (JsonProcessingException e) {
            log.error("Result controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
