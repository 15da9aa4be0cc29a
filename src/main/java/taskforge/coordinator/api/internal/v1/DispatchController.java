package taskforge.coordinator.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import taskforge.coordinator.api.Controller;
import taskforge.coordinator.api.internal.v1.dto.ClaimResponse;
import taskforge.coordinator.api.internal.v1.dto.OperationResponse;
import taskforge.coordinator.api.internal.v1.dto.RetryRequest;
import taskforge.coordinator.api.internal.v1.dto.RetryResponse;
import taskforge.coordinator.api.internal.v1.dto.WorkerRequest;
import taskforge.coordinator.broker.JobBroker;
import taskforge.coordinator.broker.RetryDecision;
import taskforge.coordinator.server.RouterHandler;
import taskforge.coordinator.service.DispatchService;
import taskforge.protocol.ClaimedJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for job delivery to remote workers (internal API).
 * POST /internal/v1/jobs/claim - Claim the next job
 * POST /internal/v1/jobs/{taskId}/ack - Confirm a handled job
 * POST /internal/v1/jobs/{taskId}/retry - Report a failed attempt
 */
public class DispatchController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(DispatchController.class);

    private static final Pattern CLAIM_PATTERN = Pattern.compile("^/internal/v1/jobs/claim$");
    private static final Pattern ACK_PATTERN = Pattern.compile("^/internal/v1/jobs/([^/]+)/ack$");
    private static final Pattern RETRY_PATTERN = Pattern.compile("^/internal/v1/jobs/([^/]+)/retry$");

    private final DispatchService dispatchService;
    private final JobBroker broker;

    public DispatchController(DispatchService dispatchService, JobBroker broker) {
        this.dispatchService = dispatchService;
        this.broker = broker;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return CLAIM_PATTERN.matcher(path).matches()
                || ACK_PATTERN.matcher(path).matches()
                || RETRY_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (CLAIM_PATTERN.matcher(path).matches()) {
                return handleClaim(req);
            }

            Matcher ackMatcher = ACK_PATTERN.matcher(path);
            if (ackMatcher.matches()) {
                return handleAck(req, ackMatcher.group(1));
            }

            Matcher retryMatcher = RETRY_PATTERN.matcher(path);
            if (retryMatcher.matches()) {
                return handleRetry(req, retryMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown job endpoint");

        } catch (JsonProcessingException e) {
            log.error("Dispatch controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /internal/v1/jobs/claim
     */
    private ControllerResponse handleClaim(FullHttpRequest req) throws JsonProcessingException {
        WorkerRequest request = RouterHandler.readJson(req, WorkerRequest.class);
        request.validate();

        Optional<ClaimedJob> job = dispatchService.claim(request.workerId());

        ClaimResponse response = job.map(ClaimResponse::new).orElseGet(ClaimResponse::empty);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * POST /internal/v1/jobs/{taskId}/ack
     */
    private ControllerResponse handleAck(FullHttpRequest req, String taskId) throws JsonProcessingException {
        WorkerRequest request = RouterHandler.readJson(req, WorkerRequest.class);
        request.validate();

        boolean acked = broker.ack(taskId, request.workerId());

        OperationResponse response = acked
                ? OperationResponse.success()
                : OperationResponse.rejected("not_active");
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * POST /internal/v1/jobs/{taskId}/retry
     */
    private ControllerResponse handleRetry(FullHttpRequest req, String taskId) throws JsonProcessingException {
        RetryRequest request = RouterHandler.readJson(req, RetryRequest.class);
        request.validate();

        RetryDecision decision = dispatchService.reportFailure(taskId, request.workerId(), request.truncatedError());

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(RetryResponse.from(decision)));
    }
}
