package taskforge.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import taskforge.exception.BrokerUnavailableException;
import taskforge.exception.TaskForgeException;
import taskforge.protocol.ClaimedJob;
import taskforge.protocol.ResultMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP transport from a remote worker to the coordinator's internal API.
 * <p>
 * An unreachable coordinator, or one answering 503, surfaces as
 * {@link BrokerUnavailableException}; other non-2xx answers as {@link TaskForgeException}.
 */
public class CoordinatorClient implements JobSource, ResultPublisher, HeartbeatSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorClient.class);

    public static final String WORKER_KEY_HEADER = "X-TaskForge-Key";
    static final String ERROR_CODE = "COORDINATOR_ERROR";

    private final WorkerConfig config;
    private final String baseUrl;
    private final HttpClient http;
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private volatile boolean closed = false;

    public CoordinatorClient(WorkerConfig config) {
        this.config = config;
        this.baseUrl = config.coordinatorUrl().endsWith("/")
                ? config.coordinatorUrl().substring(0, config.coordinatorUrl().length() - 1)
                : config.coordinatorUrl();
        this.http = HttpClient.newBuilder()
                .connectTimeout(config.requestTimeout())
                .build();
    }

    @Override
    public Optional<ClaimedJob> claim(String workerId) {
        JsonNode response = post("/internal/v1/jobs/claim", Map.of("workerId", workerId));
        JsonNode job = response.get("job");
        if (job == null || job.isNull()) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.treeToValue(job, ClaimedJob.class));
        } catch (IOException e) {
            throw new TaskForgeException(ERROR_CODE, "Malformed claim response: " + e.getMessage(), e);
        }
    }

    @Override
    public void ack(String taskId, String workerId) {
        JsonNode response = post("/internal/v1/jobs/" + encode(taskId) + "/ack", Map.of("workerId", workerId));
        if (!response.path("ok").asBoolean(false)) {
            log.warn("Ack of task {} not applied: {}", taskId, response.path("outcome").asText());
        }
    }

    @Override
    public void retry(String taskId, String workerId, String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("workerId", workerId);
        body.put("error", error);
        JsonNode response = post("/internal/v1/jobs/" + encode(taskId) + "/retry", body);
        log.debug("Retry of task {}: {} (delay {}ms)", taskId,
                response.path("decision").asText(), response.path("delayMs").asLong());
    }

    @Override
    public void publish(ResultMessage message) {
        JsonNode response = post("/internal/v1/results", message);
        log.debug("Result for task {} applied: {}", message.taskId(), response.path("outcome").asText());
    }

    @Override
    public void heartbeat(String workerId, String type) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("workerId", workerId);
        body.put("type", type);
        post("/internal/v1/heartbeat", body);
    }

    @Override
    public void close() {
        closed = true;
        log.info("Coordinator client for {} closed", config.workerId());
    }

    private JsonNode post(String path, Object body) {
        if (closed) {
            throw new IllegalStateException("Coordinator client is closed");
        }

        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new TaskForgeException(ERROR_CODE, "Failed to serialize request for " + path, e);
        }

        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(config.requestTimeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
        if (config.hasWorkerKey()) {
            request.header(WORKER_KEY_HEADER, config.workerKey());
        }

        HttpResponse<String> response;
        try {
            response = http.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new BrokerUnavailableException("Coordinator unreachable at " + baseUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerUnavailableException("Interrupted while calling coordinator", e);
        }

        int status = response.statusCode();
        if (status == 503) {
            throw new BrokerUnavailableException("Coordinator reports broker unavailable: " + response.body());
        }
        if (status < 200 || status >= 300) {
            throw new TaskForgeException(ERROR_CODE,
                    String.format("POST %s returned %d: %s", path, status, response.body()));
        }

        try {
            return mapper.readTree(response.body());
        } catch (IOException e) {
            throw new TaskForgeException(ERROR_CODE, "Malformed response from " + path, e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
