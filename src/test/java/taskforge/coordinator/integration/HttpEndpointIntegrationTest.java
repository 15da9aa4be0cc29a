package taskforge.coordinator.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import taskforge.coordinator.config.CoordinatorConfig;
import taskforge.coordinator.config.Dependencies;
import taskforge.coordinator.server.CoordinatorNettyServer;
import taskforge.coordinator.server.RouterHandler;
import taskforge.exception.TaskNotFoundException;
import taskforge.exception.TaskNotTerminalException;
import taskforge.exception.ValidationException;
import taskforge.worker.CoordinatorClient;
import taskforge.worker.ExecutionResult;
import taskforge.worker.WorkerConfig;
import taskforge.worker.WorkerRuntime;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HTTP-level tests against a coordinator bound to an ephemeral port.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient http = HttpClient.newHttpClient();

    private Dependencies deps;
    private CoordinatorNettyServer server;
    private String baseUrl;

    private void start(CoordinatorConfig config) {
        deps = Dependencies.create(config.withDatabaseUrl("jdbc:h2:mem:test-http-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE"));
        server = new CoordinatorNettyServer(deps.routerHandler(), "127.0.0.1", 0);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.port();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
        if (deps != null) {
            deps.close();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        return http.send(HttpRequest.newBuilder(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> delete(String path) throws Exception {
        return http.send(HttpRequest.newBuilder(URI.create(baseUrl + path)).DELETE().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String json) throws Exception {
        return post(path, json, null);
    }

    private HttpResponse<String> post(String path, String json, String workerKey) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json));
        if (workerKey != null) {
            request.header(RouterHandler.WORKER_KEY_HEADER, workerKey);
        }
        return http.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return MAPPER.readTree(response.body());
    }

    @Test
    @DisplayName("health reports database and queue status")
    void testHealth() throws Exception {
        start(CoordinatorConfig.defaults());

        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertEquals("healthy", body.get("status").asText());
        assertEquals("ok", body.get("database").asText());
        assertEquals("ok", body.get("queue").asText());
        assertEquals(0, body.get("activeWorkers").asInt());
    }

    @Test
    @DisplayName("task endpoints: submit, get, validation, not found, delete conflict")
    void testTaskEndpoints() throws Exception {
        start(CoordinatorConfig.defaults());

        HttpResponse<String> submitted = post("/api/v1/tasks", "{\"prompt\":\"echo hi\",\"timeout\":30}");
        assertEquals(202, submitted.statusCode());
        JsonNode receipt = json(submitted);
        String taskId = receipt.get("id").asText();
        assertEquals("QUEUED", receipt.get("status").asText());
        assertTrue(receipt.hasNonNull("createdAt"));

        HttpResponse<String> fetched = get("/api/v1/tasks/" + taskId);
        assertEquals(200, fetched.statusCode());
        JsonNode task = json(fetched);
        assertEquals("echo hi", task.get("prompt").asText());
        assertEquals(30, task.get("timeout").asInt());
        assertFalse(task.has("result"));

        HttpResponse<String> invalid = post("/api/v1/tasks", "{\"prompt\":\"\"}");
        assertEquals(400, invalid.statusCode());
        assertEquals(ValidationException.ERROR_CODE, json(invalid).get("code").asText());

        assertEquals(400, post("/api/v1/tasks", "{\"prompt\":\"x\",\"timeout\":5000}").statusCode());
        HttpResponse<String> fractional = post("/api/v1/tasks", "{\"prompt\":\"x\",\"timeout\":1.5}");
        assertEquals(400, fractional.statusCode(), "fractional timeout is rejected, not truncated");
        assertEquals(ValidationException.ERROR_CODE, json(fractional).get("code").asText());
        assertEquals(400, post("/api/v1/tasks", "not json").statusCode());

        HttpResponse<String> missing = get("/api/v1/tasks/does-not-exist");
        assertEquals(404, missing.statusCode());
        assertEquals(TaskNotFoundException.ERROR_CODE, json(missing).get("code").asText());

        HttpResponse<String> conflict = delete("/api/v1/tasks/" + taskId);
        assertEquals(409, conflict.statusCode());
        assertEquals(TaskNotTerminalException.ERROR_CODE, json(conflict).get("code").asText());

        assertEquals(404, get("/api/v1/nothing-here").statusCode());
    }

    @Test
    @DisplayName("remote worker runs a task over the internal API")
    void testRemoteWorker() throws Exception {
        start(CoordinatorConfig.defaults());

        WorkerConfig workerConfig = WorkerConfig.defaults()
                .withWorkerId("remote-1")
                .withCoordinatorUrl(baseUrl)
                .withIdleSleep(Duration.ofMillis(20))
                .withHeartbeatInterval(Duration.ofMillis(200))
                .withShutdownTimeout(Duration.ofSeconds(10));
        CoordinatorClient client = new CoordinatorClient(workerConfig);
        WorkerRuntime runtime = new WorkerRuntime(workerConfig, client, client, client,
                (prompt, code, timeout) -> new ExecutionResult(0, "ran: " + prompt, ""), client);

        try {
            runtime.start();
            String taskId = json(post("/api/v1/tasks", "{\"prompt\":\"hello\"}")).get("id").asText();

            JsonNode task = null;
            long deadline = System.nanoTime() + Duration.ofSeconds(15).toNanos();
            while (System.nanoTime() < deadline) {
                task = json(get("/api/v1/tasks/" + taskId));
                if ("COMPLETED".equals(task.get("status").asText())) {
                    break;
                }
                Thread.sleep(25);
            }

            assertNotNull(task);
            assertEquals("COMPLETED", task.get("status").asText());
            assertEquals("ran: hello", task.get("result").asText());
            assertEquals("remote-1", task.get("workerId").asText());
            assertTrue(task.hasNonNull("completedAt"));

            JsonNode workers = json(get("/api/v1/workers"));
            assertTrue(workers.isArray());
            assertEquals("remote-1", workers.get(0).get("id").asText());
            assertEquals("local", workers.get(0).get("type").asText());
            assertEquals("active", workers.get(0).get("status").asText());

            JsonNode stats = json(get("/api/v1/tasks/stats"));
            assertEquals(1, stats.get("database").get("completed").asInt());
            assertEquals(1, stats.get("queue").get("completed").asInt());

            assertEquals(0, json(get("/api/v1/queue/stats")).get("waiting").asInt());

            HttpResponse<String> deleted = delete("/api/v1/tasks/" + taskId);
            assertEquals(200, deleted.statusCode());
            assertTrue(json(deleted).get("deleted").asBoolean());
        } finally {
            runtime.stop();
        }
    }

    @Test
    @DisplayName("internal API requires the worker key when one is configured")
    void testWorkerKey() throws Exception {
        start(CoordinatorConfig.defaults().withWorkerKey("s3cret"));

        String heartbeat = "{\"workerId\":\"w1\",\"type\":\"local\"}";
        assertEquals(403, post("/internal/v1/heartbeat", heartbeat).statusCode());
        assertEquals(403, post("/internal/v1/heartbeat", heartbeat, "wrong").statusCode());
        assertEquals(200, post("/internal/v1/heartbeat", heartbeat, "s3cret").statusCode());

        assertEquals(200, get("/api/v1/health").statusCode(), "public API needs no key");
        assertEquals(1, deps.livenessRegistry().size());
    }

    @Test
    @DisplayName("internal claim returns null job when the queue is empty")
    void testEmptyClaim() throws Exception {
        start(CoordinatorConfig.defaults());

        HttpResponse<String> response = post("/internal/v1/jobs/claim", "{\"workerId\":\"w1\"}");

        assertEquals(200, response.statusCode());
        assertTrue(json(response).get("job").isNull());
        assertEquals(400, post("/internal/v1/heartbeat", "{\"workerId\":\"w1\",\"type\":\"gpu\"}").statusCode());
    }

    @Test
    @DisplayName("task list is newest first, filtered by status and paged")
    void testTaskList() throws Exception {
        start(CoordinatorConfig.defaults());
        for (int i = 0; i < 3; i++) {
            assertEquals(202, post("/api/v1/tasks", "{\"prompt\":\"echo " + i + "\"}").statusCode());
        }

        HttpResponse<String> all = get("/api/v1/tasks");
        assertEquals(200, all.statusCode());
        JsonNode page = json(all);
        assertEquals(3, page.get("tasks").size());
        assertEquals(3, page.get("total").asInt());
        assertEquals(1, page.get("page").asInt());
        assertEquals(10, page.get("limit").asInt());
        assertEquals(1, page.get("totalPages").asInt());

        JsonNode second = json(get("/api/v1/tasks?page=2&limit=2"));
        assertEquals(1, second.get("tasks").size());
        assertEquals(2, second.get("totalPages").asInt());

        JsonNode queued = json(get("/api/v1/tasks?status=queued"));
        assertEquals(3, queued.get("total").asInt());
        JsonNode running = json(get("/api/v1/tasks?status=RUNNING"));
        assertEquals(0, running.get("tasks").size());
        assertEquals(0, running.get("totalPages").asInt());

        assertEquals(400, get("/api/v1/tasks?status=bogus").statusCode());
        assertEquals(400, get("/api/v1/tasks?limit=0").statusCode());
        assertEquals(400, get("/api/v1/tasks?page=abc").statusCode());
    }
}
