package taskforge.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import taskforge.coordinator.broker.RetryDecision;
import taskforge.protocol.ClaimedJob;
import taskforge.protocol.DispatchMessage;
import taskforge.protocol.ResultMessage;
import taskforge.protocol.ResultStatus;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wire format of the worker-facing messages.
 */
class InternalDtoTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final ClaimedJob JOB = ClaimedJob.of(new DispatchMessage("t1", "echo hi", null, 60), 2, 3);

    @Test
    @DisplayName("result status uses lowercase wire names")
    void testResultWireFormat() throws Exception {
        JsonNode json = MAPPER.readTree(MAPPER.writeValueAsString(
                ResultMessage.failed(JOB, "w1", "boom", 42)));

        assertEquals("failed", json.get("status").asText());
        assertEquals("boom", json.get("errorMessage").asText());
        assertFalse(json.has("result"));
        assertEquals(2, json.get("attempt").asInt());
        assertFalse(json.get("finalAttempt").asBoolean());
    }

    @Test
    @DisplayName("result message parses from worker JSON")
    void testResultParse() throws Exception {
        ResultMessage message = MAPPER.readValue("""
                {"taskId":"t1","workerId":"w1","status":"completed","result":"hi",
                 "executionTimeMs":12,"timedOut":false,"attempt":1,"finalAttempt":true}
                """, ResultMessage.class);

        assertEquals(ResultStatus.COMPLETED, message.status());
        assertEquals("hi", message.result());
        assertEquals(12, message.executionTimeMs());
        assertDoesNotThrow(message::validate);
    }

    @Test
    @DisplayName("claimed job hides derived fields")
    void testClaimedJobFormat() throws Exception {
        JsonNode json = MAPPER.readTree(MAPPER.writeValueAsString(new ClaimResponse(JOB)));

        JsonNode job = json.get("job");
        assertEquals("t1", job.get("taskId").asText());
        assertFalse(job.has("code"));
        assertFalse(job.has("finalAttempt"));
        assertFalse(job.has("message"));
        assertEquals(JOB, MAPPER.treeToValue(job, ClaimedJob.class));

        assertTrue(MAPPER.readTree(MAPPER.writeValueAsString(ClaimResponse.empty())).get("job").isNull());
        assertFalse(ClaimResponse.empty().hasJob());
    }

    @Test
    @DisplayName("heartbeat accepts local, cloud or no type")
    void testHeartbeatValidation() {
        assertDoesNotThrow(() -> new HeartbeatRequest("w1", "local").validate());
        assertDoesNotThrow(() -> new HeartbeatRequest("w1", "cloud").validate());
        assertDoesNotThrow(() -> new HeartbeatRequest("w1", null).validate());
        assertThrows(IllegalArgumentException.class, () -> new HeartbeatRequest("w1", "gpu").validate());
        assertThrows(IllegalArgumentException.class, () -> new HeartbeatRequest("", "local").validate());
    }

    @Test
    @DisplayName("retry error is truncated and defaulted")
    void testRetryRequest() {
        String longError = "x".repeat(RetryRequest.MAX_ERROR_LENGTH + 50);

        assertEquals(RetryRequest.MAX_ERROR_LENGTH + 3, new RetryRequest("w1", longError).truncatedError().length());
        assertEquals("Unknown error", new RetryRequest("w1", null).truncatedError());
        assertThrows(IllegalArgumentException.class, () -> new RetryRequest(null, "e").validate());
    }

    @Test
    void testRetryResponse() {
        RetryResponse response = RetryResponse.from(RetryDecision.scheduled(Duration.ofSeconds(4), 2));

        assertEquals(RetryDecision.Outcome.RETRY_SCHEDULED, response.decision());
        assertEquals(4000, response.delayMs());
        assertEquals(2, response.attempts());
    }
}
