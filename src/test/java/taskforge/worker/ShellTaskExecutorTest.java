package taskforge.worker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ShellTaskExecutorTest {

    private final ShellTaskExecutor executor = new ShellTaskExecutor();

    @Test
    @DisplayName("prompt runs as a shell command and output is trimmed")
    void testPrompt() throws Exception {
        ExecutionResult result = executor.execute("echo hi", null, 10);

        assertTrue(result.isSuccess());
        assertEquals("hi", result.stdout());
        assertEquals("", result.stderr());
    }

    @Test
    @DisplayName("code takes precedence over the prompt")
    void testCodePrecedence() throws Exception {
        ExecutionResult result = executor.execute("echo prompt", "echo code", 10);
        assertEquals("code", result.stdout());
    }

    @Test
    @DisplayName("non-zero exit keeps stderr")
    void testFailure() throws Exception {
        ExecutionResult result = executor.execute("echo oops >&2; exit 3", null, 10);

        assertFalse(result.isSuccess());
        assertEquals(3, result.exitCode());
        assertEquals("oops", result.errorMessage());
    }

    @Test
    @DisplayName("process past its deadline is killed with exit 124")
    void testTimeout() throws Exception {
        long start = System.nanoTime();
        ExecutionResult result = executor.execute("sleep 5", null, 1);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(result.timedOut());
        assertEquals(ExecutionResult.TIMEOUT_EXIT_CODE, result.exitCode());
        assertEquals("Task timed out after 1 seconds", result.errorMessage());
        assertTrue(elapsedMs < 4000);
    }
}
