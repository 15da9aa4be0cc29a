package taskforge.worker;

import java.io.IOException;

/**
 * Runs the actual work of a task.
 * Implementations must stop promptly when the calling thread is interrupted.
 */
@FunctionalInterface
public interface TaskExecutor {

    /**
     * Execute a task.
     *
     * @param prompt         task instruction, never blank
     * @param code           optional code to run; may be null
     * @param timeoutSeconds deadline the caller will enforce
     * @return exit code and captured output
     */
    ExecutionResult execute(String prompt, String code, int timeoutSeconds) throws IOException, InterruptedException;
}
