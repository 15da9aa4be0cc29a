package taskforge.worker;

/**
 * Outcome of one executor run.
 *
 * @param exitCode process exit code; 0 means success
 * @param stdout   captured standard output, trimmed
 * @param stderr   captured standard error, trimmed
 * @param timedOut the executor killed the run at its deadline
 */
public record ExecutionResult(int exitCode, String stdout, String stderr, boolean timedOut) {

    /** Conventional exit code for a command killed by its deadline */
    public static final int TIMEOUT_EXIT_CODE = 124;

    public ExecutionResult(int exitCode, String stdout, String stderr) {
        this(exitCode, stdout, stderr, false);
    }

    public static ExecutionResult timedOut(String stdout, String error) {
        return new ExecutionResult(TIMEOUT_EXIT_CODE, stdout, error, true);
    }

    public boolean isSuccess() {
        return exitCode == 0 && !timedOut;
    }

    /**
     * Error text for a failed run: stderr when present, otherwise the exit code.
     */
    public String errorMessage() {
        if (stderr != null && !stderr.isBlank()) {
            return stderr;
        }
        return "exit code " + exitCode;
    }
}
