package taskforge.worker;

import taskforge.exception.ExecutionTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Executes a task as a shell command: {@code code} when present, otherwise {@code prompt}.
 * <p>
 * Output is redirected to temporary files so a chatty process never blocks on a full pipe.
 * The process is killed when its deadline passes (exit code 124) or when the calling
 * thread is interrupted.
 */
public class ShellTaskExecutor implements TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(ShellTaskExecutor.class);

    private final List<String> shell;

    public ShellTaskExecutor() {
        this(List.of("sh", "-c"));
    }

    /**
     * @param shell command prefix the script is appended to, e.g. {@code ["bash", "-lc"]}
     */
    public ShellTaskExecutor(List<String> shell) {
        this.shell = List.copyOf(shell);
    }

    @Override
    public ExecutionResult execute(String prompt, String code, int timeoutSeconds)
            throws IOException, InterruptedException {
        String script = code != null && !code.isBlank() ? code : prompt;

        File stdoutFile = File.createTempFile("taskforge-", ".out");
        File stderrFile = File.createTempFile("taskforge-", ".err");
        try {
            ProcessBuilder pb = new ProcessBuilder(command(script));
            pb.redirectOutput(ProcessBuilder.Redirect.to(stdoutFile));
            pb.redirectError(ProcessBuilder.Redirect.to(stderrFile));

            Process process = pb.start();
            int exitCode;
            String timeoutError = null;
            try {
                boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
                if (finished) {
                    exitCode = process.exitValue();
                } else {
                    process.destroyForcibly();
                    process.waitFor(5, TimeUnit.SECONDS);
                    exitCode = ExecutionResult.TIMEOUT_EXIT_CODE;
                    timeoutError = ExecutionTimeoutException.message(timeoutSeconds);
                }
            } catch (InterruptedException e) {
                process.destroyForcibly();
                log.debug("Execution interrupted, process {} killed", process.pid());
                throw e;
            }

            String stdout = read(stdoutFile);
            if (timeoutError != null) {
                return ExecutionResult.timedOut(stdout, timeoutError);
            }
            return new ExecutionResult(exitCode, stdout, read(stderrFile));
        } finally {
            Files.deleteIfExists(stdoutFile.toPath());
            Files.deleteIfExists(stderrFile.toPath());
        }
    }

    private List<String> command(String script) {
        List<String> command = new ArrayList<>(shell);
        command.add(script);
        return command;
    }

    private static String read(File file) throws IOException {
        return Files.readString(file.toPath(), StandardCharsets.UTF_8).trim();
    }
}
