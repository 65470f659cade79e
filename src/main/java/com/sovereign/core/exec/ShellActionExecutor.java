package com.sovereign.core.exec;

import com.sovereign.core.context.ExecutionContext;
import com.sovereign.core.logging.SensitiveData;
import com.sovereign.core.scope.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs actions as {@code <shell> -c <command>} through {@link ProcessBuilder}.
 * <p>
 * The working directory is the {@value ExecutionContext#REPO_PATH_KEY} entry of
 * the task context, falling back to the configured working directory. Output is
 * spooled to temporary files so a chatty process never blocks on a full pipe
 * while the timeout is running. Timeout and interruption destroy the process
 * and surface as {@link CancellationSignal}; a non-zero exit surfaces as
 * {@link ActionFailedException}.
 */
public class ShellActionExecutor implements ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(ShellActionExecutor.class);

    private final ExecProperties properties;

    public ShellActionExecutor(ExecProperties properties) {
        this.properties = properties;
    }

    @Override
    public String execute(String command, ExecutionContext context) {
        Path workDir = workingDirectory(context);
        String masked = SensitiveData.mask(command);
        log.info("Running: {} [span: {}, dir: {}]", masked, context.spanId(), workDir);

        Path stdout = null;
        Path stderr = null;
        try {
            stdout = Files.createTempFile("sovereign-out-", ".log");
            stderr = Files.createTempFile("sovereign-err-", ".log");
            Process process;
            try {
                process = new ProcessBuilder(List.of(properties.getShell(), "-c", command))
                        .directory(workDir.toFile())
                        .redirectOutput(stdout.toFile())
                        .redirectError(stderr.toFile())
                        .start();
            } catch (IOException e) {
                throw new ActionFailedException("Could not start '" + masked + "': " + e.getMessage(),
                        ActionFailedException.NOT_STARTED, "", e);
            }
            int exitCode = awaitExit(process, masked);
            String out = Files.readString(stdout, StandardCharsets.UTF_8);
            if (exitCode != 0) {
                String err = SensitiveData.mask(Files.readString(stderr, StandardCharsets.UTF_8).strip());
                log.warn("Command failed (exit {}): {} - {}", exitCode, masked, err);
                throw new ActionFailedException(
                        "Command failed (exit code %d): %s".formatted(exitCode, err.isEmpty() ? masked : err),
                        exitCode, err);
            }
            return out;
        } catch (IOException e) {
            throw new ActionFailedException("I/O error running '" + masked + "': " + e.getMessage(),
                    ActionFailedException.NOT_STARTED, "", e);
        } finally {
            deleteSpoolFile(stdout);
            deleteSpoolFile(stderr);
        }
    }

    private int awaitExit(Process process, String masked) {
        int timeoutSeconds = properties.getTimeoutSeconds();
        try {
            if (timeoutSeconds <= 0) {
                return process.waitFor();
            }
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.warn("Command timed out after {}s: {}", timeoutSeconds, masked);
                throw new CancellationSignal(CancellationSignal.Reason.TIMEOUT,
                        "Command timeout after " + timeoutSeconds + "s - cancelling operation: " + masked);
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CancellationSignal(CancellationSignal.Reason.EXTERNAL,
                    "Interrupted while running: " + masked, e);
        }
    }

    Path workingDirectory(ExecutionContext context) {
        String repoPath = context.metadata().get(ExecutionContext.REPO_PATH_KEY);
        return Path.of(repoPath != null && !repoPath.isBlank() ? repoPath : properties.getWorkingDirectory());
    }

    private static void deleteSpoolFile(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete spool file {}: {}", file, e.getMessage());
        }
    }
}
