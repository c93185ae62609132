package com.sandboxgate.sandbox;

import com.sandboxgate.shared.model.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external process with a timeout, capturing stdout and stderr separately.
 */
final class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);
    private static final long DRAIN_JOIN_MS = 5000;

    private ProcessRunner() {}

    static ExecutionResult run(List<String> argv, File workDir, String stdin, long timeoutSeconds) {
        var started = System.nanoTime();
        try {
            var pb = new ProcessBuilder(argv);
            if (workDir != null) pb.directory(workDir);
            var proc = pb.start();
            var stdout = new ByteArrayOutputStream();
            var stderr = new ByteArrayOutputStream();
            var outReader = drain(proc.getInputStream(), stdout);
            var errReader = drain(proc.getErrorStream(), stderr);

            try (var in = proc.getOutputStream()) {
                if (stdin != null) in.write(stdin.getBytes(StandardCharsets.UTF_8));
            }

            if (!proc.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                proc.destroyForcibly();
                outReader.join(DRAIN_JOIN_MS);
                errReader.join(DRAIN_JOIN_MS);
                return ExecutionResult.failure("Command timed out after " + timeoutSeconds + "s", -1)
                        .withExecution(elapsedMs(started), null);
            }
            outReader.join(DRAIN_JOIN_MS);
            errReader.join(DRAIN_JOIN_MS);

            int exit = proc.exitValue();
            var err = stderr.toString(StandardCharsets.UTF_8);
            if (exit != 0 && err.isBlank()) err = "Command exited with code " + exit;
            return ExecutionResult.fromExit(exit, stdout.toString(StandardCharsets.UTF_8), err)
                    .withExecution(elapsedMs(started), null);
        } catch (IOException e) {
            throw new SandboxException("Failed to run " + argv.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException("Interrupted while waiting for " + argv.get(0), e, false);
        }
    }

    private static Thread drain(InputStream in, OutputStream out) {
        var t = new Thread(() -> {
            try {
                in.transferTo(out);
            } catch (IOException e) {
                log.debug("Process stream closed early: {}", e.getMessage());
            }
        }, "sandbox-process-drain");
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
