package com.sandboxgate.sandbox;

import com.sandboxgate.shared.config.SandboxConfig;
import com.sandboxgate.shared.model.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One long-lived container per sandbox. Operations go through {@code docker exec};
 * the container runs with cpu, memory and pid limits and without a network unless
 * networking is enabled.
 */
public class DockerSandbox extends AbstractSandbox {

    private static final Logger log = LoggerFactory.getLogger(DockerSandbox.class);

    static final String SANDBOX_USER = "1000:1000";
    private static final long CONTROL_TIMEOUT_SECONDS = 60;

    private final String containerName;

    public DockerSandbox(SandboxConfig config) {
        this(config, "sandboxgate-" + UUID.randomUUID().toString().substring(0, 12));
    }

    DockerSandbox(SandboxConfig config, String containerName) {
        super(config);
        this.containerName = containerName;
    }

    @Override
    protected String doConnect() {
        var unenforced = unenforcedDomains();
        if (!unenforced.isEmpty()) {
            log.warn("[Docker] Container {} gets full network access; the domain allow-list {} is not enforced here",
                    containerName, unenforced);
        }
        var started = ProcessRunner.run(runArgs(), null, null, CONTROL_TIMEOUT_SECONDS);
        if (!started.success()) {
            throw new SandboxException("docker run failed: " + started.error().strip());
        }
        if (!config.security().allowRoot()) {
            var prepared = ProcessRunner.run(List.of("docker", "exec", containerName,
                    "chown", SANDBOX_USER, config.workingDirectory()), null, null, CONTROL_TIMEOUT_SECONDS);
            if (!prepared.success()) {
                log.warn("[Docker] Could not hand {} to the sandbox user: {}",
                        config.workingDirectory(), prepared.error());
            }
        }
        return containerName;
    }

    @Override
    protected void doDisconnect() {
        var removed = ProcessRunner.run(List.of("docker", "rm", "-f", containerName), null, null, CONTROL_TIMEOUT_SECONDS);
        if (!removed.success()) {
            throw new SandboxException("docker rm failed for " + containerName + ": " + removed.error().strip());
        }
    }

    @Override
    public ExecutionResult executeBash(String command, Integer timeoutSeconds) {
        var notConnected = notConnected();
        if (notConnected != null) return notConnected;
        return exec(List.of("bash", "-c", command), null, timeoutSeconds(timeoutSeconds));
    }

    @Override
    public ExecutionResult readFile(String path) {
        var notConnected = notConnected();
        if (notConnected != null) return notConnected;
        return exec(List.of("cat", "--", resolvePath(path)), null, timeoutSeconds(null));
    }

    @Override
    public ExecutionResult writeFile(String path, String content) {
        var notConnected = notConnected();
        if (notConnected != null) return notConnected;
        var target = resolvePath(path);
        var result = exec(List.of("sh", "-c", "mkdir -p \"$(dirname \"$1\")\" && cat > \"$1\"", "sh", target),
                content == null ? "" : content, timeoutSeconds(null));
        if (!result.success()) return result;
        return ExecutionResult.ok("Wrote " + target).withExecution(result.elapsedMs(), sandboxId())
                .withFileChanges(List.of(), List.of(target));
    }

    @Override
    public ExecutionResult listFiles(String path, String pattern) {
        var notConnected = notConnected();
        if (notConnected != null) return notConnected;
        var dir = resolvePath(path);
        if (pattern == null || pattern.isBlank()) {
            return exec(List.of("ls", "-la", "--", dir), null, timeoutSeconds(null));
        }
        return exec(List.of("find", dir, "-name", lastSegment(pattern)), null, timeoutSeconds(null));
    }

    @Override
    public ExecutionResult searchFiles(String pattern, String path, String filePattern) {
        var notConnected = notConnected();
        if (notConnected != null) return notConnected;
        var cmd = new ArrayList<>(List.of("grep", "-rnE"));
        if (filePattern != null && !filePattern.isBlank()) cmd.add("--include=" + filePattern);
        cmd.addAll(List.of("-e", pattern, "--", resolvePath(path)));
        var result = exec(cmd, null, timeoutSeconds(null));
        // grep exits 1 when nothing matched
        if (!result.success() && result.exitCode() == 1) {
            return ExecutionResult.ok("").withExecution(result.elapsedMs(), sandboxId());
        }
        return result;
    }

    public String containerName() {
        return containerName;
    }

    List<String> runArgs() {
        var limits = config.resourceLimits();
        var cmd = new ArrayList<String>();
        cmd.add("docker"); cmd.add("run"); cmd.add("-d");
        cmd.add("--name"); cmd.add(containerName);
        cmd.add("--memory=" + limits.memoryMb() + "m");
        cmd.add("--cpus=" + limits.cpuCores());
        cmd.add("--pids-limit=" + limits.maxProcesses());
        if (!config.network().enabled()) {
            cmd.add("--network=none");
        }
        if (config.autoCleanup() && !config.persistFiles()) {
            cmd.add("--rm");
        }
        cmd.add("-w"); cmd.add(config.workingDirectory());
        cmd.add(config.dockerImage());
        cmd.add("sleep"); cmd.add("infinity");
        return cmd;
    }

    /** Domains the configuration allows that this provider cannot restrict traffic to. */
    List<String> unenforcedDomains() {
        return config.network().restrictsDomains() ? config.network().allowedDomains() : List.of();
    }

    List<String> execArgs(List<String> command, boolean interactive) {
        var cmd = new ArrayList<String>();
        cmd.add("docker"); cmd.add("exec");
        if (interactive) cmd.add("-i");
        if (!config.security().allowRoot()) {
            cmd.add("--user"); cmd.add(SANDBOX_USER);
        }
        cmd.add("-w"); cmd.add(config.workingDirectory());
        cmd.add(containerName);
        cmd.addAll(command);
        return cmd;
    }

    private ExecutionResult exec(List<String> command, String stdin, long timeoutSeconds) {
        var result = ProcessRunner.run(execArgs(command, stdin != null), null, stdin, timeoutSeconds);
        return result.withExecution(result.elapsedMs(), sandboxId());
    }

    private static String lastSegment(String pattern) {
        int slash = pattern.lastIndexOf('/');
        return slash >= 0 ? pattern.substring(slash + 1) : pattern;
    }

    /** Whether a Docker daemon answers on this host. */
    public static boolean isAvailable() {
        try {
            return ProcessRunner.run(List.of("docker", "info"), null, null, 5).success();
        } catch (SandboxException e) {
            log.debug("Docker not available: {}", e.getMessage());
            return false;
        }
    }
}
