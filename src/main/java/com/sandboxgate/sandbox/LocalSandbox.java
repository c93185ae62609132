package com.sandboxgate.sandbox;

import com.sandboxgate.shared.config.SandboxConfig;
import com.sandboxgate.shared.model.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Host-directory backend for development and tests. Sandbox paths are mapped under
 * {@code root} (so {@code /workspace/a.txt} lives at {@code root/workspace/a.txt}); shell
 * commands run with {@code bash -c} in the mapped working directory. Not an isolation
 * boundary: commands can still reach the rest of the host.
 */
public class LocalSandbox extends AbstractSandbox {

    private static final Logger log = LoggerFactory.getLogger(LocalSandbox.class);
    private static final int MAX_SEARCH_MATCHES = 500;

    private final Path root;

    public LocalSandbox(SandboxConfig config, Path root) {
        super(config);
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    protected String doConnect() {
        try {
            Files.createDirectories(hostPath(config.workingDirectory()));
        } catch (IOException e) {
            throw new SandboxException("Cannot prepare local sandbox at " + root, e);
        }
        return "local-" + UUID.randomUUID().toString().substring(0, 8);
    }

    @Override
    protected void doDisconnect() {
        log.debug("[Sandbox] Local files remain under {}", root);
    }

    @Override
    public ExecutionResult executeBash(String command, Integer timeoutSeconds) {
        var notConnected = notConnected();
        if (notConnected != null) return notConnected;
        var shell = System.getProperty("os.name").toLowerCase().contains("win")
                ? List.of("cmd", "/c", command)
                : List.of("bash", "-c", command);
        var result = ProcessRunner.run(shell, hostPath(config.workingDirectory()).toFile(), null,
                timeoutSeconds(timeoutSeconds));
        return result.withExecution(result.elapsedMs(), sandboxId());
    }

    @Override
    public ExecutionResult readFile(String path) {
        var notConnected = notConnected();
        if (notConnected != null) return notConnected;
        var file = hostPath(path);
        try {
            return ExecutionResult.ok(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return ExecutionResult.failure("File not found: " + resolvePath(path));
        } catch (MalformedInputException e) {
            return ExecutionResult.failure("File is not valid UTF-8 text: " + resolvePath(path));
        } catch (IOException e) {
            return ExecutionResult.failure("Cannot read " + resolvePath(path) + ": " + e.getMessage());
        }
    }

    @Override
    public ExecutionResult writeFile(String path, String content) {
        var notConnected = notConnected();
        if (notConnected != null) return notConnected;
        var file = hostPath(path);
        var sandboxPath = resolvePath(path);
        try {
            var existed = Files.exists(file);
            if (file.getParent() != null) Files.createDirectories(file.getParent());
            var bytes = (content == null ? "" : content).getBytes(StandardCharsets.UTF_8);
            Files.write(file, bytes);
            return ExecutionResult.ok("Wrote " + bytes.length + " bytes to " + sandboxPath)
                    .withFileChanges(existed ? List.of() : List.of(sandboxPath),
                            existed ? List.of(sandboxPath) : List.of());
        } catch (IOException e) {
            return ExecutionResult.failure("Cannot write " + sandboxPath + ": " + e.getMessage());
        }
    }

    @Override
    public ExecutionResult listFiles(String path, String pattern) {
        var notConnected = notConnected();
        if (notConnected != null) return notConnected;
        var dir = hostPath(path);
        if (!Files.isDirectory(dir)) {
            return ExecutionResult.failure("Not a directory: " + resolvePath(path));
        }
        var matcher = pattern == null || pattern.isBlank()
                ? null
                : FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        try (Stream<Path> entries = matcher == null ? Files.list(dir) : Files.walk(dir)) {
            var listed = entries
                    .filter(p -> !p.equals(dir))
                    .map(dir::relativize)
                    .filter(rel -> matcher == null || matcher.matches(rel) || matcher.matches(rel.getFileName()))
                    .map(rel -> rel.toString().replace('\\', '/'))
                    .sorted()
                    .collect(Collectors.joining("\n"));
            return ExecutionResult.ok(listed);
        } catch (IOException | UncheckedIOException e) {
            return ExecutionResult.failure("Cannot list " + resolvePath(path) + ": " + e.getMessage());
        }
    }

    @Override
    public ExecutionResult searchFiles(String pattern, String path, String filePattern) {
        var notConnected = notConnected();
        if (notConnected != null) return notConnected;
        Pattern regex;
        try {
            regex = Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            return ExecutionResult.failure("Invalid search pattern: " + e.getDescription());
        }
        var start = hostPath(path);
        var include = filePattern == null || filePattern.isBlank()
                ? null
                : FileSystems.getDefault().getPathMatcher("glob:" + filePattern);

        var matches = new ArrayList<String>();
        try (Stream<Path> files = Files.walk(start)) {
            var candidates = files.filter(Files::isRegularFile)
                    .filter(f -> include == null || include.matches(f.getFileName()))
                    .sorted()
                    .collect(Collectors.toList());
            for (var file : candidates) {
                if (matches.size() >= MAX_SEARCH_MATCHES) break;
                searchFile(file, regex, matches);
            }
        } catch (NoSuchFileException e) {
            return ExecutionResult.failure("Path not found: " + resolvePath(path));
        } catch (IOException | UncheckedIOException e) {
            return ExecutionResult.failure("Cannot search " + resolvePath(path) + ": " + e.getMessage());
        }
        return ExecutionResult.ok(String.join("\n", matches));
    }

    public Path root() {
        return root;
    }

    private void searchFile(Path file, Pattern regex, List<String> matches) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Skipping unreadable file {}: {}", file, e.getMessage());
            return;
        }
        var display = "/" + root.relativize(file).toString().replace('\\', '/');
        for (int i = 0; i < lines.size() && matches.size() < MAX_SEARCH_MATCHES; i++) {
            if (regex.matcher(lines.get(i)).find()) {
                matches.add(display + ":" + (i + 1) + ":" + lines.get(i));
            }
        }
    }

    /** Host location of a sandbox path. Normalization keeps every result under {@code root}. */
    Path hostPath(String path) {
        var sandboxPath = resolvePath(path);
        var relative = sandboxPath.startsWith("/") ? sandboxPath.substring(1) : sandboxPath;
        return relative.isEmpty() ? root : root.resolve(relative).normalize();
    }
}
