package com.sandboxgate.security;

import java.util.ArrayDeque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read/write checks for sandbox paths. Paths are POSIX paths inside the sandbox, so they
 * are normalized as strings rather than through the host {@link java.nio.file.Path}.
 */
public class PathValidator {

    static final List<String> SENSITIVE_PATHS = List.of(
            "/etc/passwd",
            "/etc/shadow",
            "/etc/sudoers",
            "/root",
            "~/.ssh",
            "~/.gnupg",
            "~/.aws",
            "~/.config");

    static final List<String> READONLY_PATHS = List.of(
            "/etc",
            "/usr",
            "/bin",
            "/sbin",
            "/lib",
            "/lib64",
            "/boot",
            "/sys",
            "/proc",
            "/dev");

    private final String workingDirectory;
    private final String homeDirectory;
    private final List<String> sensitive;
    private final List<String> readonly;

    public PathValidator(String workingDirectory) {
        this(workingDirectory, System.getProperty("user.home", "/root"));
    }

    public PathValidator(String workingDirectory, String homeDirectory) {
        this.workingDirectory = workingDirectory;
        this.homeDirectory = homeDirectory;
        this.sensitive = SENSITIVE_PATHS.stream().map(this::normalize).distinct().collect(Collectors.toList());
        this.readonly = READONLY_PATHS.stream().map(this::normalize).distinct().collect(Collectors.toList());
    }

    public Verdict validateRead(String path) {
        if (hasNullByte(path)) return Verdict.deny("Invalid path: null bytes");
        var normalized = normalize(path);
        for (var s : sensitive) {
            if (normalized.startsWith(s) || normalized.contains(s)) {
                return Verdict.deny("Reading sensitive path is forbidden: " + s);
            }
        }
        return Verdict.allow();
    }

    public Verdict validateWrite(String path) {
        if (hasNullByte(path)) return Verdict.deny("Invalid path: null bytes");
        var normalized = normalize(path);
        for (var s : sensitive) {
            if (normalized.startsWith(s) || normalized.contains(s)) {
                return Verdict.deny("Writing to sensitive path is forbidden: " + s);
            }
        }
        for (var r : readonly) {
            if (normalized.startsWith(r)) {
                return Verdict.deny("Writing to system path is forbidden: " + r);
            }
        }
        return Verdict.allow();
    }

    /**
     * Expands a leading {@code ~}, anchors relative paths at the working directory and
     * collapses {@code .}, {@code ..} and repeated separators. Never climbs above {@code /}.
     */
    public String normalize(String path) {
        var p = path == null ? "" : path;
        if (p.equals("~") || p.startsWith("~/")) {
            p = homeDirectory + p.substring(1);
        }
        if (!p.startsWith("/")) {
            p = workingDirectory + "/" + p;
        }
        var parts = new ArrayDeque<String>();
        for (var segment : p.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) continue;
            if (segment.equals("..")) {
                parts.pollLast();
            } else {
                parts.addLast(segment);
            }
        }
        return "/" + String.join("/", parts);
    }

    private static boolean hasNullByte(String path) {
        return path != null && path.indexOf('\0') >= 0;
    }
}
