package com.sandboxgate.shared.config;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".sandboxgate", "config.yaml"
    );

    public static SandboxConfig load() {
        return load(DEFAULT_PATH);
    }

    public static SandboxConfig load(Path path) {
        return load(path, System.getenv());
    }

    @SuppressWarnings("unchecked")
    static SandboxConfig load(Path path, Map<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException | YAMLException | ClassCastException e) {
                throw new ConfigurationException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        try {
            var base = raw.containsKey("preset")
                    ? SandboxPresets.get(String.valueOf(raw.get("preset")))
                    : SandboxConfig.defaults();
            var sandbox = (Map<String, Object>) raw.getOrDefault("sandbox", Map.of());
            var e2b = (Map<String, Object>) sandbox.getOrDefault("e2b", Map.of());
            var daytona = (Map<String, Object>) sandbox.getOrDefault("daytona", Map.of());
            var pool = (Map<String, Object>) sandbox.getOrDefault("pool", Map.of());

            return base.toBuilder()
                .sandboxType(sandbox.containsKey("type")
                    ? SandboxType.parse(String.valueOf(sandbox.get("type")))
                    : base.sandboxType())
                .e2b(
                    envOrDefault(env, "E2B_API_KEY", str(e2b, "api-key", base.e2bApiKey())),
                    str(e2b, "template", base.e2bTemplate()))
                .daytona(
                    envOrDefault(env, "DAYTONA_API_KEY", str(daytona, "api-key", base.daytonaApiKey())),
                    envOrDefault(env, "DAYTONA_API_URL", str(daytona, "base-url", base.daytonaBaseUrl())))
                .dockerImage(str(sandbox, "docker-image", base.dockerImage()))
                .workingDirectory(envOrDefault(env, "SANDBOXGATE_WORK_DIR",
                    str(sandbox, "working-directory", base.workingDirectory())))
                .sessionTimeoutMinutes(integer(sandbox, "session-timeout-minutes", base.sessionTimeoutMinutes()))
                .autoCleanup(bool(sandbox, "auto-cleanup", base.autoCleanup()))
                .persistFiles(bool(sandbox, "persist-files", base.persistFiles()))
                .debug(bool(sandbox, "debug", base.debug()))
                .pool(bool(pool, "enabled", base.usePool()), integer(pool, "size", base.poolSize()))
                .resourceLimits(parseResources(
                    (Map<String, Object>) raw.getOrDefault("resources", Map.of()), base.resourceLimits()))
                .network(parseNetwork(
                    (Map<String, Object>) raw.getOrDefault("network", Map.of()), base.network()))
                .security(parseSecurity(
                    (Map<String, Object>) raw.getOrDefault("security", Map.of()), base.security()))
                .build();
        } catch (ClassCastException | NumberFormatException e) {
            throw new ConfigurationException("Malformed config " + path + ": " + e.getMessage(), e);
        }
    }

    private static ResourceLimits parseResources(Map<String, Object> res, ResourceLimits defaults) {
        return new ResourceLimits(
            integer(res, "cpu-cores", defaults.cpuCores()),
            integer(res, "memory-mb", defaults.memoryMb()),
            integer(res, "disk-mb", defaults.diskMb()),
            integer(res, "timeout", defaults.timeoutSeconds()),
            integer(res, "max-processes", defaults.maxProcesses())
        );
    }

    private static NetworkConfig parseNetwork(Map<String, Object> net, NetworkConfig defaults) {
        return new NetworkConfig(
            bool(net, "enabled", defaults.enabled()),
            list(net, "allowed-domains", defaults.allowedDomains()),
            bool(net, "allow-external-api", defaults.allowExternalApi())
        );
    }

    @SuppressWarnings("unchecked")
    private static SecurityConfig parseSecurity(Map<String, Object> sec, SecurityConfig defaults) {
        var rate = (Map<String, Object>) sec.getOrDefault("rate-limit", Map.of());
        return new SecurityConfig(
            list(sec, "allowed-tools", defaults.allowedTools()),
            list(sec, "blocked-tools", defaults.blockedTools()),
            list(sec, "command-blacklist", defaults.commandBlacklist()),
            list(sec, "command-whitelist", defaults.commandWhitelist()),
            bool(sec, "audit-log", defaults.auditEnabled()),
            bool(sec, "allow-root", defaults.allowRoot()),
            integer(rate, "requests", defaults.rateLimitRequests()),
            integer(rate, "window-seconds", defaults.rateLimitWindowSeconds())
        );
    }

    private static String str(Map<String, Object> map, String key, String fallback) {
        var val = map.get(key);
        return val != null ? String.valueOf(val) : fallback;
    }

    private static int integer(Map<String, Object> map, String key, int fallback) {
        return Integer.parseInt(String.valueOf(map.getOrDefault(key, fallback)));
    }

    private static boolean bool(Map<String, Object> map, String key, boolean fallback) {
        return Boolean.parseBoolean(String.valueOf(map.getOrDefault(key, fallback)));
    }

    private static List<String> list(Map<String, Object> map, String key, List<String> fallback) {
        if (!map.containsKey(key)) return fallback;
        var val = map.get(key);
        if (val == null) return List.of();
        return ((List<?>) val).stream().map(String::valueOf).collect(Collectors.toList());
    }

    private static String envOrDefault(Map<String, String> env, String name, String fallback) {
        var val = env.get(name);
        return val != null && !val.isBlank() ? val : fallback;
    }
}
