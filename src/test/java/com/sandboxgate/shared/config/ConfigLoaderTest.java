package com.sandboxgate.shared.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        var cfg = ConfigLoader.load(tempDir.resolve("absent.yaml"), Map.of());
        assertEquals(SandboxConfig.defaults(), cfg);
    }

    @Test
    void emptyFileGivesDefaults() throws IOException {
        assertEquals(SandboxConfig.defaults(), writeAndLoad("", Map.of()));
    }

    @Test
    void parsesFullConfig() throws IOException {
        var yaml = """
            sandbox:
              type: local
              docker-image: python:3.12-slim
              working-directory: /srv/agent
              session-timeout-minutes: 30
              auto-cleanup: false
              pool:
                enabled: true
                size: 3
            resources:
              cpu-cores: 4
              memory-mb: 1024
              timeout: 120
            network:
              enabled: true
              allowed-domains: ["pypi.org"]
            security:
              blocked-tools: [WebFetch]
              command-whitelist: ["ls", "cat"]
              allow-root: true
              audit-log: false
              rate-limit:
                requests: 10
                window-seconds: 30
            """;
        var cfg = writeAndLoad(yaml, Map.of());

        assertEquals(SandboxType.LOCAL, cfg.sandboxType());
        assertEquals("python:3.12-slim", cfg.dockerImage());
        assertEquals("/srv/agent", cfg.workingDirectory());
        assertEquals(30, cfg.sessionTimeoutMinutes());
        assertFalse(cfg.autoCleanup());
        assertTrue(cfg.usePool());
        assertEquals(3, cfg.poolSize());

        assertEquals(4, cfg.resourceLimits().cpuCores());
        assertEquals(1024, cfg.resourceLimits().memoryMb());
        assertEquals(120, cfg.resourceLimits().timeoutSeconds());
        assertEquals(ResourceLimits.defaults().maxProcesses(), cfg.resourceLimits().maxProcesses());

        assertTrue(cfg.network().enabled());
        assertEquals(List.of("pypi.org"), cfg.network().allowedDomains());

        var sec = cfg.security();
        assertEquals(List.of("WebFetch"), sec.blockedTools());
        assertEquals(List.of("ls", "cat"), sec.commandWhitelist());
        assertEquals(SecurityConfig.DEFAULT_COMMAND_BLACKLIST, sec.commandBlacklist());
        assertTrue(sec.allowRoot());
        assertFalse(sec.auditEnabled());
        assertEquals(10, sec.rateLimitRequests());
        assertEquals(30, sec.rateLimitWindowSeconds());
    }

    @Test
    void presetProvidesBaseValues() throws IOException {
        var cfg = writeAndLoad("""
            preset: development
            resources:
              memory-mb: 4096
            """, Map.of());
        assertEquals(4096, cfg.resourceLimits().memoryMb());
        assertEquals(300, cfg.resourceLimits().timeoutSeconds());
        assertTrue(cfg.debug());
    }

    @Test
    void environmentOverridesFile() throws IOException {
        var yaml = """
            sandbox:
              type: e2b
              e2b:
                api-key: from-file
                template: python
            """;
        var cfg = writeAndLoad(yaml, Map.of("E2B_API_KEY", "from-env", "SANDBOXGATE_WORK_DIR", "/data"));
        assertEquals("from-env", cfg.e2bApiKey());
        assertEquals("python", cfg.e2bTemplate());
        assertEquals("/data", cfg.workingDirectory());
        assertTrue(cfg.validate().isEmpty());
    }

    @Test
    void malformedValuesAreConfigurationErrors() throws IOException {
        assertThrows(ConfigurationException.class, () -> writeAndLoad("""
            resources:
              timeout: soon
            """, Map.of()));
        assertThrows(ConfigurationException.class, () -> writeAndLoad("sandbox: [1, 2]", Map.of()));
        assertThrows(ConfigurationException.class, () -> writeAndLoad("sandbox:\n  type: vm", Map.of()));
    }

    private SandboxConfig writeAndLoad(String yaml, Map<String, String> env) throws IOException {
        var file = tempDir.resolve("config.yaml");
        Files.writeString(file, yaml);
        return ConfigLoader.load(file, env);
    }
}
