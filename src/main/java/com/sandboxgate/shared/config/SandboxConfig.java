package com.sandboxgate.shared.config;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable configuration snapshot, validated once before an executor starts.
 */
public record SandboxConfig(
    SandboxType sandboxType,
    String e2bApiKey,
    String e2bTemplate,
    String daytonaApiKey,
    String daytonaBaseUrl,
    String dockerImage,
    ResourceLimits resourceLimits,
    NetworkConfig network,
    SecurityConfig security,
    boolean usePool,
    int poolSize,
    int sessionTimeoutMinutes,
    boolean autoCleanup,
    boolean persistFiles,
    String workingDirectory,
    boolean debug
) {

    public SandboxConfig {
        if (sandboxType == null) sandboxType = SandboxType.DOCKER;
        if (resourceLimits == null) resourceLimits = ResourceLimits.defaults();
        if (network == null) network = NetworkConfig.defaults();
        if (security == null) security = SecurityConfig.defaults();
        if (workingDirectory == null || workingDirectory.isBlank()) workingDirectory = "/workspace";
    }

    public static SandboxConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .sandboxType(sandboxType)
                .e2b(e2bApiKey, e2bTemplate)
                .daytona(daytonaApiKey, daytonaBaseUrl)
                .dockerImage(dockerImage)
                .resourceLimits(resourceLimits)
                .network(network)
                .security(security)
                .pool(usePool, poolSize)
                .sessionTimeoutMinutes(sessionTimeoutMinutes)
                .autoCleanup(autoCleanup)
                .persistFiles(persistFiles)
                .workingDirectory(workingDirectory)
                .debug(debug);
    }

    /** Returns every configuration problem found; empty when the configuration is usable. */
    public List<String> validate() {
        var errors = new ArrayList<String>();

        if (sandboxType == SandboxType.E2B && isBlank(e2bApiKey)) {
            errors.add("E2B sandbox requires e2b-api-key");
        }
        if (sandboxType == SandboxType.DAYTONA) {
            if (isBlank(daytonaApiKey)) errors.add("Daytona sandbox requires daytona-api-key");
            if (isBlank(daytonaBaseUrl)) errors.add("Daytona sandbox requires daytona-base-url");
        }
        if (sandboxType == SandboxType.DOCKER && isBlank(dockerImage)) {
            errors.add("Docker sandbox requires docker-image");
        }

        if (resourceLimits.timeoutSeconds() < 1) errors.add("Timeout must be at least 1 second");
        if (resourceLimits.memoryMb() < 128) errors.add("Memory limit must be at least 128MB");
        if (resourceLimits.cpuCores() < 1) errors.add("CPU cores must be at least 1");
        if (resourceLimits.maxProcesses() < 1) errors.add("Max processes must be at least 1");

        if (usePool && poolSize < 1) errors.add("Pool size must be at least 1");
        if (sessionTimeoutMinutes < 1) errors.add("Session timeout must be at least 1 minute");

        if (security.rateLimitRequests() < 1) errors.add("Rate limit must allow at least 1 request");
        if (security.rateLimitWindowSeconds() < 1) errors.add("Rate limit window must be at least 1 second");
        for (var pattern : security.commandBlacklist()) {
            try {
                Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                errors.add("Invalid command blacklist pattern '" + pattern + "': " + e.getDescription());
            }
        }
        return errors;
    }

    public void validateOrThrow() {
        var errors = validate();
        if (!errors.isEmpty()) {
            throw new ConfigurationException("Configuration errors: " + String.join(", ", errors));
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public static final class Builder {
        private SandboxType sandboxType = SandboxType.DOCKER;
        private String e2bApiKey;
        private String e2bTemplate = "base";
        private String daytonaApiKey;
        private String daytonaBaseUrl;
        private String dockerImage = "ubuntu:22.04";
        private ResourceLimits resourceLimits = ResourceLimits.defaults();
        private NetworkConfig network = NetworkConfig.defaults();
        private SecurityConfig security = SecurityConfig.defaults();
        private boolean usePool;
        private int poolSize = 5;
        private int sessionTimeoutMinutes = 60;
        private boolean autoCleanup = true;
        private boolean persistFiles;
        private String workingDirectory = "/workspace";
        private boolean debug;

        private Builder() {}

        public Builder sandboxType(SandboxType sandboxType) { this.sandboxType = sandboxType; return this; }

        public Builder e2b(String apiKey, String template) {
            this.e2bApiKey = apiKey;
            this.e2bTemplate = template;
            return this;
        }

        public Builder daytona(String apiKey, String baseUrl) {
            this.daytonaApiKey = apiKey;
            this.daytonaBaseUrl = baseUrl;
            return this;
        }

        public Builder dockerImage(String dockerImage) { this.dockerImage = dockerImage; return this; }
        public Builder resourceLimits(ResourceLimits limits) { this.resourceLimits = limits; return this; }
        public Builder network(NetworkConfig network) { this.network = network; return this; }
        public Builder security(SecurityConfig security) { this.security = security; return this; }

        public Builder pool(boolean usePool, int poolSize) {
            this.usePool = usePool;
            this.poolSize = poolSize;
            return this;
        }

        public Builder sessionTimeoutMinutes(int minutes) { this.sessionTimeoutMinutes = minutes; return this; }
        public Builder autoCleanup(boolean autoCleanup) { this.autoCleanup = autoCleanup; return this; }
        public Builder persistFiles(boolean persistFiles) { this.persistFiles = persistFiles; return this; }
        public Builder workingDirectory(String dir) { this.workingDirectory = dir; return this; }
        public Builder debug(boolean debug) { this.debug = debug; return this; }

        public SandboxConfig build() {
            return new SandboxConfig(sandboxType, e2bApiKey, e2bTemplate, daytonaApiKey, daytonaBaseUrl,
                    dockerImage, resourceLimits, network, security, usePool, poolSize,
                    sessionTimeoutMinutes, autoCleanup, persistFiles, workingDirectory, debug);
        }
    }
}
