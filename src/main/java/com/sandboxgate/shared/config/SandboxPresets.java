package com.sandboxgate.shared.config;

import java.util.List;
import java.util.Map;
import java.util.Set;

public final class SandboxPresets {

    private static final Map<String, SandboxConfig> PRESETS = Map.of(
            "minimal", SandboxConfig.builder()
                    .resourceLimits(new ResourceLimits(1, 256, 1024, 30, 50))
                    .network(NetworkConfig.defaults())
                    .build(),
            "standard", SandboxConfig.builder()
                    .resourceLimits(new ResourceLimits(2, 512, 1024, 60, 50))
                    .network(NetworkConfig.defaults())
                    .build(),
            "development", SandboxConfig.builder()
                    .resourceLimits(new ResourceLimits(4, 2048, 1024, 300, 50))
                    .network(NetworkConfig.allowing(List.of("pypi.org", "npmjs.com", "github.com")))
                    .debug(true)
                    .build()
    );

    private SandboxPresets() {}

    public static SandboxConfig get(String name) {
        var preset = PRESETS.get(name);
        if (preset == null) {
            throw new ConfigurationException("Unknown sandbox preset: " + name + " (known: " + names() + ")");
        }
        return preset;
    }

    public static Set<String> names() {
        return PRESETS.keySet();
    }
}
