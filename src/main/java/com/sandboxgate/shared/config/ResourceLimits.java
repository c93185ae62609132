package com.sandboxgate.shared.config;

public record ResourceLimits(
    int cpuCores,
    int memoryMb,
    int diskMb,
    int timeoutSeconds,
    int maxProcesses
) {
    public static ResourceLimits defaults() {
        return new ResourceLimits(2, 512, 1024, 60, 50);
    }
}
