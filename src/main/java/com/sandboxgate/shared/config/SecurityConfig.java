package com.sandboxgate.shared.config;

import java.util.List;

/**
 * Tool and command policy.
 *
 * @param allowedTools           tools permitted to run; empty means every tool not blocked
 * @param blockedTools           tools always refused
 * @param commandBlacklist       case-insensitive regular expressions refused in Bash commands
 * @param commandWhitelist       command prefixes; empty means no whitelist is enforced
 * @param auditEnabled           whether tool calls are recorded in the audit log
 * @param allowRoot              whether privilege-escalation commands may run
 * @param rateLimitRequests      requests allowed per caller inside the window
 * @param rateLimitWindowSeconds sliding window length
 */
public record SecurityConfig(
    List<String> allowedTools,
    List<String> blockedTools,
    List<String> commandBlacklist,
    List<String> commandWhitelist,
    boolean auditEnabled,
    boolean allowRoot,
    int rateLimitRequests,
    int rateLimitWindowSeconds
) {

    public static final List<String> DEFAULT_COMMAND_BLACKLIST = List.of(
            "rm\\s+-rf\\s+/",
            ":\\(\\)\\s*\\{\\s*:\\|:&\\s*\\};:",
            "dd\\s+if=/dev/zero",
            "mkfs\\.",
            "chmod\\s+-R\\s+777\\s+/",
            "curl.*\\|\\s*(ba)?sh",
            "wget.*\\|\\s*(ba)?sh");

    public SecurityConfig {
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
        blockedTools = blockedTools == null ? List.of() : List.copyOf(blockedTools);
        commandBlacklist = commandBlacklist == null ? List.of() : List.copyOf(commandBlacklist);
        commandWhitelist = commandWhitelist == null ? List.of() : List.copyOf(commandWhitelist);
    }

    public static SecurityConfig defaults() {
        return new SecurityConfig(List.of(), List.of(), DEFAULT_COMMAND_BLACKLIST, List.of(),
                true, false, 100, 60);
    }

    public boolean hasWhitelist() {
        return !commandWhitelist.isEmpty();
    }

    public SecurityConfig withRateLimit(int requests, int windowSeconds) {
        return new SecurityConfig(allowedTools, blockedTools, commandBlacklist, commandWhitelist,
                auditEnabled, allowRoot, requests, windowSeconds);
    }

    public SecurityConfig withToolLists(List<String> allowed, List<String> blocked) {
        return new SecurityConfig(allowed, blocked, commandBlacklist, commandWhitelist,
                auditEnabled, allowRoot, rateLimitRequests, rateLimitWindowSeconds);
    }

    public SecurityConfig withCommandLists(List<String> blacklist, List<String> whitelist) {
        return new SecurityConfig(allowedTools, blockedTools, blacklist, whitelist,
                auditEnabled, allowRoot, rateLimitRequests, rateLimitWindowSeconds);
    }

    public SecurityConfig withAllowRoot(boolean allowRoot) {
        return new SecurityConfig(allowedTools, blockedTools, commandBlacklist, commandWhitelist,
                auditEnabled, allowRoot, rateLimitRequests, rateLimitWindowSeconds);
    }

    public SecurityConfig withAuditEnabled(boolean auditEnabled) {
        return new SecurityConfig(allowedTools, blockedTools, commandBlacklist, commandWhitelist,
                auditEnabled, allowRoot, rateLimitRequests, rateLimitWindowSeconds);
    }
}
