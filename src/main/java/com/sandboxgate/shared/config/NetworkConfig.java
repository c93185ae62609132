package com.sandboxgate.shared.config;

import java.util.List;

/**
 * Network access for sandboxes. {@code allowedDomains} is advisory: the built-in providers
 * only switch networking on or off, and a provider that can filter egress (or a proxy in
 * front of it) is expected to apply the list. {@link #restrictsDomains()} tells callers
 * when such a list was asked for.
 */
public record NetworkConfig(
    boolean enabled,
    List<String> allowedDomains,
    boolean allowExternalApi
) {
    public NetworkConfig {
        allowedDomains = allowedDomains == null ? List.of() : List.copyOf(allowedDomains);
    }

    /** Network is on but limited to {@code allowedDomains}. */
    public boolean restrictsDomains() {
        return enabled && !allowedDomains.isEmpty();
    }

    public static NetworkConfig defaults() {
        return new NetworkConfig(false, List.of(), false);
    }

    public static NetworkConfig allowing(List<String> domains) {
        return new NetworkConfig(true, domains, false);
    }
}
