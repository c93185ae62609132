package com.sandboxgate.shared.config;

import java.util.Locale;

public enum SandboxType {
    E2B,
    DAYTONA,
    DOCKER,
    /** Host-directory execution; no isolation, development only. */
    LOCAL;

    public static SandboxType parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException("Unknown sandbox type: " + value);
        }
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
