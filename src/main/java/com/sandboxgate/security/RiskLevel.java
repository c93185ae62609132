package com.sandboxgate.security;

import java.util.Locale;

public enum RiskLevel {
    LOW, MEDIUM, HIGH, CRITICAL;

    /** HIGH and CRITICAL findings block a command; LOW and MEDIUM are only recorded. */
    public boolean isBlocking() {
        return this == HIGH || this == CRITICAL;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
