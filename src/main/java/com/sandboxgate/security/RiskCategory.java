package com.sandboxgate.security;

import java.util.Locale;

public enum RiskCategory {
    FILESYSTEM_DESTRUCTION,
    SYSTEM_DESTRUCTION,
    PRIVILEGE_ESCALATION,
    REMOTE_CODE_EXECUTION,
    NETWORK_ATTACK,
    INFORMATION_DISCLOSURE,
    RESOURCE_EXHAUSTION,
    BLACKLIST_MATCH,
    WHITELIST_VIOLATION,
    UNSAFE_COMMAND,
    RATE_LIMIT,
    TOOL_BLOCKED,
    TOOL_NOT_ALLOWED,
    INVALID_PATH;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
