package com.sandboxgate.shared.model;

public enum ToolRiskClass {
    /** Only inspects the workspace. */
    READ_ONLY,
    /** Does not touch the workspace or shell; passes through without a sandbox. */
    STANDARD,
    /** Mutates state or runs code; must run inside a sandbox. */
    HIGH
}
