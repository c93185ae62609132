package com.sandboxgate.sandbox;

/** The sandbox has no handler for the requested tool. */
public class UnsupportedToolException extends RuntimeException {

    private final String toolName;

    public UnsupportedToolException(String toolName) {
        super("Unsupported tool type: " + toolName);
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }
}
