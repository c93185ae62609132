package com.sandboxgate.sandbox;

public enum SandboxState {
    DISCONNECTED,
    CONNECTED,
    CLOSING
}
