package com.sandboxgate.sandbox;

/**
 * Backend or transport failure: connect errors, process I/O, pool wait timeouts.
 * Non-retryable failures are not retried by {@link ResilientCall}.
 */
public class SandboxException extends RuntimeException {

    private final boolean retryable;

    public SandboxException(String message) {
        this(message, null, true);
    }

    public SandboxException(String message, Throwable cause) {
        this(message, cause, true);
    }

    public SandboxException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static SandboxException permanent(String message) {
        return new SandboxException(message, null, false);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
