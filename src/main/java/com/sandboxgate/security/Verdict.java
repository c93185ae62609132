package com.sandboxgate.security;

/** Outcome of a single policy check; {@code reason} is set only when not allowed. */
public record Verdict(boolean allowed, String reason) {

    private static final Verdict ALLOW = new Verdict(true, null);

    public static Verdict allow() {
        return ALLOW;
    }

    public static Verdict deny(String reason) {
        return new Verdict(false, reason);
    }
}
