package com.sandboxgate.sandbox;

import com.sandboxgate.shared.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Retries backend calls with exponential backoff. Configuration errors, non-retryable
 * {@link SandboxException}s and client errors fail immediately. A client error is a message
 * reporting {@code status 4xx} or {@code HTTP 4xx} other than 408 and 429; bare numbers such
 * as ports or file names are not read as status codes.
 */
public final class ResilientCall {

    private static final Logger log = LoggerFactory.getLogger(ResilientCall.class);

    static final int MAX_RETRIES = 2;
    static final long INITIAL_DELAY_MS = 500;
    private static final long MAX_BACKOFF_MS = 10_000;
    private static final Pattern STATUS_CODE = Pattern.compile("(?i)\\b(?:status(?:\\s+code)?|http(?:/\\d(?:\\.\\d)?)?)[\\s:=]+(\\d{3})\\b");

    private ResilientCall() {}

    public static <T> T execute(Callable<T> action) {
        return execute(action, MAX_RETRIES, INITIAL_DELAY_MS);
    }

    public static <T> T execute(Callable<T> action, int maxRetries, long baseDelayMs) {
        Exception last = null;
        long delay = baseDelayMs;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                return action.call();
            } catch (Exception e) {
                last = e;
                if (isNonRetryable(e)) break;
                if (attempt < maxRetries) {
                    log.debug("Attempt {} failed, retrying in {}ms: {}", attempt + 1, delay, e.getMessage());
                    sleep(delay);
                    delay = Math.min(delay * 2, MAX_BACKOFF_MS);
                }
            }
        }
        if (last instanceof SandboxException && isNonRetryable(last)) {
            throw (SandboxException) last;
        }
        if (last instanceof ConfigurationException) {
            throw (ConfigurationException) last;
        }
        throw new SandboxException("All retries exhausted: " + last.getMessage(), last, false);
    }

    static boolean isNonRetryable(Exception e) {
        if (e instanceof SandboxException && !((SandboxException) e).isRetryable()) return true;
        if (e instanceof ConfigurationException || e instanceof IllegalArgumentException) return true;
        int code = extractStatusCode(e);
        return code >= 400 && code < 500 && code != 429 && code != 408;
    }

    private static int extractStatusCode(Exception e) {
        if (e.getMessage() == null) return 0;
        Matcher m = STATUS_CODE.matcher(e.getMessage());
        while (m.find()) {
            int code = Integer.parseInt(m.group(1));
            if (code >= 100 && code < 600) return code;
        }
        return 0;
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new SandboxException("Interrupted during retry", ie, false);
        }
    }
}
