package com.sandboxgate.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sandboxgate.shared.model.ExecutionResult;
import com.sandboxgate.shared.model.ToolCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Append-only, hash-chained record of tool-call attempts. Entries appear in the order
 * {@link #log} is called, i.e. completion order.
 */
public class AuditLogger {

    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    public static final String GENESIS_HASH = "0".repeat(64);

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final boolean enabled;
    private final Clock clock;
    private final List<AuditEntry> entries = new ArrayList<>();

    public AuditLogger() {
        this(true);
    }

    public AuditLogger(boolean enabled) {
        this(enabled, Clock.systemUTC());
    }

    public AuditLogger(boolean enabled, Clock clock) {
        this.enabled = enabled;
        this.clock = clock;
    }

    public boolean isEnabled() { return enabled; }

    /** Appends an entry for {@code call}. Returns {@code null} when auditing is disabled. */
    public AuditEntry log(ToolCall call, ExecutionResult result, String userId, String sessionId) {
        if (!enabled) return null;

        AuditEntry entry;
        synchronized (entries) {
            var previous = entries.isEmpty() ? GENESIS_HASH : entries.get(entries.size() - 1).hash();
            var unsigned = new AuditEntry(entries.size(), clock.instant(), call.toolName(), call.arguments(),
                    result.success(), result.output(), result.error(), result.exitCode(), result.elapsedMs(),
                    result.sandboxId(), call.callId(), userId, sessionId, previous, null);
            entry = withHash(unsigned, hash(previous, unsigned));
            entries.add(entry);
        }

        if (entry.success()) {
            log.info("[Audit] {} ok (exit={}, {}ms, sandbox={})",
                    entry.toolName(), entry.exitCode(), entry.elapsedMs(), entry.sandboxId());
        } else {
            log.warn("[Audit] {} failed (exit={}): {}", entry.toolName(), entry.exitCode(), entry.error());
        }
        return entry;
    }

    /** Entries filtered by time range and tool name; any filter may be {@code null}. */
    public List<AuditEntry> getLogs(Instant from, Instant to, String toolName) {
        synchronized (entries) {
            return entries.stream()
                    .filter(e -> from == null || !e.timestamp().isBefore(from))
                    .filter(e -> to == null || !e.timestamp().isAfter(to))
                    .filter(e -> toolName == null || toolName.equals(e.toolName()))
                    .collect(Collectors.toList());
        }
    }

    public List<AuditEntry> getLogs() {
        return getLogs(null, null, null);
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public List<Map<String, Object>> exportLogs() {
        return getLogs().stream().map(AuditEntry::toMap).collect(Collectors.toList());
    }

    /** One JSON object per line, in log order. */
    public String exportJsonLines() {
        var sb = new StringBuilder();
        for (var record : exportLogs()) {
            sb.append(toJson(record)).append('\n');
        }
        return sb.toString();
    }

    /** Recomputes the chain; false if any entry was altered, dropped or reordered. */
    public boolean verifyChain() {
        return verifyChain(getLogs());
    }

    public static boolean verifyChain(List<AuditEntry> chain) {
        var previous = GENESIS_HASH;
        for (int i = 0; i < chain.size(); i++) {
            var entry = chain.get(i);
            if (entry.sequence() != i || !previous.equals(entry.previousHash())) return false;
            if (!hash(previous, entry).equals(entry.hash())) return false;
            previous = entry.hash();
        }
        return true;
    }

    static String hash(String previousHash, AuditEntry entry) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            digest.update(previousHash.getBytes(StandardCharsets.UTF_8));
            digest.update(toJson(entry.hashedContent()).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static AuditEntry withHash(AuditEntry e, String hash) {
        return new AuditEntry(e.sequence(), e.timestamp(), e.toolName(), e.arguments(), e.success(), e.output(),
                e.error(), e.exitCode(), e.elapsedMs(), e.sandboxId(), e.callId(), e.userId(), e.sessionId(),
                e.previousHash(), hash);
    }

    private static String toJson(Map<String, Object> record) {
        try {
            return CANONICAL.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit record is not serializable", e);
        }
    }
}
