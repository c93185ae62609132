package com.sandboxgate.security;

import com.sandboxgate.shared.config.SecurityConfig;
import com.sandboxgate.shared.model.ToolCall;
import com.sandboxgate.shared.model.ToolType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Single policy entry point for tool calls. Checks run cheapest first and the first
 * failure wins: rate limit, tool block-list, tool allow-list, then the tool-specific
 * command or path check. Every failure is appended to the violation log.
 */
public class SecurityManager {

    private static final Logger log = LoggerFactory.getLogger(SecurityManager.class);

    private final SecurityConfig config;
    private final CommandAnalyzer commandAnalyzer;
    private final PathValidator pathValidator;
    private final RateLimiter rateLimiter;
    private final List<RiskFinding> violations = Collections.synchronizedList(new ArrayList<>());
    private final List<Consumer<RiskFinding>> listeners = new CopyOnWriteArrayList<>();

    public SecurityManager(SecurityConfig config, String workingDirectory) {
        this(config, new CommandAnalyzer(config), new PathValidator(workingDirectory),
                new RateLimiter(config.rateLimitRequests(), config.rateLimitWindowSeconds()));
    }

    public SecurityManager(SecurityConfig config, CommandAnalyzer commandAnalyzer,
                           PathValidator pathValidator, RateLimiter rateLimiter) {
        this.config = config;
        this.commandAnalyzer = commandAnalyzer;
        this.pathValidator = pathValidator;
        this.rateLimiter = rateLimiter;
    }

    public Verdict validate(ToolCall call) {
        return validate(call, null);
    }

    public Verdict validate(ToolCall call, String callerId) {
        var toolName = call.toolName();

        var rate = rateLimiter.check(callerId == null ? RateLimiter.DEFAULT_KEY : callerId);
        if (!rate.allowed()) {
            return reject(RiskCategory.RATE_LIMIT, rate.reason(), call, RiskLevel.MEDIUM);
        }

        if (config.blockedTools().contains(toolName)) {
            return reject(RiskCategory.TOOL_BLOCKED, "Tool " + toolName + " is blocked", call, RiskLevel.HIGH);
        }

        if (!config.allowedTools().isEmpty() && !config.allowedTools().contains(toolName)) {
            return reject(RiskCategory.TOOL_NOT_ALLOWED, "Tool " + toolName + " is not in the allowed list",
                    call, RiskLevel.MEDIUM);
        }

        var type = call.toolType();
        if (type == ToolType.BASH) {
            var verdict = commandAnalyzer.isSafe(call.stringArg("", "command"));
            if (!verdict.allowed()) {
                return reject(RiskCategory.UNSAFE_COMMAND, verdict.reason(), call, RiskLevel.HIGH);
            }
        } else if (type == ToolType.READ) {
            var verdict = pathValidator.validateRead(call.path());
            if (!verdict.allowed()) {
                return reject(RiskCategory.INVALID_PATH, verdict.reason(), call, RiskLevel.MEDIUM);
            }
        } else if (type == ToolType.WRITE || type == ToolType.EDIT) {
            var verdict = pathValidator.validateWrite(call.path());
            if (!verdict.allowed()) {
                return reject(RiskCategory.INVALID_PATH, verdict.reason(), call, RiskLevel.HIGH);
            }
        }
        return Verdict.allow();
    }

    public void addViolationListener(Consumer<RiskFinding> listener) {
        listeners.add(listener);
    }

    /** Violations filtered by time range and level; any filter may be {@code null}. */
    public List<RiskFinding> getViolations(Instant from, Instant to, RiskLevel level) {
        synchronized (violations) {
            return violations.stream()
                    .filter(v -> from == null || !v.timestamp().isBefore(from))
                    .filter(v -> to == null || !v.timestamp().isAfter(to))
                    .filter(v -> level == null || v.level() == level)
                    .collect(Collectors.toList());
        }
    }

    public List<RiskFinding> getViolations() {
        return getViolations(null, null, null);
    }

    public List<Map<String, Object>> exportViolations() {
        return getViolations().stream().map(RiskFinding::toMap).collect(Collectors.toList());
    }

    public Map<String, Object> stats() {
        var snapshot = getViolations();
        var byLevel = new LinkedHashMap<String, Integer>();
        var byType = new LinkedHashMap<String, Integer>();
        for (var v : snapshot) {
            byLevel.merge(v.level().value(), 1, Integer::sum);
            byType.merge(v.category().value(), 1, Integer::sum);
        }
        var stats = new LinkedHashMap<String, Object>();
        stats.put("total_violations", snapshot.size());
        stats.put("by_risk_level", byLevel);
        stats.put("by_violation_type", byType);
        return stats;
    }

    public CommandAnalyzer commandAnalyzer() { return commandAnalyzer; }

    public PathValidator pathValidator() { return pathValidator; }

    public RateLimiter rateLimiter() { return rateLimiter; }

    private Verdict reject(RiskCategory category, String reason, ToolCall call, RiskLevel level) {
        var violation = RiskFinding.violation(category, reason, level, call.toolName(), call.arguments());
        violations.add(violation);
        log.warn("[Security] Violation: {} - {} (tool={}, risk={})",
                category.value(), reason, call.toolName(), level.value());
        for (var listener : listeners) {
            listener.accept(violation);
        }
        return Verdict.deny(reason);
    }
}
