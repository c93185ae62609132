package com.sandboxgate.security;

import com.sandboxgate.shared.config.SecurityConfig;
import com.sandboxgate.shared.model.ToolCall;
import com.sandboxgate.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SecurityManagerTest {

    private final MutableClock clock = new MutableClock();

    private SecurityManager manager(SecurityConfig config) {
        return new SecurityManager(config, new CommandAnalyzer(config),
                new PathValidator("/workspace", "/home/agent"),
                new RateLimiter(config.rateLimitRequests(), Duration.ofSeconds(config.rateLimitWindowSeconds()), clock));
    }

    private static ToolCall bash(String command) {
        return new ToolCall("Bash", Map.of("command", command));
    }

    @Test
    void allowsSafeCallsWithoutRecordingViolations() {
        var manager = manager(SecurityConfig.defaults());
        assertTrue(manager.validate(bash("ls -la")).allowed());
        assertTrue(manager.validate(new ToolCall("Read", Map.of("file_path", "src/App.java"))).allowed());
        assertTrue(manager.getViolations().isEmpty());
    }

    @Test
    void unsafeCommandIsHighSeverity() {
        var manager = manager(SecurityConfig.defaults());
        var verdict = manager.validate(bash("rm -rf /"));

        assertFalse(verdict.allowed());
        assertThat(verdict.reason()).contains("Root directory deletion");
        assertThat(manager.getViolations()).singleElement().satisfies(v -> {
            assertEquals(RiskCategory.UNSAFE_COMMAND, v.category());
            assertEquals(RiskLevel.HIGH, v.level());
            assertEquals("Bash", v.toolName());
            assertEquals("rm -rf /", v.arguments().get("command"));
        });
    }

    @Test
    void writeToSystemPathIsHighAndReadOfSensitivePathIsMedium() {
        var manager = manager(SecurityConfig.defaults());
        assertFalse(manager.validate(new ToolCall("Write", Map.of("path", "/etc/passwd", "content", "x"))).allowed());
        assertFalse(manager.validate(new ToolCall("Edit", Map.of("path", "/usr/lib/x.conf"))).allowed());
        assertFalse(manager.validate(new ToolCall("Read", Map.of("path", "/etc/shadow"))).allowed());

        assertThat(manager.getViolations()).extracting(RiskFinding::level)
                .containsExactly(RiskLevel.HIGH, RiskLevel.HIGH, RiskLevel.MEDIUM);
        assertThat(manager.getViolations()).extracting(RiskFinding::category)
                .containsOnly(RiskCategory.INVALID_PATH);
    }

    @Test
    void blockListWinsOverToolCheck() {
        var config = SecurityConfig.defaults().withToolLists(List.of(), List.of("Bash"));
        var manager = manager(config);

        var verdict = manager.validate(bash("rm -rf /"));
        assertEquals("Tool Bash is blocked", verdict.reason());
        assertThat(manager.getViolations()).singleElement()
                .satisfies(v -> assertEquals(RiskCategory.TOOL_BLOCKED, v.category()));
    }

    @Test
    void allowListOnlyAppliesWhenNonEmpty() {
        var manager = manager(SecurityConfig.defaults().withToolLists(List.of("Read"), List.of()));
        assertTrue(manager.validate(new ToolCall("Read", Map.of("path", "a.txt"))).allowed());

        var verdict = manager.validate(new ToolCall("Glob", Map.of("pattern", "*.java")));
        assertFalse(verdict.allowed());
        assertEquals(RiskLevel.MEDIUM, manager.getViolations().get(0).level());
        assertEquals(RiskCategory.TOOL_NOT_ALLOWED, manager.getViolations().get(0).category());
    }

    @Test
    void rateLimitIsCheckedFirstAndKeyedByCaller() {
        var manager = manager(SecurityConfig.defaults().withRateLimit(2, 60));
        assertTrue(manager.validate(bash("ls"), "alice").allowed());
        assertTrue(manager.validate(bash("ls"), "alice").allowed());

        var limited = manager.validate(bash("rm -rf /"), "alice");
        assertThat(limited.reason()).startsWith("Rate limit exceeded");
        assertEquals(RiskCategory.RATE_LIMIT, manager.getViolations().get(0).category());
        assertEquals(RiskLevel.MEDIUM, manager.getViolations().get(0).level());

        assertTrue(manager.validate(bash("ls"), "bob").allowed());

        clock.advance(Duration.ofSeconds(61));
        assertTrue(manager.validate(bash("ls"), "alice").allowed());
    }

    @Test
    void refusedCallsAreRecordedAsBlockedAtEveryLevel() {
        var manager = manager(SecurityConfig.defaults().withRateLimit(1, 60)
                .withToolLists(List.of("Bash", "Read"), List.of()));
        manager.validate(new ToolCall("Read", Map.of("path", "/etc/shadow")), "alice");
        manager.validate(bash("ls"), "alice");
        manager.validate(new ToolCall("Glob", Map.of("pattern", "*")), "bob");

        var violations = manager.getViolations();
        assertThat(violations).extracting(RiskFinding::category).containsExactly(
                RiskCategory.INVALID_PATH, RiskCategory.RATE_LIMIT, RiskCategory.TOOL_NOT_ALLOWED);
        assertThat(violations).allSatisfy(v -> {
            assertEquals(RiskLevel.MEDIUM, v.level());
            assertTrue(v.blocked());
        });
        assertThat(manager.exportViolations()).allSatisfy(m -> assertEquals(true, m.get("blocked")));
    }

    @Test
    void violationQueriesAndStats() {
        var manager = manager(SecurityConfig.defaults());
        manager.validate(bash("sudo reboot"));
        manager.validate(new ToolCall("Read", Map.of("path", "/etc/shadow")));

        assertEquals(1, manager.getViolations(null, null, RiskLevel.MEDIUM).size());
        assertEquals(2, manager.getViolations(Instant.now().minusSeconds(3600), null, null).size());

        var stats = manager.stats();
        assertEquals(2, stats.get("total_violations"));
        assertEquals(Map.of("high", 1, "medium", 1), stats.get("by_risk_level"));

        var exported = manager.exportViolations();
        assertThat(exported.get(0)).containsKeys("timestamp", "violation_type", "description",
                "tool_name", "risk_level", "blocked");
        assertEquals("unsafe_command", exported.get(0).get("violation_type"));
    }

    @Test
    void listenersSeeEveryViolation() {
        var manager = manager(SecurityConfig.defaults());
        var seen = new ArrayList<RiskFinding>();
        manager.addViolationListener(seen::add);

        manager.validate(bash("ls"));
        manager.validate(bash("mkfs.ext4 /dev/sda1"));

        assertEquals(1, seen.size());
        assertTrue(seen.get(0).blocked());
    }
}
