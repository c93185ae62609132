package com.sandboxgate.security;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RiskRuleCatalogTest {

    @Test
    void coversSevenCommandCategories() {
        var categories = RiskRuleCatalog.rules().stream().map(RiskRule::category).distinct().toList();
        assertThat(categories).containsExactlyInAnyOrder(
                RiskCategory.FILESYSTEM_DESTRUCTION,
                RiskCategory.SYSTEM_DESTRUCTION,
                RiskCategory.PRIVILEGE_ESCALATION,
                RiskCategory.REMOTE_CODE_EXECUTION,
                RiskCategory.NETWORK_ATTACK,
                RiskCategory.INFORMATION_DISCLOSURE,
                RiskCategory.RESOURCE_EXHAUSTION);
    }

    @Test
    void rulesAreCaseInsensitive() {
        var sudo = RiskRuleCatalog.rules(RiskCategory.PRIVILEGE_ESCALATION).get(0);
        assertTrue(sudo.matches("SUDO ls"));
    }

    @Test
    void forkBombIsCritical() {
        var matches = RiskRuleCatalog.rules().stream().filter(r -> r.matches(":(){ :|:& };:")).toList();
        assertEquals(1, matches.size());
        assertEquals(RiskLevel.CRITICAL, matches.get(0).level());
    }

    @Test
    void rootDeletionDoesNotMatchSubdirectory() {
        var rootRule = RiskRuleCatalog.rules().get(0);
        assertTrue(rootRule.matches("rm -rf /"));
        assertFalse(rootRule.matches("rm -rf /tmp/build"));
    }

    @Test
    void onlyHighAndCriticalBlock() {
        assertThat(Arrays.stream(RiskLevel.values()).filter(RiskLevel::isBlocking))
                .containsExactly(RiskLevel.HIGH, RiskLevel.CRITICAL);
    }
}
