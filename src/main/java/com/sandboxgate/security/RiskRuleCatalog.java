package com.sandboxgate.security;

import java.util.List;
import java.util.stream.Collectors;

import static com.sandboxgate.security.RiskCategory.*;
import static com.sandboxgate.security.RiskLevel.*;

/**
 * Built-in dangerous command patterns. Matched case-insensitively anywhere in the command.
 */
public final class RiskRuleCatalog {

    private static final List<RiskRule> RULES = List.of(
            RiskRule.of(FILESYSTEM_DESTRUCTION, "rm\\s+-rf\\s+/(?!\\S)", "Root directory deletion", CRITICAL),
            RiskRule.of(FILESYSTEM_DESTRUCTION, "rm\\s+-rf\\s+/\\*", "Deletion of all files under root", CRITICAL),
            RiskRule.of(FILESYSTEM_DESTRUCTION, "rm\\s+-rf\\s+~", "Home directory deletion", HIGH),
            RiskRule.of(FILESYSTEM_DESTRUCTION, "mkfs\\.\\w+", "Filesystem format", CRITICAL),
            RiskRule.of(FILESYSTEM_DESTRUCTION, "dd\\s+if=/dev/(zero|random)\\s+of=/dev/[sh]d", "Disk overwrite", CRITICAL),

            RiskRule.of(SYSTEM_DESTRUCTION, ":\\(\\)\\s*\\{\\s*:\\|:&\\s*\\};:", "Fork bomb", CRITICAL),
            RiskRule.of(SYSTEM_DESTRUCTION, ">\\s*/dev/[sh]d[a-z]", "Disk device overwrite", CRITICAL),
            RiskRule.of(SYSTEM_DESTRUCTION, "chmod\\s+-R\\s+777\\s+/", "Recursive world-writable permissions", HIGH),
            RiskRule.of(SYSTEM_DESTRUCTION, "chmod\\s+777\\s+/etc", "System configuration permission change", HIGH),

            RiskRule.of(PRIVILEGE_ESCALATION, "\\bsudo\\b", "Use of sudo", HIGH),
            RiskRule.of(PRIVILEGE_ESCALATION, "\\bsu\\s+-", "User switch", HIGH),
            RiskRule.of(PRIVILEGE_ESCALATION, "chmod\\s+[ugoa]*\\+s", "SUID/SGID bit", HIGH),

            RiskRule.of(REMOTE_CODE_EXECUTION, "curl.*\\|\\s*(ba)?sh", "Remote script execution (curl)", CRITICAL),
            RiskRule.of(REMOTE_CODE_EXECUTION, "wget.*\\|\\s*(ba)?sh", "Remote script execution (wget)", CRITICAL),
            RiskRule.of(REMOTE_CODE_EXECUTION, "curl.*-o\\s*/tmp.*&&.*sh", "Download and execute", HIGH),
            RiskRule.of(REMOTE_CODE_EXECUTION, "python\\s+-c\\s+['\"]import\\s+urllib", "Python remote download", MEDIUM),

            RiskRule.of(NETWORK_ATTACK, "nc\\s+-l", "Network listener", HIGH),
            RiskRule.of(NETWORK_ATTACK, "nmap\\s+", "Network scan", MEDIUM),
            RiskRule.of(NETWORK_ATTACK, "tcpdump\\s+", "Packet capture", MEDIUM),

            RiskRule.of(INFORMATION_DISCLOSURE, "cat\\s+/etc/passwd", "User list read", LOW),
            RiskRule.of(INFORMATION_DISCLOSURE, "cat\\s+/etc/shadow", "Password file read", HIGH),
            RiskRule.of(INFORMATION_DISCLOSURE, "cat\\s+~/\\.ssh/", "SSH key read", HIGH),
            RiskRule.of(INFORMATION_DISCLOSURE, "cat\\s+.*\\.env", "Environment file read", MEDIUM),
            RiskRule.of(INFORMATION_DISCLOSURE, "printenv|\\benv\\s*$", "Environment dump", LOW),

            RiskRule.of(RESOURCE_EXHAUSTION, "while\\s+true.*do", "Infinite loop", MEDIUM),
            RiskRule.of(RESOURCE_EXHAUSTION, "for\\s*\\(\\s*;\\s*;\\s*\\)", "Infinite loop", MEDIUM),
            RiskRule.of(RESOURCE_EXHAUSTION, "dd\\s+if=/dev/zero\\s+of=", "Disk fill", HIGH),
            RiskRule.of(RESOURCE_EXHAUSTION, "\\byes\\s+", "Unbounded output", MEDIUM)
    );

    private RiskRuleCatalog() {}

    public static List<RiskRule> rules() {
        return RULES;
    }

    public static List<RiskRule> rules(RiskCategory category) {
        return RULES.stream().filter(r -> r.category() == category).collect(Collectors.toList());
    }
}
