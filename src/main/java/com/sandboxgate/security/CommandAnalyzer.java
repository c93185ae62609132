package com.sandboxgate.security;

import com.sandboxgate.shared.config.SecurityConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Checks a shell command against the configured blacklist, the built-in
 * {@link RiskRuleCatalog} and an optional prefix whitelist. Every match is reported;
 * only HIGH and CRITICAL findings make a command unsafe.
 */
public class CommandAnalyzer {

    private static final String TOOL_NAME = "Bash";

    private final List<Pattern> blacklist;
    private final List<String> whitelist;
    private final List<RiskRule> rules;

    public CommandAnalyzer(SecurityConfig config) {
        this.blacklist = config.commandBlacklist().stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .collect(Collectors.toList());
        this.whitelist = config.commandWhitelist();
        // privilege escalation is the caller's explicit choice when root is allowed
        this.rules = config.allowRoot()
                ? RiskRuleCatalog.rules().stream()
                    .filter(r -> r.category() != RiskCategory.PRIVILEGE_ESCALATION)
                    .collect(Collectors.toList())
                : RiskRuleCatalog.rules();
    }

    public List<RiskFinding> analyze(String command) {
        if (command == null || command.isBlank()) return List.of();

        var findings = new ArrayList<RiskFinding>();
        var args = Map.<String, Object>of("command", command);

        for (var pattern : blacklist) {
            if (pattern.matcher(command).find()) {
                findings.add(RiskFinding.of(RiskCategory.BLACKLIST_MATCH,
                        "Command matches blacklist pattern: " + pattern.pattern(),
                        RiskLevel.HIGH, TOOL_NAME, args));
            }
        }

        for (var rule : rules) {
            if (rule.matches(command)) {
                findings.add(RiskFinding.of(rule.category(), rule.description(), rule.level(), TOOL_NAME, args));
            }
        }

        if (!whitelist.isEmpty()) {
            var stripped = command.strip();
            if (whitelist.stream().noneMatch(stripped::startsWith)) {
                findings.add(RiskFinding.of(RiskCategory.WHITELIST_VIOLATION,
                        "Command is not in the whitelist", RiskLevel.HIGH, TOOL_NAME, args));
            }
        }
        return findings;
    }

    public Verdict isSafe(String command) {
        var blocking = analyze(command).stream()
                .filter(f -> f.level().isBlocking())
                .map(f -> f.description() + " (" + f.level().value() + ")")
                .collect(Collectors.toList());
        if (blocking.isEmpty()) return Verdict.allow();
        return Verdict.deny(String.join("; ", blocking));
    }
}
