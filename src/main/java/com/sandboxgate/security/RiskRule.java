package com.sandboxgate.security;

import java.util.regex.Pattern;

public record RiskRule(RiskCategory category, Pattern pattern, String description, RiskLevel level) {

    static RiskRule of(RiskCategory category, String regex, String description, RiskLevel level) {
        return new RiskRule(category, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), description, level);
    }

    public boolean matches(String command) {
        return pattern.matcher(command).find();
    }
}
