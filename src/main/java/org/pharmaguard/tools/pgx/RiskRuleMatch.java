package org.pharmaguard.tools.pgx;

import org.pharmaguard.utils.Utils;

import java.util.List;
import java.util.Optional;

/**
 * Verdict of {@link RiskRuleMatcher}: either a matched catalog rule or the explicit Unknown fallback.
 *
 * @param rule the matched rule, {@code null} on the fallback path
 */
public record RiskRuleMatch(RiskRule rule,
                            RiskLabel riskLabel,
                            Severity severity,
                            String action,
                            List<String> alternatives) {

    public RiskRuleMatch {
        Utils.nonNull(riskLabel, "risk label");
        Utils.nonNull(severity, "severity");
        Utils.nonNull(action, "action");
        alternatives = List.copyOf(alternatives);
    }

    public static RiskRuleMatch matched(final RiskRule rule) {
        return new RiskRuleMatch(rule, rule.riskLabel(), rule.severity(), rule.action(), rule.alternatives());
    }

    public boolean isRuleCovered() {
        return rule != null;
    }

    public Optional<RiskRule> getRule() {
        return Optional.ofNullable(rule);
    }
}
