package io.fwaas.orchestrator.domain;

import java.util.Objects;

/**
 * Where to place a rule in a policy. {@code insertBefore} wins when both references are given;
 * with neither the rule goes to the top of the list.
 */
public record RuleInsertion(String ruleId, String insertBefore, String insertAfter) {

    public RuleInsertion {
        Objects.requireNonNull(ruleId, "ruleId");
    }

    public static RuleInsertion atTop(String ruleId) {
        return new RuleInsertion(ruleId, null, null);
    }

    public static RuleInsertion before(String ruleId, String referenceRuleId) {
        return new RuleInsertion(ruleId, referenceRuleId, null);
    }

    public static RuleInsertion after(String ruleId, String referenceRuleId) {
        return new RuleInsertion(ruleId, null, referenceRuleId);
    }

    /**
     * @return the referenced rule id, or {@code null} when inserting at the top
     */
    public String reference() {
        if (insertBefore != null && !insertBefore.isBlank()) {
            return insertBefore;
        }
        if (insertAfter != null && !insertAfter.isBlank()) {
            return insertAfter;
        }
        return null;
    }

    public boolean placesBefore() {
        return insertBefore != null && !insertBefore.isBlank();
    }
}
