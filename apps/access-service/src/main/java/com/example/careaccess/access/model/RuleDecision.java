package com.example.careaccess.access.model;

/**
 * Result of evaluating a single access rule.
 */
public record RuleDecision(
        Outcome outcome,
        AccessBasis basis,
        String reason,
        String ruleId,
        String consentId
) {
    public enum Outcome {
        GRANT,
        DENY,
        NOT_APPLICABLE  // Rule has no opinion; evaluation continues
    }

    public static RuleDecision grant(String ruleId, AccessBasis basis, String reason) {
        return new RuleDecision(Outcome.GRANT, basis, reason, ruleId, null);
    }

    public static RuleDecision grantByConsent(String ruleId, String consentId, String reason) {
        return new RuleDecision(Outcome.GRANT, AccessBasis.CONSENT, reason, ruleId, consentId);
    }

    public static RuleDecision deny(String ruleId, String reason) {
        return new RuleDecision(Outcome.DENY, AccessBasis.DENIED, reason, ruleId, null);
    }

    public static RuleDecision notApplicable(String ruleId) {
        return new RuleDecision(Outcome.NOT_APPLICABLE, null, "Rule not applicable", ruleId, null);
    }

    public boolean isGranted() {
        return outcome == Outcome.GRANT;
    }

    public boolean isNotApplicable() {
        return outcome == Outcome.NOT_APPLICABLE;
    }
}
