package com.repo.velocity.rules;

import java.util.List;

/**
 * Risk verdict for one commit or pull request.
 */
public record RiskAssessment(
        String itemId,
        RiskSubject.Kind kind,
        String author,
        long churn,

        /** Sum of the weights of every matched factor, never negative */
        int riskScore,

        RiskTier tier,

        /** Matched factors in rule order */
        List<RiskFactor> factors,

        /** (churn - team mean) / team stddev; 0 when the stddev is 0 */
        double churnZScore) {

    public RiskAssessment {
        factors = List.copyOf(factors);
    }

    public boolean isFlagged() {
        return tier != RiskTier.NONE;
    }

    public List<String> factorCodes() {
        return factors.stream().map(RiskFactor::code).toList();
    }
}
