package com.tradeflow.backend.trading.pipeline;

/**
 * Either an approved order or a rejection with reason. A rejection is a business
 * outcome, not an error.
 */
public record RiskVerdict(
        boolean approved,
        ApprovedOrder order,
        RejectionReason reason,
        String rationale
) {

    public static RiskVerdict approve(ApprovedOrder order) {
        return new RiskVerdict(true, order, null, order.rationale());
    }

    public static RiskVerdict reject(RejectionReason reason, String rationale) {
        return new RiskVerdict(false, null, reason, rationale);
    }
}
