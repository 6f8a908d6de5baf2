package com.evcharge.anomaly.model;

/**
 * Labels a detector can attach to a session. Declaration order is detector execution order,
 * and therefore the order labels and evidence appear in a merged finding.
 */
public enum AnomalyType {
    DOS_ATTACK("dos_attack"),
    BILLING_FRAUD("billing_fraud"),
    MULTI_USER_CONFLICT("multi_user_conflict");

    private final String label;

    AnomalyType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
