package com.company.alerting.domain.enums;

public enum EscalationState {
    /** A level is armed and its timer is running. */
    ACTIVE,
    /** Acknowledged or resolved; no timer. */
    INACTIVE,
    /** Every level and repeat has been walked; left for manual handling. */
    EXHAUSTED
}
