package com.company.alerting.domain;

import com.company.alerting.domain.enums.EscalationState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable escalation timer for one incident. Every transition bumps {@code version};
 * updates are conditional on the version read, so a stale timer fire is a no-op.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentEscalation {
    private Long incidentId;
    private Long policyId;
    private EscalationState state;
    private int currentLevel;
    private int repeatsRemaining;
    private Instant levelEnteredAt;
    private int timeoutMinutes;
    private Instant nextDueAt;
    private long version;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Level 0: inserted with the incident, level 1 not paged yet.
     */
    public boolean isArmed() {
        return state == EscalationState.ACTIVE && currentLevel == 0;
    }

    public boolean isDue(Instant now) {
        return state == EscalationState.ACTIVE && nextDueAt != null && !nextDueAt.isAfter(now);
    }
}
