package com.company.alerting.service;

import com.company.alerting.config.AlertingProperties;
import com.company.alerting.domain.EscalationPolicy;
import com.company.alerting.domain.Incident;
import com.company.alerting.domain.IncidentEscalation;
import com.company.alerting.domain.IncidentEvent;
import com.company.alerting.domain.enums.EscalationState;
import com.company.alerting.domain.enums.IncidentEventType;
import com.company.alerting.repository.EscalationPolicyRepository;
import com.company.alerting.repository.IncidentEscalationRepository;
import com.company.alerting.repository.IncidentEventRepository;
import com.company.alerting.repository.IncidentRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.AllArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Walks an incident through the levels of its escalation policy until someone
 * acknowledges it or the policy runs out.
 *
 * <p>Timer state is the {@code incident_escalations} row. The row is armed at level 0 in
 * the transaction that opens the incident, so a crash before the first page still leaves
 * a due timer for the next scan. Every transition runs with the
 * incident row locked and is applied as a version-guarded update, so a fire that lost
 * a race (acknowledged meanwhile, or already handled by another scan) changes nothing.
 * Pages go out after the transition commits.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EscalationService {

    public enum TimeoutOutcome {
        /** Armed timer fired; level 1 paged. */
        STARTED,
        /** Moved to the next level of the policy. */
        ADVANCED,
        /** Last level timed out; restarted at level 1 consuming one repeat. */
        REPEATED,
        /** Last level timed out with no repeats left. */
        EXHAUSTED,
        /** Incident no longer open; escalation switched off. */
        STOPPED,
        /** Timer was already handled, cancelled or not yet due. */
        STALE
    }

    private final IncidentEscalationRepository escalationRepository;
    private final IncidentRepository incidentRepository;
    private final IncidentEventRepository eventRepository;
    private final EscalationPolicyRepository policyRepository;
    private final EscalationPolicyResolver policyResolver;
    private final OnCallService onCallService;
    private final ResponderPager pager;
    private final TransactionTemplate transactionTemplate;
    private final AlertingProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Pages level 1 for a newly created incident, arming the timer first if the
     * incident was created without one. Returns false when the incident has no
     * applicable policy, is no longer open, or is already escalating.
     */
    public boolean start(Long incidentId) {
        Optional<IncidentEscalation> armed = escalationRepository.findByIncidentId(incidentId);
        if (armed.isEmpty()) {
            try {
                armed = transactionTemplate.execute(status -> armLocked(incidentId, clock.instant()));
            } catch (DuplicateKeyException e) {
                armed = escalationRepository.findByIncidentId(incidentId);
            }
        }

        if (armed == null || armed.isEmpty() || !armed.get().isArmed()) {
            log.debug("Escalation for incident {} not started (no policy or already running)", incidentId);
            return false;
        }
        return onTimeout(armed.get()) == TimeoutOutcome.STARTED;
    }

    /**
     * Inserts the level-0 timer, due immediately, inside the caller's transaction.
     * The first page is sent by {@link #start} after commit, or by the next scan.
     *
     * @throws DuplicateKeyException when the incident already has an escalation
     */
    public Optional<IncidentEscalation> arm(Incident incident, Instant now) {
        Optional<EscalationPolicy> policy = policyResolver.resolve(incident.getService(), incident.getSeverity());
        if (policy.isEmpty() || policy.get().levelCount() == 0) {
            log.info("No escalation policy applies to incident {} (service={}, severity={})",
                    incident.getId(), incident.getService(), incident.getSeverity().value());
            return Optional.empty();
        }

        IncidentEscalation escalation = IncidentEscalation.builder()
                .incidentId(incident.getId())
                .policyId(policy.get().getId())
                .state(EscalationState.ACTIVE)
                .currentLevel(0)
                .repeatsRemaining(policy.get().getRepeatCount())
                .levelEnteredAt(now)
                .timeoutMinutes(0)
                .nextDueAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build();
        escalationRepository.insert(escalation);

        meterRegistry.counter("escalation.started").increment();
        log.info("Escalation armed for incident {} with policy '{}'", incident.getId(), policy.get().getName());
        return Optional.of(escalation);
    }

    private Optional<IncidentEscalation> armLocked(Long incidentId, Instant now) {
        Optional<Incident> incident = incidentRepository.findByIdForUpdate(incidentId);
        if (incident.isEmpty() || !incident.get().isOpen()) {
            log.debug("Incident {} is not open, escalation not started", incidentId);
            return Optional.empty();
        }
        Optional<IncidentEscalation> existing = escalationRepository.findByIncidentId(incidentId);
        if (existing.isPresent()) {
            return existing;
        }
        return arm(incident.get(), now);
    }

    /**
     * Stops the timer because a responder took the incident.
     */
    public boolean acknowledge(Long incidentId) {
        return deactivate(incidentId, "acknowledged");
    }

    /**
     * Stops the timer because the incident was resolved.
     */
    public boolean cancel(Long incidentId) {
        return deactivate(incidentId, "cancelled");
    }

    private boolean deactivate(Long incidentId, String reason) {
        boolean stopped = escalationRepository.deactivate(incidentId, clock.instant()) > 0;
        if (stopped) {
            log.info("Escalation for incident {} {}", incidentId, reason);
        }
        return stopped;
    }

    /**
     * Handles one due timer as read by the scan. {@code due} is the row snapshot the
     * scan saw; if the row has moved on since, nothing happens.
     */
    public TimeoutOutcome onTimeout(IncidentEscalation due) {
        Instant now = clock.instant();
        Transition transition = transactionTemplate.execute(status -> advanceLocked(due, now));

        if (transition.page != null) {
            pager.page(transition.page.incident, transition.page.level, transition.page.userIds);
        }
        return transition.outcome;
    }

    private Transition advanceLocked(IncidentEscalation due, Instant now) {
        Long incidentId = due.getIncidentId();
        Optional<Incident> incident = incidentRepository.findByIdForUpdate(incidentId);
        IncidentEscalation current = escalationRepository.findByIncidentId(incidentId).orElse(null);

        if (current == null || current.getVersion() != due.getVersion() || !current.isDue(now)) {
            log.debug("Stale escalation timer for incident {} (version {})", incidentId, due.getVersion());
            return new Transition(TimeoutOutcome.STALE, null);
        }

        if (incident.isEmpty() || !incident.get().isOpen()) {
            escalationRepository.deactivate(incidentId, now);
            log.info("Incident {} no longer open, escalation stopped", incidentId);
            return new Transition(TimeoutOutcome.STOPPED, null);
        }

        EscalationPolicy policy = policyRepository.findById(current.getPolicyId());
        int levelCount = policy != null ? policy.levelCount() : 0;
        int nextLevel = current.getCurrentLevel() + 1;
        int repeatsRemaining = current.getRepeatsRemaining();
        TimeoutOutcome outcome;

        if (nextLevel <= levelCount) {
            outcome = current.isArmed() ? TimeoutOutcome.STARTED : TimeoutOutcome.ADVANCED;
        } else if (levelCount > 0 && repeatsRemaining > 0) {
            nextLevel = 1;
            repeatsRemaining--;
            outcome = TimeoutOutcome.REPEATED;
        } else {
            return exhaust(current, now);
        }

        EscalationPolicy.Level level = policy.level(nextLevel).orElseThrow();
        Instant entered = levelStart(current, now);
        current.setCurrentLevel(nextLevel);
        current.setRepeatsRemaining(repeatsRemaining);
        current.setLevelEnteredAt(entered);
        current.setTimeoutMinutes(level.getTimeoutMinutes());
        current.setNextDueAt(dueAt(entered, level));
        current.setUpdatedAt(now);

        if (!escalationRepository.compareAndSet(current, due.getVersion())) {
            return new Transition(TimeoutOutcome.STALE, null);
        }

        Set<String> users = resolveTargets(level, now);
        recordEscalated(incidentId, nextLevel, users, now);

        meterRegistry.counter("escalation.advanced", "outcome", outcome.name().toLowerCase(Locale.ROOT)).increment();
        log.warn("Incident {} escalated to level {} ({} repeats left), next timeout at {}",
                incidentId, nextLevel, repeatsRemaining, current.getNextDueAt());
        return new Transition(outcome, new Page(incident.get(), nextLevel, users));
    }

    private Transition exhaust(IncidentEscalation current, Instant now) {
        long expectedVersion = current.getVersion();
        current.setState(EscalationState.EXHAUSTED);
        current.setNextDueAt(null);
        current.setUpdatedAt(now);

        if (!escalationRepository.compareAndSet(current, expectedVersion)) {
            return new Transition(TimeoutOutcome.STALE, null);
        }

        eventRepository.append(IncidentEvent.builder()
                .incidentId(current.getIncidentId())
                .eventType(IncidentEventType.ESCALATION_EXHAUSTED)
                .description("Escalation policy exhausted at level " + current.getCurrentLevel())
                .actor(IncidentEvent.SYSTEM_ACTOR)
                .createdAt(now)
                .build());

        meterRegistry.counter("escalation.exhausted").increment();
        log.error("Escalation exhausted for incident {}; manual follow-up required", current.getIncidentId());
        return new Transition(TimeoutOutcome.EXHAUSTED, null);
    }

    /**
     * Users to page for a level: explicit users plus whoever is on call for each
     * referenced schedule, each user once.
     */
    Set<String> resolveTargets(EscalationPolicy.Level level, Instant now) {
        Set<String> users = new LinkedHashSet<>();
        if (level.getTargets() == null) {
            return users;
        }
        for (EscalationPolicy.Target target : level.getTargets()) {
            if (target == null || target.getType() == null || target.getId() == null) {
                continue;
            }
            switch (target.getType()) {
                case USER:
                    users.add(target.getId());
                    break;
                case SCHEDULE:
                    scheduleId(target.getId())
                            .flatMap(id -> onCallService.currentOnCall(id, now))
                            .ifPresent(users::add);
                    break;
                default:
                    break;
            }
        }
        return users;
    }

    private Optional<Long> scheduleId(String raw) {
        try {
            return Optional.of(Long.valueOf(raw.trim()));
        } catch (NumberFormatException e) {
            log.warn("Escalation target references invalid schedule id '{}'", raw);
            return Optional.empty();
        }
    }

    private void recordEscalated(Long incidentId, int level, Set<String> users, Instant now) {
        String who = users.isEmpty() ? "nobody on call" : "paged " + String.join(", ", users);
        eventRepository.append(IncidentEvent.builder()
                .incidentId(incidentId)
                .eventType(IncidentEventType.ESCALATED)
                .description("Escalated to level " + level + ": " + who)
                .actor(IncidentEvent.SYSTEM_ACTOR)
                .createdAt(now)
                .build());
    }

    /**
     * A timer fired within the misfire grace keeps the schedule anchored on its due time;
     * a later fire (downtime) restarts the spacing from now.
     */
    Instant levelStart(IncidentEscalation current, Instant now) {
        Instant due = current.getNextDueAt();
        if (due == null || due.isAfter(now)) {
            return now;
        }
        Duration grace = properties.getEscalation().getMisfireGrace();
        return due.isBefore(now.minus(grace)) ? now : due;
    }

    private static Instant dueAt(Instant now, EscalationPolicy.Level level) {
        return now.plus(Duration.ofMinutes(Math.max(0, level.getTimeoutMinutes())));
    }

    @AllArgsConstructor
    private static class Page {
        private final Incident incident;
        private final int level;
        private final Set<String> userIds;
    }

    @AllArgsConstructor
    private static class Transition {
        private final TimeoutOutcome outcome;
        private final Page page;
    }
}
