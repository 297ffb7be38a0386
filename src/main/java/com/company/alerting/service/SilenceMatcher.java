package com.company.alerting.service;

import com.company.alerting.domain.Alert;
import com.company.alerting.domain.SilenceWindow;
import com.company.alerting.repository.SilenceWindowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether an alert falls inside an active maintenance window.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SilenceMatcher {

    private final SilenceWindowRepository silenceWindowRepository;

    public boolean isSuppressed(Alert alert, Instant now) {
        return findMatchingWindow(alert, now).isPresent();
    }

    public Optional<SilenceWindow> findMatchingWindow(Alert alert, Instant now) {
        for (SilenceWindow window : silenceWindowRepository.findActive(now)) {
            if (window.isActiveAt(now) && matches(window.getMatchers(), alert)) {
                log.info("Alert {} ({}) silenced by window {} '{}'",
                        alert.getFingerprint(), alert.getName(), window.getId(), window.getName());
                return Optional.of(window);
            }
        }
        return Optional.empty();
    }

    static boolean matches(SilenceWindow.Matchers matchers, Alert alert) {
        if (matchers == null) {
            return true;
        }
        if (!isEmpty(matchers.getService()) && !matchers.getService().contains(alert.getService())) {
            return false;
        }
        if (!isEmpty(matchers.getSeverity())
                && (alert.getSeverity() == null || !matchers.getSeverity().contains(alert.getSeverity().value()))) {
            return false;
        }
        Map<String, String> required = matchers.getLabels();
        if (required != null && !required.isEmpty()) {
            Map<String, String> labels = alert.getLabels() != null ? alert.getLabels() : Map.of();
            for (Map.Entry<String, String> entry : required.entrySet()) {
                if (!Objects.equals(entry.getValue(), labels.get(entry.getKey()))) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean isEmpty(List<String> values) {
        return values == null || values.isEmpty();
    }
}
