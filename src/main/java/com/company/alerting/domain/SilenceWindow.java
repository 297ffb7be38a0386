package com.company.alerting.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SilenceWindow {
    private Long id;
    private String name;
    private Matchers matchers;
    private Instant startsAt;
    private Instant endsAt;
    private Boolean active;
    private String createdBy;
    private Instant createdAt;

    public boolean isActiveAt(Instant now) {
        return Boolean.TRUE.equals(active)
                && startsAt != null && endsAt != null
                && !now.isBefore(startsAt)
                && !now.isAfter(endsAt);
    }

    /**
     * Present matchers are AND-combined; an absent or empty matcher matches everything.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Matchers {
        private List<String> service;
        private List<String> severity;
        private Map<String, String> labels;
    }
}
