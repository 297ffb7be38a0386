package com.company.alerting.domain;

import com.company.alerting.domain.enums.TargetType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationPolicy implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private String name;

    @Builder.Default
    private List<Level> levels = new ArrayList<>();

    /** 0 means the levels are walked once. */
    private int repeatCount;

    private Instant createdAt;

    public int levelCount() {
        return levels == null ? 0 : levels.size();
    }

    /**
     * Levels are 1-indexed and walked in ascending order of their {@code level} number.
     */
    public Optional<Level> level(int number) {
        if (levels == null || number < 1 || number > levels.size()) {
            return Optional.empty();
        }
        List<Level> ordered = new ArrayList<>(levels);
        ordered.sort(Comparator.comparingInt(Level::getLevel));
        return Optional.of(ordered.get(number - 1));
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Level implements Serializable {
        private static final long serialVersionUID = 1L;

        private int level;

        @JsonProperty("timeout_minutes")
        private int timeoutMinutes;

        @Builder.Default
        private List<Target> targets = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Target implements Serializable {
        private static final long serialVersionUID = 1L;

        private TargetType type;
        private String id;

        public static Target user(String userId) {
            return new Target(TargetType.USER, userId);
        }

        public static Target schedule(String scheduleId) {
            return new Target(TargetType.SCHEDULE, scheduleId);
        }
    }
}
