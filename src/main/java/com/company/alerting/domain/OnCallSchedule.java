package com.company.alerting.domain;

import com.company.alerting.domain.enums.RotationType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OnCallSchedule implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private String name;
    private RotationType rotationType;

    @Builder.Default
    private List<Member> members = new ArrayList<>();

    private LocalTime handoffTime;
    private String timezone;
    private Integer rotationIntervalHours;
    private Integer rotationIntervalDays;
    private Instant effectiveFrom;
    private Boolean active;

    @Builder.Default
    private List<ScheduleOverride> overrides = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Member implements Serializable {
        private static final long serialVersionUID = 1L;

        @JsonProperty("user_id")
        private String userId;

        private int order;
    }

    /**
     * Temporary replacement of the rotation; active over {@code [startsAt, endsAt)}.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScheduleOverride implements Serializable {
        private static final long serialVersionUID = 1L;

        private Long id;
        private Long scheduleId;
        private String userId;
        private Instant startsAt;
        private Instant endsAt;
        private Instant createdAt;

        public boolean covers(Instant at) {
            return !at.isBefore(startsAt) && at.isBefore(endsAt);
        }
    }
}
