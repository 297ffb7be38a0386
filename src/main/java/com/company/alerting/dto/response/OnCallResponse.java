package com.company.alerting.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OnCallResponse {
    private Long scheduleId;
    private String scheduleName;
    private Instant at;
    // null when nobody is on call
    private String userId;
}
