package com.company.alerting.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestResponse {
    private Long alertId;
    private String fingerprint;
    @JsonProperty("is_new")
    private Boolean isNew;
    private Integer duplicateCount;
    private String status;
    private Long incidentId;
}
