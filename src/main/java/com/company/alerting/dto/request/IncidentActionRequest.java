package com.company.alerting.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IncidentActionRequest {
    // Defaults to "system" when absent
    @Size(max = 255, message = "Actor must be at most 255 characters")
    private String actor;
}
