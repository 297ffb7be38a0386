package com.company.alerting.support;

import com.company.alerting.dto.request.NormalizedAlertRequest;

import java.util.Map;

public final class AlertRequests {

    private AlertRequests() {
    }

    public static NormalizedAlertRequest firing(String service, String name, String severity) {
        return NormalizedAlertRequest.builder()
                .name(name)
                .source("prometheus")
                .service(service)
                .host("host-1")
                .severity(severity)
                .status("firing")
                .labels(Map.of("env", "prod"))
                .build();
    }

    public static NormalizedAlertRequest resolved(String service, String name, String severity) {
        NormalizedAlertRequest request = firing(service, name, severity);
        request.setStatus("resolved");
        return request;
    }
}
