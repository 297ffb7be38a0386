package com.company.alerting.domain;

import com.company.alerting.domain.enums.ChannelType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationChannel {
    private Long id;
    private String name;
    private ChannelType channelType;

    /** Type-specific settings, e.g. webhook_url, routing_key, recipients. */
    @Builder.Default
    private Map<String, Object> config = new HashMap<>();

    private Filters filters;
    private Boolean active;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Filters {
        private List<String> severity;
        private List<String> service;
    }
}
