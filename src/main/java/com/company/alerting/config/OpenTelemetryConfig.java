package com.company.alerting.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * SDK configured from the standard OTEL_* environment (exporter, endpoint, sampler).
 * Notification deliveries are the only spans this service creates.
 */
@Configuration
public class OpenTelemetryConfig {

    static final String INSTRUMENTATION_SCOPE = "com.company.alerting.notification";

    @Bean
    public OpenTelemetry openTelemetry() {
        return AutoConfiguredOpenTelemetrySdk.initialize().getOpenTelemetrySdk();
    }

    @Bean
    public Tracer notificationTracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_SCOPE, "1.0.0");
    }
}
