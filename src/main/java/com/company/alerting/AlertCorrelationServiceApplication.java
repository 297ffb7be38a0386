package com.company.alerting;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableCaching
@EnableScheduling
@EnableAsync
@OpenAPIDefinition(
        info = @Info(
                title = "Alert Correlation Service API",
                version = "1.0.0",
                description = "Alert deduplication, incident correlation, escalation and notification"
        )
)
public class AlertCorrelationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertCorrelationServiceApplication.class, args);
    }
}
