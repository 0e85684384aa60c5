package com.company.slaregistry.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

@Configuration
@Slf4j
public class OpenTelemetryConfig {

    @Value("${spring.application.name:sla-registry-service}")
    private String serviceName;

    @Value("${otel.traces.exporter:otlp}")
    private String tracesExporter;

    /**
     * Only traces are exported; metrics go through Micrometer.
     * OTEL_* environment variables still override these defaults.
     */
    @Bean
    public OpenTelemetry openTelemetry() {
        log.info("Initializing OpenTelemetry for {} (traces exporter: {})", serviceName, tracesExporter);

        return AutoConfiguredOpenTelemetrySdk.builder()
                .addPropertiesSupplier(() -> Map.of(
                        "otel.service.name", serviceName,
                        "otel.traces.exporter", tracesExporter,
                        "otel.metrics.exporter", "none",
                        "otel.logs.exporter", "none"))
                .build()
                .getOpenTelemetrySdk();
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer("sla-registry-service");
    }
}
