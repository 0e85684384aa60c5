package com.company.slaregistry.config;

import com.company.slaregistry.domain.enums.AlertStatus;
import com.company.slaregistry.domain.enums.SlaStatus;
import com.company.slaregistry.repository.EntityStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Ledger gauges
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final EntityStore store;

    @Bean
    public MeterBinder ledgerMetrics() {
        return (registry) -> {
            for (AlertStatus status : AlertStatus.values()) {
                Gauge.builder("sla.alerts", store, s -> s.countAlertsByStatus(status))
                        .tag("status", status.name())
                        .description("Number of alerts per lifecycle status")
                        .register(registry);
            }

            for (SlaStatus status : SlaStatus.values()) {
                Gauge.builder("sla.slas", store, s -> s.countSlasByStatus(status))
                        .tag("status", status.name())
                        .description("Number of SLAs per status")
                        .register(registry);
            }

            log.info("Ledger metrics registered");
        };
    }
}
