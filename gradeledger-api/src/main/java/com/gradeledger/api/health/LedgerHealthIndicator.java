package com.gradeledger.api.health;

import com.gradeledger.api.config.GradeLedgerProperties;
import com.gradeledger.core.repository.DomainEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Reports whether the ledger store answers queries.
 */
@Component
public class LedgerHealthIndicator implements HealthIndicator {

    private final DomainEventRepository eventRepository;
    private final GradeLedgerProperties properties;

    public LedgerHealthIndicator(DomainEventRepository eventRepository, GradeLedgerProperties properties) {
        this.eventRepository = eventRepository;
        this.properties = properties;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("store", properties.getStore().getType().name().toLowerCase());

        try {
            details.put("events", eventRepository.count());
            return Health.up()
                .withDetails(details)
                .build();
        } catch (RuntimeException e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }
}
