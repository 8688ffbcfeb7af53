package com.example.careaccess.observability.health;

import com.example.careaccess.emergency.service.EmergencyAccessMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Reports emergency access monitoring state via /actuator/health/emergencyAccess.
 */
@Slf4j
@Component("emergencyAccessHealthIndicator")
@RequiredArgsConstructor
public class EmergencyAccessHealthIndicator implements ReactiveHealthIndicator {

    private final EmergencyAccessMonitor monitor;

    @Value("${app.store.type:memory}")
    private String storeType;

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(() -> Health.up()
                        .withDetail("storeType", storeType)
                        .withDetail("activeSessions", monitor.getActiveSessionCount())
                        .withDetail("unresolvedAlerts", monitor.getUnresolvedAlertCount())
                        .build())
                .onErrorResume(e -> {
                    log.warn("Emergency access health check failed: {}", e.getMessage());
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }
}
