package com.example.careaccess.observability.metrics;

import com.example.careaccess.access.model.AccessBasis;
import com.example.careaccess.emergency.model.AlertType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Business metrics for access decisions and emergency access. Tag values come from enums only,
 * keeping cardinality bounded.
 */
@Component
public class AccessMetrics {

    private final MeterRegistry registry;

    private final Map<AccessBasis, Counter> decisionsByBasis = new EnumMap<>(AccessBasis.class);
    private final Map<AlertType, Counter> alertsByType = new EnumMap<>(AlertType.class);

    private final Counter emergencyGranted;
    private final Counter emergencyRejected;
    private final Counter sessionExpired;
    private final Counter sessionRevoked;
    private final Counter consentGranted;
    private final Counter consentRevoked;

    public AccessMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;

        for (AccessBasis basis : AccessBasis.values()) {
            decisionsByBasis.put(basis, Counter.builder("access.decision")
                    .tag("basis", basis.name().toLowerCase())
                    .description("Access decisions by basis")
                    .register(registry));
        }

        for (AlertType type : AlertType.values()) {
            alertsByType.put(type, Counter.builder("emergency.alert")
                    .tag("type", type.name().toLowerCase())
                    .description("Compliance alerts raised")
                    .register(registry));
        }

        this.emergencyGranted = Counter.builder("emergency.grant")
                .tag("outcome", "granted")
                .description("Emergency access requests granted")
                .register(registry);

        this.emergencyRejected = Counter.builder("emergency.grant")
                .tag("outcome", "rejected")
                .description("Emergency access requests rejected")
                .register(registry);

        this.sessionExpired = Counter.builder("emergency.session")
                .tag("event", "expired")
                .description("Emergency sessions retired by the sweeper")
                .register(registry);

        this.sessionRevoked = Counter.builder("emergency.session")
                .tag("event", "revoked")
                .description("Emergency sessions revoked explicitly")
                .register(registry);

        this.consentGranted = Counter.builder("consent.lifecycle")
                .tag("event", "granted")
                .description("Consents granted")
                .register(registry);

        this.consentRevoked = Counter.builder("consent.lifecycle")
                .tag("event", "revoked")
                .description("Consents revoked")
                .register(registry);
    }

    public void recordDecision(@NonNull AccessBasis basis) {
        decisionsByBasis.get(basis).increment();
    }

    public void recordEmergencyGranted() {
        emergencyGranted.increment();
    }

    public void recordEmergencyRejected() {
        emergencyRejected.increment();
    }

    public void recordAlert(@NonNull AlertType type) {
        alertsByType.get(type).increment();
    }

    public void recordSessionExpired(int count) {
        sessionExpired.increment(count);
    }

    public void recordSessionRevoked() {
        sessionRevoked.increment();
    }

    public void recordConsentGranted() {
        consentGranted.increment();
    }

    public void recordConsentRevoked() {
        consentRevoked.increment();
    }

    public void registerActiveSessionGauge(@NonNull Supplier<Number> activeSessions) {
        Gauge.builder("emergency.sessions.active", activeSessions)
                .description("Currently active emergency sessions")
                .register(registry);
    }
}
