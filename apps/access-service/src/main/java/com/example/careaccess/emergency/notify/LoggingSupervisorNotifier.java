package com.example.careaccess.emergency.notify;

import com.example.careaccess.common.util.StringSanitizer;
import com.example.careaccess.emergency.model.ComplianceAlert;
import com.example.careaccess.emergency.model.EmergencyGrant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Default notifier that records the notification in the service log.
 */
@Slf4j
@Component
public class LoggingSupervisorNotifier implements SupervisorNotifier {

    @Override
    public Mono<Void> notifySupervisor(EmergencyGrant grant, List<ComplianceAlert> alerts) {
        return Mono.fromRunnable(() -> log.warn(
                "Supervisor notification: {} emergency access {} for user={} on resource={} (supervisor={}, alerts={})",
                grant.level().getValue(),
                grant.requestId(),
                StringSanitizer.forLog(grant.userId()),
                StringSanitizer.forLog(grant.resourceAccessed()),
                StringSanitizer.forLog(grant.supervisorId()),
                alerts.stream().map(a -> a.type().name()).toList()));
    }
}
