package com.example.careaccess.emergency.notify;

import com.example.careaccess.emergency.model.ComplianceAlert;
import com.example.careaccess.emergency.model.EmergencyGrant;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Delivers supervisor notifications for high and critical emergency grants. Delivery mechanics
 * (paging, email) belong to the implementation.
 */
public interface SupervisorNotifier {

    Mono<Void> notifySupervisor(EmergencyGrant grant, List<ComplianceAlert> alerts);
}
