package com.example.careaccess.emergency.controller;

import com.example.careaccess.common.util.StringSanitizer;
import com.example.careaccess.emergency.model.ComplianceAlert;
import com.example.careaccess.emergency.model.request.EmergencyAccessRequest;
import com.example.careaccess.emergency.model.response.EmergencyAccessResponse;
import com.example.careaccess.emergency.model.response.EmergencyStatsResponse;
import com.example.careaccess.emergency.model.response.RevokeResponse;
import com.example.careaccess.emergency.model.response.SessionStatusResponse;
import com.example.careaccess.emergency.service.EmergencyAccessMonitor;
import com.example.careaccess.rbac.Permission;
import com.example.careaccess.rbac.PermissionRegistry;
import com.example.careaccess.security.context.CallerContext;
import com.example.careaccess.security.context.CallerContextHolder;
import com.example.careaccess.security.exception.AuthorizationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/emergency")
@RequiredArgsConstructor
public class EmergencyAccessController {

    private final EmergencyAccessMonitor monitor;
    private final PermissionRegistry permissionRegistry;

    @PostMapping("/requests")
    public Mono<ResponseEntity<EmergencyAccessResponse>> requestAccess(@RequestBody EmergencyAccessRequest request) {
        return CallerContextHolder.getContext()
                .doOnNext(caller -> log.debug("POST /requests - caller: {}, user: {}, level: {}",
                        caller.userId(), StringSanitizer.forLog(request.userId()),
                        StringSanitizer.forLog(request.emergencyLevel())))
                .flatMap(caller -> monitor.requestAccess(caller, request))
                .map(response -> response.accessGranted()
                        ? ResponseEntity.ok(response)
                        : ResponseEntity.status(HttpStatus.FORBIDDEN).body(response));
    }

    @GetMapping("/sessions/{requestId}")
    public Mono<SessionStatusResponse> getSessionStatus(@PathVariable String requestId) {
        return requireEmergencyRole()
                .flatMap(caller -> monitor.getSessionStatus(requestId));
    }

    @DeleteMapping("/sessions/{requestId}")
    public Mono<RevokeResponse> revoke(
            @PathVariable String requestId,
            @RequestParam(required = false) String reason) {
        return requireEmergencyRole()
                .flatMap(caller -> monitor.revoke(requestId, caller.userId(), reason));
    }

    @GetMapping("/alerts")
    public Mono<List<ComplianceAlert>> getUnresolvedAlerts() {
        return requireAdmin()
                .map(caller -> monitor.getUnresolvedAlerts());
    }

    @PostMapping("/alerts/{alertId}/resolve")
    public Mono<ComplianceAlert> resolveAlert(@PathVariable String alertId) {
        return requireAdmin()
                .flatMap(caller -> monitor.resolveAlert(alertId, caller.userId()));
    }

    @GetMapping("/stats")
    public Mono<EmergencyStatsResponse> getStats() {
        return CallerContextHolder.getContext()
                .flatMap(caller -> permissionRegistry.hasPermission(caller.role(), Permission.VIEW_SYSTEM_STATS)
                        ? Mono.just(monitor.getStats())
                        : Mono.error(new AuthorizationException(caller.userId(), "System statistics require VIEW_SYSTEM_STATS")));
    }

    private Mono<CallerContext> requireAdmin() {
        return CallerContextHolder.getContext()
                .flatMap(caller -> caller.isAdmin()
                        ? Mono.just(caller)
                        : Mono.error(new AuthorizationException(caller.userId(), "Administrator role required")));
    }

    private Mono<CallerContext> requireEmergencyRole() {
        return CallerContextHolder.getContext()
                .flatMap(caller -> permissionRegistry.isEmergencyRole(caller.role())
                        ? Mono.just(caller)
                        : Mono.error(new AuthorizationException(caller.userId(), "Emergency role required")));
    }
}
