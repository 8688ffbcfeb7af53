package com.example.careaccess.audit.controller;

import com.example.careaccess.audit.model.AuditAction;
import com.example.careaccess.audit.model.AuditEntry;
import com.example.careaccess.audit.model.AuditQuery;
import com.example.careaccess.audit.service.AuditTrail;
import com.example.careaccess.security.context.CallerContextHolder;
import com.example.careaccess.security.exception.AuthorizationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.time.Instant;

/**
 * Read-only audit trail queries, restricted to administrators.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditTrail auditTrail;

    @GetMapping("/entries")
    public Flux<AuditEntry> query(
            @RequestParam(required = false) String userId,
            @RequestParam(required = false) AuditAction action,
            @RequestParam(required = false) String requestId,
            @RequestParam(required = false) String subjectId,
            @RequestParam(required = false) Boolean granted,
            @RequestParam(defaultValue = "false") boolean phiOnly,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "100") int size) {

        AuditQuery query = AuditQuery.builder()
                .userId(userId)
                .action(action)
                .requestId(requestId)
                .subjectId(subjectId)
                .granted(granted)
                .phiOnly(phiOnly)
                .from(from)
                .to(to)
                .page(page)
                .size(size)
                .build();

        return CallerContextHolder.getContext()
                .flatMapMany(caller -> {
                    if (!caller.isAdmin()) {
                        return Flux.error(new AuthorizationException(caller.userId(),
                                "Audit queries require the administrator role"));
                    }
                    log.debug("GET /entries - admin: {}, action: {}, page: {}", caller.userId(), action, page);
                    return auditTrail.query(query);
                });
    }
}
