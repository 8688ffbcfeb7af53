package com.example.careaccess.access.controller;

import com.example.careaccess.access.model.AccessDecision;
import com.example.careaccess.access.model.request.AccessCheckRequest;
import com.example.careaccess.access.service.AccessDecisionService;
import com.example.careaccess.common.util.StringSanitizer;
import com.example.careaccess.security.context.CallerContextHolder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/access")
@RequiredArgsConstructor
public class AccessDecisionController {

    private final AccessDecisionService accessDecisionService;

    @PostMapping("/check")
    public Mono<AccessDecision> checkAccess(@RequestBody AccessCheckRequest request) {
        return CallerContextHolder.getContext()
                .doOnNext(caller -> log.debug("POST /check - user: {}, role: {}, purpose: {}",
                        caller.userId(), caller.role(), StringSanitizer.forLog(request.purpose())))
                .flatMap(caller -> accessDecisionService.checkAccess(caller, request));
    }
}
