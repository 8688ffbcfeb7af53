package com.example.careaccess.consent.controller;

import com.example.careaccess.consent.model.Consent;
import com.example.careaccess.consent.model.request.GrantConsentRequest;
import com.example.careaccess.consent.service.ConsentService;
import com.example.careaccess.security.context.CallerContextHolder;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/consents")
@RequiredArgsConstructor
public class ConsentController {

    private final ConsentService consentService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<Consent> grant(@Valid @RequestBody GrantConsentRequest request) {
        return CallerContextHolder.getContext()
                .doOnNext(caller -> log.debug("POST /consents - user: {}, purpose: {}",
                        caller.userId(), request.purpose()))
                .flatMap(caller -> consentService.grant(caller, request));
    }

    @DeleteMapping("/{consentId}")
    public Mono<Consent> revoke(
            @PathVariable String consentId,
            @RequestParam(required = false) String reason) {
        return CallerContextHolder.getContext()
                .flatMap(caller -> consentService.revoke(caller, consentId, reason));
    }

    @GetMapping("/patient/{patientId}")
    public Flux<Consent> listForPatient(
            @PathVariable String patientId,
            @RequestParam(defaultValue = "true") boolean activeOnly) {
        return CallerContextHolder.getContext()
                .flatMapMany(caller -> consentService.listForPatient(caller, patientId, activeOnly));
    }
}
