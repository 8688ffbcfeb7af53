package com.example.careaccess.relationship.client;

import com.example.careaccess.common.exception.BackendUnavailableException;
import com.example.careaccess.common.util.StringSanitizer;
import com.example.careaccess.config.properties.RelationshipProperties;
import com.example.careaccess.relationship.service.CareAssignmentDirectory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Care-assignment lookups against the remote relationship service.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.relationship.type", havingValue = "remote")
public class RelationshipServiceClient implements CareAssignmentDirectory {

    private static final String SERVICE_NAME = "RelationshipService";

    private final WebClient webClient;
    private final Duration timeout;

    public RelationshipServiceClient(WebClient.Builder webClientBuilder, RelationshipProperties properties) {
        if (properties.baseUrl() == null || properties.baseUrl().isBlank()) {
            throw new IllegalStateException("app.relationship.base-url is required when app.relationship.type=remote");
        }
        this.webClient = webClientBuilder.baseUrl(properties.baseUrl()).build();
        this.timeout = properties.timeout();
    }

    @Override
    public Mono<Boolean> hasActiveAssignment(@NonNull String actorId, @NonNull String subjectId) {
        return webClient.get()
                .uri(uri -> uri.path("/api/v1/assignments/active")
                        .queryParam("actorId", actorId)
                        .queryParam("subjectId", subjectId)
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(),
                        response -> response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new BackendUnavailableException(
                                        SERVICE_NAME,
                                        "Relationship service returned " + response.statusCode().value()))))
                .bodyToMono(AssignmentResponse.class)
                .timeout(timeout)
                .map(response -> Boolean.TRUE.equals(response.getActive()))
                .defaultIfEmpty(false)
                .onErrorMap(e -> !(e instanceof BackendUnavailableException),
                        e -> new BackendUnavailableException(SERVICE_NAME, "Relationship lookup failed", e))
                .doOnError(e -> log.error("Assignment lookup failed for actor={}, subject={}: {}",
                        StringSanitizer.forLog(actorId), StringSanitizer.forLog(subjectId), e.getMessage()));
    }

    @Data
    public static class AssignmentResponse {
        private Boolean active;
    }
}
