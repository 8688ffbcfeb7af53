package com.example.careaccess.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Care-assignment directory configuration. {@code type} selects the in-process directory
 * ({@code memory}, the default) or the remote relationship service ({@code remote}).
 */
@ConfigurationProperties(prefix = "app.relationship")
public record RelationshipProperties(
        String type,
        String baseUrl,
        Duration timeout,
        List<Assignment> assignments
) {
    /**
     * Seed assignment for the in-memory directory.
     */
    public record Assignment(String actorId, String subjectId) {
    }

    public RelationshipProperties {
        if (type == null || type.isBlank()) {
            type = "memory";
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(2);
        }
        if (assignments == null) {
            assignments = List.of();
        }
    }
}
