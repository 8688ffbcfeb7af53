package com.example.careaccess.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration for break-glass emergency access monitoring.
 */
@ConfigurationProperties(prefix = "app.emergency")
public record EmergencyAccessProperties(
        Integer minJustificationLength,
        Integer maxConcurrentSessions,
        Integer suspiciousAccessThreshold,
        Duration suspiciousAccessWindow,
        Long sweepIntervalMs
) {
    public EmergencyAccessProperties {
        if (minJustificationLength == null || minJustificationLength < 1) {
            minJustificationLength = 20;
        }
        if (maxConcurrentSessions == null || maxConcurrentSessions < 1) {
            maxConcurrentSessions = 3;
        }
        if (suspiciousAccessThreshold == null || suspiciousAccessThreshold < 1) {
            suspiciousAccessThreshold = 2;
        }
        if (suspiciousAccessWindow == null) {
            suspiciousAccessWindow = Duration.ofHours(1);
        }
        if (sweepIntervalMs == null || sweepIntervalMs < 1000) {
            sweepIntervalMs = 300_000L;
        }
    }

    public static EmergencyAccessProperties defaults() {
        return new EmergencyAccessProperties(null, null, null, null, null);
    }
}
