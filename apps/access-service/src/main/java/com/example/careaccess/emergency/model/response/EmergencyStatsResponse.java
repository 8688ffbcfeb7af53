package com.example.careaccess.emergency.model.response;

import java.util.Map;

/**
 * Counters since service start.
 */
public record EmergencyStatsResponse(
        int activeSessions,
        long totalRequests,
        long rejectedRequests,
        int totalAlerts,
        int unresolvedAlerts,
        Map<String, Long> levelDistribution,
        Map<String, Long> accessTypeDistribution
) {
}
