package com.factguard.application.audit;

import java.util.Map;

/**
 * Aggregates over one organization's interactions in a time window.
 */
public record AuditStats(
        long totalInteractions,
        Map<String, Long> byStatus,
        Map<String, Long> violationsByType,
        Map<String, Long> violationsBySeverity,
        Map<String, Long> byModel,
        double averageConfidence
) {
}
