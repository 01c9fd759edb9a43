package com.factguard.interfaces.api.dto;

import com.factguard.application.audit.AuditStats;

import java.util.Map;

public record AuditStatsResponse(
        long totalInteractions,
        Map<String, Long> byStatus,
        Map<String, Long> violationsByType,
        Map<String, Long> violationsBySeverity,
        Map<String, Long> byModel,
        double averageConfidence
) {
    public static AuditStatsResponse from(AuditStats stats) {
        return new AuditStatsResponse(
                stats.totalInteractions(),
                stats.byStatus(),
                stats.violationsByType(),
                stats.violationsBySeverity(),
                stats.byModel(),
                Math.round(stats.averageConfidence() * 1000.0) / 1000.0);
    }
}
