package com.factguard.domain.audit.model;

import com.factguard.domain.validation.model.ValidationStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One validated AI response. Root of the audit trail.
 */
@Entity
@Table(name = "ai_interactions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Interaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 64)
    private String organizationId;

    @Column(name = "query_text", nullable = false, columnDefinition = "TEXT")
    private String query;

    @Column(name = "response_text", nullable = false, columnDefinition = "TEXT")
    private String response;

    @Column(columnDefinition = "TEXT")
    private String validatedResponse;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ValidationStatus status;

    @Column(nullable = false)
    private double confidenceScore;

    @Column(nullable = false, length = 100)
    private String aiModel;

    @Column(length = 100)
    private String sessionId;

    @Column(nullable = false, length = 64)
    private String queryFingerprint;

    @Column(columnDefinition = "TEXT")
    private String explanation;

    @Column(nullable = false)
    private long processingTimeMs;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Builder
    public Interaction(String organizationId, String query, String response, String validatedResponse,
                       ValidationStatus status, double confidenceScore, String aiModel, String sessionId,
                       String queryFingerprint, String explanation, long processingTimeMs) {
        this.organizationId = organizationId;
        this.query = query;
        this.response = response;
        this.validatedResponse = validatedResponse;
        this.status = status;
        this.confidenceScore = confidenceScore;
        this.aiModel = aiModel;
        this.sessionId = sessionId;
        this.queryFingerprint = queryFingerprint;
        this.explanation = explanation;
        this.processingTimeMs = processingTimeMs;
        this.createdAt = LocalDateTime.now();
    }
}
