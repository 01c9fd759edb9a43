package com.factguard.domain.audit.model;

import com.factguard.domain.validation.model.VerificationResult;
import com.factguard.domain.validation.model.VerificationStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "verification_results")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class VerificationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private UUID interactionId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String claimText;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private VerificationStatus status;

    @Column(nullable = false)
    private double confidence;

    @Column(length = 50)
    private String source;

    @Column(columnDefinition = "TEXT")
    private String details;

    @Column(length = 2048)
    private String url;

    @Column(length = 30)
    private String method;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public VerificationRecord(UUID interactionId, VerificationResult result) {
        this.interactionId = interactionId;
        this.claimText = result.claim();
        this.status = result.status();
        this.confidence = result.confidence();
        this.source = result.source();
        this.details = result.details();
        this.url = result.url();
        this.method = result.method();
        this.createdAt = LocalDateTime.now();
    }

    public VerificationResult toResult() {
        return new VerificationResult(claimText, status, confidence, source, details, url, method);
    }
}
