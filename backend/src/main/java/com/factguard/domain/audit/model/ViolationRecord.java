package com.factguard.domain.audit.model;

import com.factguard.domain.validation.model.Severity;
import com.factguard.domain.validation.model.Violation;
import com.factguard.domain.validation.model.ViolationOrigin;
import com.factguard.domain.validation.model.ViolationType;
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
@Table(name = "violations")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ViolationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private UUID interactionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ViolationType violationType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Severity severity;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ViolationOrigin.Kind originKind;

    @Column(columnDefinition = "TEXT")
    private String originReference;

    @Column(columnDefinition = "TEXT")
    private String matchedText;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public ViolationRecord(UUID interactionId, Violation violation) {
        this.interactionId = interactionId;
        this.violationType = violation.type();
        this.severity = violation.severity();
        this.description = violation.description();
        this.originKind = violation.origin().kind();
        this.originReference = violation.origin().reference();
        this.matchedText = violation.matchedText();
        this.createdAt = LocalDateTime.now();
    }

    public Violation toViolation() {
        return new Violation(violationType, severity, description,
                new ViolationOrigin(originKind, originReference), matchedText, null);
    }
}
