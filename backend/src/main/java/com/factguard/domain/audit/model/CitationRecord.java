package com.factguard.domain.audit.model;

import com.factguard.domain.validation.model.Citation;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
@Table(name = "citations")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CitationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private UUID interactionId;

    @Column(nullable = false, length = 2048)
    private String url;

    @Column(nullable = false)
    private boolean valid;

    @Column(nullable = false)
    private boolean contentMatch;

    private Integer httpStatus;

    @Column(length = 500)
    private String errorMessage;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public CitationRecord(UUID interactionId, Citation citation) {
        this.interactionId = interactionId;
        this.url = citation.url();
        this.valid = citation.valid();
        this.contentMatch = citation.contentMatch();
        this.httpStatus = citation.httpStatus();
        this.errorMessage = truncate(citation.errorMessage());
        this.createdAt = LocalDateTime.now();
    }

    private static String truncate(String message) {
        return message != null && message.length() > 500 ? message.substring(0, 500) : message;
    }

    public Citation toCitation() {
        return new Citation(url, valid, contentMatch, httpStatus, errorMessage);
    }
}
