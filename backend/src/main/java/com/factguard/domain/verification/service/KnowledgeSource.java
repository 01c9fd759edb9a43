package com.factguard.domain.verification.service;

import com.factguard.domain.verification.model.KnowledgeDocument;
import com.factguard.domain.verification.model.SourceTier;

import java.util.List;

/**
 * External knowledge lookup used to verify claims.
 */
public interface KnowledgeSource {

    /** Short identifier stored with verification results, e.g. "wikipedia". */
    String name();

    SourceTier tier();

    /** False when the source is not configured (missing API key, disabled). */
    boolean isAvailable();

    /**
     * Look up documents for a search term. An empty list means the source answered
     * but found nothing.
     *
     * @throws SourceUnavailableException on timeout, network or HTTP errors
     */
    List<KnowledgeDocument> lookup(String searchTerm);
}
