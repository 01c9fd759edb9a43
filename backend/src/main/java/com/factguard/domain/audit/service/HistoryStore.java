package com.factguard.domain.audit.service;

import java.util.List;

/**
 * Prior responses given to similar queries, newest first.
 */
public interface HistoryStore {

    /**
     * @param organizationId   organization that owns the history
     * @param queryFingerprint fingerprint of the normalized query
     * @param limit            maximum number of responses
     * @return up to {@code limit} prior response texts, newest first
     */
    List<String> recentResponses(String organizationId, String queryFingerprint, int limit);
}
