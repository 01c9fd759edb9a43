package com.factguard.infrastructure.consistency;

import com.factguard.domain.audit.model.Interaction;
import com.factguard.domain.audit.repository.InteractionRepository;
import com.factguard.domain.audit.service.HistoryStore;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Component
@RequiredArgsConstructor
public class JpaHistoryStore implements HistoryStore {

    private final InteractionRepository interactionRepository;

    @Override
    @Transactional(readOnly = true)
    public List<String> recentResponses(String organizationId, String queryFingerprint, int limit) {
        return interactionRepository
                .findByOrganizationIdAndQueryFingerprintOrderByCreatedAtDesc(
                        organizationId, queryFingerprint, PageRequest.of(0, limit))
                .stream()
                .map(Interaction::getResponse)
                .toList();
    }
}
