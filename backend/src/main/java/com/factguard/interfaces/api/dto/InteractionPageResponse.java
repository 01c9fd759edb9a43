package com.factguard.interfaces.api.dto;

import com.factguard.domain.audit.model.Interaction;
import org.springframework.data.domain.Page;

import java.util.List;

public record InteractionPageResponse(
        List<InteractionSummaryResponse> items,
        int page,
        int size,
        long totalElements,
        int totalPages
) {
    public static InteractionPageResponse from(Page<Interaction> page) {
        return new InteractionPageResponse(
                page.getContent().stream().map(InteractionSummaryResponse::from).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages());
    }
}
