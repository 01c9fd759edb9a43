package com.factguard.interfaces.api.dto;

import com.factguard.domain.audit.model.ViolationRecord;
import org.springframework.data.domain.Page;

import java.util.List;

public record ViolationPageResponse(
        List<ViolationSummaryResponse> items,
        int page,
        int size,
        long totalElements,
        int totalPages
) {
    public static ViolationPageResponse from(Page<ViolationRecord> page) {
        return new ViolationPageResponse(
                page.getContent().stream().map(ViolationSummaryResponse::from).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages());
    }
}
