package com.factguard.interfaces.api.audit;

import com.factguard.application.audit.AuditQueryService;
import com.factguard.application.audit.InteractionFilter;
import com.factguard.application.audit.ViolationFilter;
import com.factguard.domain.validation.model.Severity;
import com.factguard.domain.validation.model.ValidationStatus;
import com.factguard.domain.validation.model.ViolationType;
import com.factguard.interfaces.api.dto.AuditStatsResponse;
import com.factguard.interfaces.api.dto.AuditTrailResponse;
import com.factguard.interfaces.api.dto.InteractionPageResponse;
import com.factguard.interfaces.api.dto.ViolationPageResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/audit")
@RequiredArgsConstructor
public class AuditController {

    private static final int MAX_PAGE_SIZE = 100;

    private final AuditQueryService auditQueryService;

    @GetMapping("/interactions/{id}")
    public ResponseEntity<AuditTrailResponse> getInteraction(@PathVariable UUID id) {
        return ResponseEntity.ok(AuditTrailResponse.from(auditQueryService.getTrail(id)));
    }

    @GetMapping("/interactions")
    public ResponseEntity<InteractionPageResponse> listInteractions(
            @RequestParam(required = false) String organizationId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String aiModel,
            @RequestParam(required = false) String sessionId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        InteractionFilter filter = new InteractionFilter(
                organizationId,
                status != null ? ValidationStatus.fromValue(status) : null,
                aiModel, sessionId, from, to);

        return ResponseEntity.ok(InteractionPageResponse.from(auditQueryService.list(filter, newestFirst(page, size))));
    }

    @GetMapping("/violations")
    public ResponseEntity<ViolationPageResponse> listViolations(
            @RequestParam(required = false) String organizationId,
            @RequestParam(required = false) UUID interactionId,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        ViolationFilter filter = new ViolationFilter(
                organizationId,
                interactionId,
                type != null ? ViolationType.fromValue(type) : null,
                severity != null ? Severity.fromValue(severity) : null,
                from, to);

        return ResponseEntity.ok(ViolationPageResponse.from(auditQueryService.listViolations(filter, newestFirst(page, size))));
    }

    @GetMapping("/stats")
    public ResponseEntity<AuditStatsResponse> getStats(
            @RequestParam String organizationId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        return ResponseEntity.ok(AuditStatsResponse.from(auditQueryService.stats(organizationId, from, to)));
    }

    private PageRequest newestFirst(int page, int size) {
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE);
        }
        return PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt"));
    }
}
