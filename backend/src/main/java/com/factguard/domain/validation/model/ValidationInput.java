package com.factguard.domain.validation.model;

/**
 * Input of one validation run.
 *
 * @param query          the user question that produced the response
 * @param responseText   the AI response to validate
 * @param organizationId organization whose rules and policies apply
 * @param aiModel        model that generated the response
 * @param sessionId      optional conversation id
 * @param industry       optional industry used to select industry-specific rules
 */
public record ValidationInput(
        String query,
        String responseText,
        String organizationId,
        String aiModel,
        String sessionId,
        String industry
) {
}
