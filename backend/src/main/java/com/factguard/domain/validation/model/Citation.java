package com.factguard.domain.validation.model;

/**
 * A URL cited in the response and the outcome of checking it.
 *
 * @param url          the cited URL, trailing punctuation removed
 * @param valid        the URL answered with HTTP 200
 * @param contentMatch the page text overlaps with the citing sentence
 * @param httpStatus   status code returned (nullable when the request failed)
 * @param errorMessage why the URL is invalid (nullable)
 */
public record Citation(
        String url,
        boolean valid,
        boolean contentMatch,
        Integer httpStatus,
        String errorMessage
) {
}
