package com.factguard.domain.validation.model;

import java.util.List;

/**
 * Corrected response text plus the change log.
 *
 * @param correctedText    final text after deterministic rewrites and the optional model pass
 * @param changes          deterministic changes applied, in order
 * @param rewrittenByModel true if the generative rewriter produced the final text
 */
public record CorrectionResult(
        String correctedText,
        List<CorrectionChange> changes,
        boolean rewrittenByModel
) {

    public static CorrectionResult unchanged(String text) {
        return new CorrectionResult(text, List.of(), false);
    }

    public boolean changed(String original) {
        return correctedText != null && !correctedText.equals(original);
    }
}
