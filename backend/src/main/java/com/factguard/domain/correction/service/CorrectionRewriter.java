package com.factguard.domain.correction.service;

import com.factguard.domain.validation.model.Violation;

import java.util.List;
import java.util.Optional;

/**
 * Optional generative pass over a deterministically corrected draft.
 */
public interface CorrectionRewriter {

    /**
     * @param draft      deterministic correction of the response
     * @param violations violations the draft was corrected for
     * @param query      the original user query
     * @return rewritten text, or empty when no rewrite was produced
     * @throws CorrectionRewriteException when the generative service fails
     */
    Optional<String> rewrite(String draft, List<Violation> violations, String query);
}
