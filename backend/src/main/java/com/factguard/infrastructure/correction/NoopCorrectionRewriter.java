package com.factguard.infrastructure.correction;

import com.factguard.domain.correction.service.CorrectionRewriter;
import com.factguard.domain.validation.model.Violation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
@Profile("!llm-correction")
@Slf4j
public class NoopCorrectionRewriter implements CorrectionRewriter {

    @Override
    public Optional<String> rewrite(String draft, List<Violation> violations, String query) {
        log.debug("Generative correction disabled, keeping deterministic draft ({} violations)", violations.size());
        return Optional.empty();
    }
}
