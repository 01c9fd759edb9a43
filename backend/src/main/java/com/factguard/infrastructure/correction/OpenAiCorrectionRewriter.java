package com.factguard.infrastructure.correction;

import com.factguard.domain.correction.service.CorrectionRewriteException;
import com.factguard.domain.correction.service.CorrectionRewriter;
import com.factguard.domain.validation.model.Violation;
import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Final natural-language pass over the deterministic correction, using an OpenAI chat model.
 * Active only with the {@code llm-correction} profile.
 */
@Slf4j
@Service
@Profile("llm-correction")
@RequiredArgsConstructor
public class OpenAiCorrectionRewriter implements CorrectionRewriter {

    static final String SYSTEM_PROMPT = """
            You are a compliance assistant that corrects AI responses to fix violations.
            Keep the original intent and helpfulness. Keep every disclaimer already present in the draft.
            Never add facts, figures, dates or promises that are not in the draft.
            Return only the corrected response text.""";

    private final OpenAIClient openAIClient;

    @Value("${openai.model:gpt-4o-mini}")
    private String model;

    @Value("${openai.temperature:0.3}")
    private double temperature;

    @Value("${openai.max-tokens:500}")
    private int maxTokens;

    @Override
    public Optional<String> rewrite(String draft, List<Violation> violations, String query) {
        log.info("Generative correction - model: {}, violations: {}, draftLength: {}", model, violations.size(), draft.length());

        try {
            ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                    .model(model)
                    .temperature(temperature)
                    .maxCompletionTokens(maxTokens)
                    .addSystemMessage(SYSTEM_PROMPT)
                    .addUserMessage(buildUserMessage(draft, violations, query))
                    .build();

            ChatCompletion completion = openAIClient.chat().completions().create(params);

            completion.usage().ifPresent(usage ->
                    log.info("Token usage - prompt: {}, completion: {}, total: {}",
                            usage.promptTokens(), usage.completionTokens(), usage.totalTokens()));

            return completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .map(String::trim)
                    .filter(content -> !content.isEmpty());
        } catch (Exception e) {
            log.error("OpenAI correction call failed", e);
            throw new CorrectionRewriteException("Generative correction failed", e);
        }
    }

    String buildUserMessage(String draft, List<Violation> violations, String query) {
        String violationSummary = violations.stream()
                .map(v -> "- [" + v.severity().value() + "] " + v.description())
                .collect(Collectors.joining("\n"));

        return """
                Original query: %s

                Corrected draft:
                %s

                Violations to address:
                %s

                Rewrite the draft so it reads naturally and addresses every violation.""".formatted(query, draft, violationSummary);
    }
}
