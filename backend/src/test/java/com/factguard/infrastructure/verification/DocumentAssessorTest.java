package com.factguard.infrastructure.verification;

import com.factguard.domain.validation.model.Claim;
import com.factguard.domain.validation.model.ClaimKind;
import com.factguard.domain.validation.model.VerificationResult;
import com.factguard.domain.validation.model.VerificationStatus;
import com.factguard.domain.verification.model.KnowledgeDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentAssessorTest {

    private static final KnowledgeDocument PYTHON_LANGUAGE = new KnowledgeDocument(
            "Python (programming language)",
            "Python is a high-level programming language created by Guido van Rossum and first released in 1991. "
                    + "Its design emphasizes code readability.",
            "https://en.wikipedia.org/wiki/Python_(programming_language)",
            "summary");

    private static final KnowledgeDocument PYTHON_GENUS = new KnowledgeDocument(
            "Python (genus)",
            "Python is a genus of constricting snakes native to the tropics of Africa and Asia.",
            "https://en.wikipedia.org/wiki/Python_(genus)",
            "summary");

    private DocumentAssessor assessor;

    @BeforeEach
    void setUp() {
        assessor = new DocumentAssessor(new TopicClassifier());
        ReflectionTestUtils.setField(assessor, "minOverlap", 0.2);
    }

    @Test
    @DisplayName("Calling the programming language a snake is false")
    void python_is_a_snake() {
        Claim claim = claim("Python is a snake.");

        VerificationResult result = assessor.assess(claim, "What is the Python programming language?",
                new SearchTerm("Python", "Python (programming language)"), "wikipedia", List.of(PYTHON_LANGUAGE));

        assertThat(result.status()).isEqualTo(VerificationStatus.FALSE);
        assertThat(result.confidence()).isEqualTo(0.9);
        assertThat(result.details()).contains("animal").contains("programming");
    }

    @Test
    @DisplayName("A document about another sense of the term is a context mismatch")
    void context_mismatch() {
        Claim claim = claim("Python was created in 1991.");

        VerificationResult result = assessor.assess(claim, "Which programming language should I learn first?",
                new SearchTerm("Python", "Python"), "wikipedia", List.of(PYTHON_GENUS));

        assertThat(result.status()).isEqualTo(VerificationStatus.FALSE);
        assertThat(result.details()).startsWith("Context mismatch");
    }

    @Test
    @DisplayName("A different year for the same event is a contradiction")
    void year_contradiction() {
        Claim claim = claim("Python was released in 1989.");

        VerificationResult result = assessor.assess(claim, null,
                new SearchTerm("Python", "Python"), "wikipedia", List.of(PYTHON_LANGUAGE));

        assertThat(result.status()).isEqualTo(VerificationStatus.FALSE);
        assertThat(result.confidence()).isEqualTo(0.75);
        assertThat(result.details()).contains("1989").contains("1991");
    }

    @Test
    @DisplayName("Enough word overlap verifies the claim")
    void overlap_verifies() {
        Claim claim = claim("Python was created by Guido van Rossum in 1991.");

        VerificationResult result = assessor.assess(claim, null,
                new SearchTerm("Python", "Python"), "wikipedia", List.of(PYTHON_LANGUAGE));

        assertThat(result.status()).isEqualTo(VerificationStatus.VERIFIED);
        assertThat(result.confidence()).isEqualTo(0.85);
        assertThat(result.url()).isEqualTo(PYTHON_LANGUAGE.url());
        assertThat(result.method()).isEqualTo("summary");
    }

    @Test
    @DisplayName("Overlap alone never makes a claim false")
    void low_overlap_unverified() {
        Claim claim = claim("Guido enjoys hiking near Amsterdam every summer.");

        VerificationResult result = assessor.assess(claim, null,
                new SearchTerm("Guido", "Guido"), "wikipedia", List.of(PYTHON_LANGUAGE));

        assertThat(result.status()).isEqualTo(VerificationStatus.UNVERIFIED);
    }

    @Test
    @DisplayName("No documents means unverified")
    void no_documents() {
        VerificationResult result = assessor.assess(claim("Python was created in 1991."), null,
                new SearchTerm("Python", "Python"), "wikipedia", List.of());

        assertThat(result.status()).isEqualTo(VerificationStatus.UNVERIFIED);
        assertThat(result.confidence()).isEqualTo(0.3);
        assertThat(result.details()).contains("No matching document");
    }

    private static Claim claim(String text) {
        return new Claim(text, ClaimKind.GENERAL, false, false, false, true);
    }
}
