package com.factguard.infrastructure.extraction;

import com.factguard.domain.validation.model.Claim;
import com.factguard.domain.validation.model.ClaimKind;
import com.factguard.infrastructure.preprocessing.SentenceSplitter;
import com.factguard.infrastructure.preprocessing.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClaimExtractorTest {

    private ClaimExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new ClaimExtractor(new TextNormalizer(), new SentenceSplitter());
        ReflectionTestUtils.setField(extractor, "minSentenceLength", 10);
        ReflectionTestUtils.setField(extractor, "maxClaims", 10);
    }

    @Nested
    @DisplayName("Claim selection")
    class Selection {

        @Test
        @DisplayName("General statements yield no claims")
        void general_statements_dropped() {
            List<Claim> claims = extractor.extract(
                    "Python is a programming language known for its simplicity. It is widely used in web development.");

            assertThat(claims).isEmpty();
        }

        @Test
        @DisplayName("Sentences with a date, entity and specific fact are kept")
        void concrete_sentence_kept() {
            List<Claim> claims = extractor.extract("Python was created by Guido van Rossum in 1991.");

            assertThat(claims).hasSize(1);
            Claim claim = claims.get(0);
            assertThat(claim.text()).isEqualTo("Python was created by Guido van Rossum in 1991.");
            assertThat(claim.hasDate()).isTrue();
            assertThat(claim.hasEntity()).isTrue();
            assertThat(claim.hasSpecificFact()).isTrue();
        }

        @Test
        @DisplayName("Opinions are dropped even with numbers")
        void opinions_dropped() {
            assertThat(extractor.extract("I think Python 3 is the best language ever made.")).isEmpty();
        }

        @Test
        @DisplayName("Fragments shorter than the minimum length are dropped")
        void short_fragments_dropped() {
            assertThat(extractor.extract("In 2020.")).isEmpty();
        }

        @Test
        @DisplayName("Duplicate sentences yield one claim")
        void duplicates_removed() {
            List<Claim> claims = extractor.extract("Python was created in 1991. Python was created in 1991!");

            assertThat(claims).hasSize(1);
        }

        @Test
        @DisplayName("Extraction stops at the claim limit")
        void claim_limit() {
            ReflectionTestUtils.setField(extractor, "maxClaims", 2);

            List<Claim> claims = extractor.extract(
                    "Java was released in 1995. Rust was released in 2015. Go was released in 2009.");

            assertThat(claims).extracting(Claim::text)
                    .containsExactly("Java was released in 1995.", "Rust was released in 2015.");
        }

        @Test
        @DisplayName("Blank input yields no claims")
        void blank_input() {
            assertThat(extractor.extract(null)).isEmpty();
            assertThat(extractor.extract(" ")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Claim kind")
    class Kind {

        @Test
        @DisplayName("Money terms make a financial claim")
        void financial() {
            assertThat(extractor.toClaim("Apple reported revenue of $394 billion in 2022.").kind())
                    .isEqualTo(ClaimKind.FINANCIAL);
        }

        @Test
        @DisplayName("Percentages make a statistical claim")
        void statistical() {
            assertThat(extractor.toClaim("About 45% of adults exercise every week.").kind())
                    .isEqualTo(ClaimKind.STATISTICAL);
        }

        @Test
        @DisplayName("Regulation names make a regulatory claim")
        void regulatory() {
            assertThat(extractor.toClaim("The GDPR took effect across Europe in May 2018.").kind())
                    .isEqualTo(ClaimKind.REGULATORY);
        }

        @Test
        @DisplayName("A year without other numbers makes a temporal claim")
        void temporal() {
            assertThat(extractor.toClaim("Python was created by Guido van Rossum in 1991.").kind())
                    .isEqualTo(ClaimKind.TEMPORAL);
        }

        @Test
        @DisplayName("Entities without numbers make a general claim")
        void general() {
            assertThat(extractor.toClaim("The Eiffel Tower stands in central Paris.").kind())
                    .isEqualTo(ClaimKind.GENERAL);
        }
    }
}
