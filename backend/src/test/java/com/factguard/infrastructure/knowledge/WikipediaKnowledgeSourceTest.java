package com.factguard.infrastructure.knowledge;

import com.factguard.domain.verification.model.KnowledgeDocument;
import com.factguard.domain.verification.service.SourceUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WikipediaKnowledgeSourceTest {

    private static final String SUMMARY_URL = "https://en.wikipedia.org/api/rest_v1/page/summary/Guido_van_Rossum";
    private static final String SEARCH_URL = "https://en.wikipedia.org/w/rest.php/v1/search/page?q=Guido+van+Rossum&limit=5";

    private MockRestServiceServer server;
    private WikipediaKnowledgeSource source;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        source = new WikipediaKnowledgeSource(builder.build(), new ObjectMapper(), "https://en.wikipedia.org", true, 5);
    }

    @Test
    @DisplayName("Page summary becomes a single summary document")
    void summary_found() {
        server.expect(requestTo(SUMMARY_URL))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("User-Agent", AbstractHttpKnowledgeSource.USER_AGENT))
                .andRespond(withSuccess("""
                        {
                          "type": "standard",
                          "title": "Guido van Rossum",
                          "description": "Dutch programmer",
                          "extract": "Guido van Rossum is a Dutch programmer best known as the creator of Python.",
                          "content_urls": {"desktop": {"page": "https://en.wikipedia.org/wiki/Guido_van_Rossum"}}
                        }
                        """, MediaType.APPLICATION_JSON));

        List<KnowledgeDocument> documents = source.lookup("Guido van Rossum");

        assertThat(documents).containsExactly(new KnowledgeDocument(
                "Guido van Rossum",
                "Dutch programmer. Guido van Rossum is a Dutch programmer best known as the creator of Python.",
                "https://en.wikipedia.org/wiki/Guido_van_Rossum",
                "summary"));
        server.verify();
    }

    @Test
    @DisplayName("Missing page falls back to full-text search")
    void search_fallback() {
        server.expect(requestTo(SUMMARY_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo(SEARCH_URL))
                .andRespond(withSuccess("""
                        {"pages": [
                          {"key": "Guido_van_Rossum", "title": "Guido van Rossum", "description": "Dutch programmer",
                           "excerpt": "<span class=\\"searchmatch\\">Guido</span> van Rossum created Python"},
                          {"key": "", "title": "", "excerpt": "ignored"}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        List<KnowledgeDocument> documents = source.lookup("Guido van Rossum");

        assertThat(documents).hasSize(1);
        assertThat(documents.get(0).summary()).isEqualTo("Dutch programmer. Guido van Rossum created Python");
        assertThat(documents.get(0).url()).isEqualTo("https://en.wikipedia.org/wiki/Guido_van_Rossum");
        assertThat(documents.get(0).method()).isEqualTo("search");
        server.verify();
    }

    @Test
    @DisplayName("Disambiguation pages are skipped in favor of search")
    void disambiguation_skipped() {
        server.expect(requestTo(SUMMARY_URL))
                .andRespond(withSuccess("""
                        {"type": "disambiguation", "title": "Guido van Rossum", "extract": "may refer to"}
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(SEARCH_URL)).andRespond(withSuccess("{\"pages\": []}", MediaType.APPLICATION_JSON));

        assertThat(source.lookup("Guido van Rossum")).isEmpty();
        server.verify();
    }

    @Test
    @DisplayName("Server errors make the source unavailable")
    void server_error() {
        server.expect(requestTo(SUMMARY_URL)).andRespond(withServerError());

        assertThatThrownBy(() -> source.lookup("Guido van Rossum"))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    @DisplayName("Rate limiting makes the source unavailable")
    void rate_limited() {
        server.expect(requestTo(SUMMARY_URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> source.lookup("Guido van Rossum"))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("rate limited");
    }

    @Test
    @DisplayName("Disabled source reports unavailable")
    void disabled() {
        WikipediaKnowledgeSource disabled = new WikipediaKnowledgeSource(
                RestClient.create(), new ObjectMapper(), "https://en.wikipedia.org", false, 5);

        assertThat(disabled.isAvailable()).isFalse();
    }
}
