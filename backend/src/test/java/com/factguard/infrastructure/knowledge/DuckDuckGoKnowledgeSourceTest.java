package com.factguard.infrastructure.knowledge;

import com.factguard.domain.verification.model.KnowledgeDocument;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DuckDuckGoKnowledgeSourceTest {

    @Test
    @DisplayName("Abstract and related topics become instant-answer documents")
    void instant_answer_mapped() {
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        DuckDuckGoKnowledgeSource source = new DuckDuckGoKnowledgeSource(
                builder.build(), new ObjectMapper(), "https://api.duckduckgo.com/", true);

        server.expect(requestTo("https://api.duckduckgo.com/?q=Eiffel+Tower&format=json&no_html=1&skip_disambig=1"))
                .andRespond(withSuccess("""
                        {
                          "Heading": "Eiffel Tower",
                          "AbstractText": "The Eiffel Tower is a wrought-iron lattice tower in Paris.",
                          "AbstractURL": "https://en.wikipedia.org/wiki/Eiffel_Tower",
                          "Answer": "",
                          "RelatedTopics": [
                            {"Text": "Gustave Eiffel - French civil engineer", "FirstURL": "https://duckduckgo.com/Gustave_Eiffel"},
                            {"Name": "See also", "Topics": []}
                          ]
                        }
                        """, MediaType.APPLICATION_JSON));

        List<KnowledgeDocument> documents = source.lookup("Eiffel Tower");

        assertThat(documents).extracting(KnowledgeDocument::title).containsExactly("Eiffel Tower", "Gustave Eiffel");
        assertThat(documents.get(0).url()).isEqualTo("https://en.wikipedia.org/wiki/Eiffel_Tower");
        assertThat(documents).extracting(KnowledgeDocument::method).containsOnly("instant-answer");
        server.verify();
    }
}
