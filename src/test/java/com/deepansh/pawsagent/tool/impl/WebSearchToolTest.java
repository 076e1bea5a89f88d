package com.deepansh.pawsagent.tool.impl;

import com.deepansh.pawsagent.config.ToolProperties;
import com.deepansh.pawsagent.exception.TransientExternalException;
import com.deepansh.pawsagent.tool.ToolContext;
import com.deepansh.pawsagent.tool.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WebSearchToolTest {

    private static final ToolContext CONTEXT = new ToolContext("req-1", "+5491100000000", "SM1");

    private ToolProperties props;
    private MockRestServiceServer server;
    private WebSearchTool tool;

    @BeforeEach
    void setUp() {
        props = new ToolProperties();
        props.getWebSearch().getTavily().setApiKey("tvly-test");
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        tool = new WebSearchTool(props, new ObjectMapper(), builder);
    }

    @Test
    void getName_returnsWebSearch() {
        assertThat(tool.getName()).isEqualTo("web_search");
        assertThat(tool.getInputSchema().get("required").toString()).contains("query");
    }

    @Test
    void isEnabled_onlyWithApiKey() {
        assertThat(tool.isEnabled()).isTrue();

        props.getWebSearch().getTavily().setApiKey("");

        assertThat(tool.isEnabled()).isFalse();
    }

    @Test
    void execute_mapsAndDeduplicatesResults() {
        server.expect(requestTo("https://api.tavily.com/search"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer tvly-test"))
                .andExpect(jsonPath("$.query").value("site:avma.org vacunas gatos"))
                .andExpect(jsonPath("$.max_results").value(3))
                .andRespond(withSuccess("""
                        {"results": [
                          {"title": "Vacunas felinas", "url": "https://avma.org/a", "content": "Calendario...", "score": 0.9},
                          {"title": "Duplicado", "url": "https://avma.org/a", "content": "..."},
                          {"url": "https://avma.org/b", "content": "Refuerzos", "published_date": "2024-03-01"}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        ToolResult result = tool.execute(input("vacunas gatos", 3, "avma.org"), CONTEXT);

        server.verify();
        assertThat(result.ok()).isTrue();
        Map<String, Object> data = data(result);
        assertThat(data).containsEntry("count", 2).containsEntry("query", "vacunas gatos");
        List<Map<String, Object>> results = results(data);
        assertThat(results.get(0)).containsEntry("title", "Vacunas felinas").containsEntry("score", 0.9);
        assertThat(results.get(1)).containsEntry("title", "No title").containsEntry("published", "2024-03-01");
    }

    @Test
    void execute_clientError_returnsFailure() {
        server.expect(requestTo("https://api.tavily.com/search"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        ToolResult result = tool.execute(input("vacunas", null, null), CONTEXT);

        assertThat(result.ok()).isFalse();
        assertThat(result.error()).startsWith("Web search failed");
    }

    @Test
    void execute_rateLimited_throwsTransient() {
        server.expect(requestTo("https://api.tavily.com/search"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> tool.execute(input("vacunas", null, null), CONTEXT))
                .isInstanceOf(TransientExternalException.class);
    }

    @Test
    void execute_serverError_throwsTransient() {
        server.expect(requestTo("https://api.tavily.com/search"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> tool.execute(input("vacunas", null, null), CONTEXT))
                .isInstanceOf(TransientExternalException.class);
    }

    @Test
    void buildRequestBody_defaultsAndRecency() {
        WebSearchTool.Input input = input("pulgas", null, null);
        input.setRecencyDays(7);

        Map<String, Object> body = tool.buildRequestBody(input);

        assertThat(body)
                .containsEntry("query", "pulgas")
                .containsEntry("max_results", 5)
                .containsKey("published_after");
    }

    private static WebSearchTool.Input input(String query, Integer n, String site) {
        WebSearchTool.Input input = new WebSearchTool.Input();
        input.setQuery(query);
        input.setN(n);
        input.setSite(site);
        return input;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> data(ToolResult result) {
        return (Map<String, Object>) result.data();
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> results(Map<String, Object> data) {
        return (List<Map<String, Object>>) data.get("results");
    }
}
