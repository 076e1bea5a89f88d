package com.deepansh.pawsagent.tool.impl;

import com.deepansh.pawsagent.config.ToolProperties;
import com.deepansh.pawsagent.exception.TransientExternalException;
import com.deepansh.pawsagent.tool.ToolContext;
import com.deepansh.pawsagent.tool.ToolHandler;
import com.deepansh.pawsagent.tool.ToolPolicy;
import com.deepansh.pawsagent.tool.ToolResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Web search tool powered by the Tavily Search API.
 *
 * Only registered when TAVILY_API_KEY is set. Results are mapped to
 * {title, url, snippet, published, score} and de-duplicated by URL.
 *
 * Failure behavior:
 * - 4xx (bad key, bad query) → failed ToolResult, not retried
 * - 5xx / 429 / network → TransientExternalException, retried by the runner
 */
@Component
@Slf4j
public class WebSearchTool implements ToolHandler<WebSearchTool.Input> {

    private static final ToolPolicy POLICY = ToolPolicy.of(Duration.ofSeconds(15), 1, Duration.ofSeconds(2));

    private final ToolProperties toolProperties;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;
    private final Clock clock;

    public WebSearchTool(ToolProperties toolProperties, ObjectMapper objectMapper, RestClient.Builder restClientBuilder) {
        this.toolProperties = toolProperties;
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder.clone()
                .baseUrl(toolProperties.getWebSearch().getTavily().getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.clock = Clock.systemUTC();
    }

    @Data
    public static class Input {
        @NotBlank(message = "Query is required")
        private String query;

        @Min(1)
        @Max(10)
        private Integer n;

        @Min(1)
        private Integer recencyDays;

        private String site;
    }

    @Override
    public String getName() {
        return "web_search";
    }

    @Override
    public String getDescription() {
        return "Search the web for fresh or factual information like veterinary care, vaccination schedules, "
                + "medication recalls, symptom information, or current prices. Use ONLY when you need up-to-date "
                + "information that you cannot answer from your existing knowledge. Do NOT use for basic pet care "
                + "knowledge.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "query", Map.of(
                                "type", "string",
                                "description", "Search query focusing on current/factual information"),
                        "n", Map.of(
                                "type", "integer",
                                "minimum", 1,
                                "maximum", 10,
                                "default", 5,
                                "description", "Number of results to return (1-10)"),
                        "recencyDays", Map.of(
                                "type", "integer",
                                "minimum", 1,
                                "description", "Only return results from last N days"),
                        "site", Map.of(
                                "type", "string",
                                "description", "Restrict search to specific site (e.g., \"veterinary.org\")")
                ),
                "required", List.of("query"),
                "additionalProperties", false
        );
    }

    @Override
    public Class<Input> getInputType() {
        return Input.class;
    }

    @Override
    public Optional<ToolPolicy> getPolicy() {
        return Optional.of(POLICY);
    }

    @Override
    public boolean isEnabled() {
        return toolProperties.getWebSearch().isConfigured();
    }

    @Override
    public ToolResult execute(Input input, ToolContext context) {
        log.info("[{}] Web search: '{}'", context.requestId(), input.getQuery());

        String responseBody;
        try {
            responseBody = restClient.post()
                    .uri("/search")
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + toolProperties.getWebSearch().getTavily().getApiKey())
                    .body(buildRequestBody(input))
                    .retrieve()
                    .body(String.class);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == 429) {
                throw new TransientExternalException("Tavily rate limited", e);
            }
            log.warn("[{}] Tavily rejected search: {}", context.requestId(), e.getStatusCode());
            return ToolResult.failure("Web search failed: " + e.getStatusCode());
        } catch (HttpServerErrorException | ResourceAccessException e) {
            throw new TransientExternalException("Tavily unavailable: " + e.getMessage(), e);
        }

        List<Map<String, Object>> results;
        try {
            results = parseResults(responseBody);
        } catch (JsonProcessingException e) {
            log.warn("[{}] Unreadable Tavily response: {}", context.requestId(), e.getMessage());
            return ToolResult.failure("Web search failed: unreadable response");
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("query", input.getQuery());
        data.put("results", results);
        data.put("count", results.size());
        return ToolResult.success(data);
    }

    Map<String, Object> buildRequestBody(Input input) {
        Map<String, Object> body = new HashMap<>();
        String query = input.getQuery();
        if (input.getSite() != null && !input.getSite().isBlank()) {
            query = "site:" + input.getSite() + " " + query;
        }
        body.put("query", query);
        body.put("max_results", input.getN() != null
                ? input.getN()
                : toolProperties.getWebSearch().getTavily().getMaxResults());
        body.put("search_depth", "basic");
        body.put("include_answer", false);
        body.put("include_raw_content", false);
        if (input.getRecencyDays() != null) {
            body.put("published_after", LocalDate.now(clock).minusDays(input.getRecencyDays()).toString());
        }
        return body;
    }

    private List<Map<String, Object>> parseResults(String responseBody) throws JsonProcessingException {
        List<Map<String, Object>> hits = new ArrayList<>();
        if (responseBody == null || responseBody.isBlank()) {
            return hits;
        }
        JsonNode results = objectMapper.readTree(responseBody).path("results");
        if (!results.isArray()) {
            return hits;
        }

        Set<String> seenUrls = new LinkedHashSet<>();
        for (JsonNode result : results) {
            String url = result.path("url").asText("");
            if (!url.isEmpty() && !seenUrls.add(url)) {
                continue;
            }
            Map<String, Object> hit = new LinkedHashMap<>();
            hit.put("title", result.path("title").asText("No title"));
            hit.put("url", url);
            hit.put("snippet", result.path("content").asText(""));
            if (result.hasNonNull("published_date")) {
                hit.put("published", result.get("published_date").asText());
            }
            if (result.hasNonNull("score")) {
                hit.put("score", result.get("score").asDouble());
            }
            hits.add(hit);
        }
        return hits;
    }
}
