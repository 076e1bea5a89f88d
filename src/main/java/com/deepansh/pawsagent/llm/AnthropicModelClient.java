package com.deepansh.pawsagent.llm;

import com.deepansh.pawsagent.exception.ModelClientException;
import com.deepansh.pawsagent.exception.TransientExternalException;
import com.deepansh.pawsagent.model.ContentBlock;
import com.deepansh.pawsagent.model.TextBlock;
import com.deepansh.pawsagent.model.ToolUseBlock;
import com.deepansh.pawsagent.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API adapter: POST /v1/messages.
 *
 * Status mapping:
 * - 429, 5xx, 529 (overloaded), I/O errors → TransientExternalException (retried)
 * - 401 and any other 4xx, unreadable body → ModelClientException (not retried)
 *
 * Only text and tool_use blocks are kept from the response.
 */
@Component("anthropicModelClient")
@Slf4j
public class AnthropicModelClient implements ModelClient {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ModelProviderProperties properties;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public AnthropicModelClient(ModelProviderProperties properties,
                                ObjectMapper objectMapper,
                                RestClient.Builder restClientBuilder) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder.clone()
                .baseUrl(properties.getBaseUrl())
                .defaultHeader("x-api-key", properties.getApiKey() != null ? properties.getApiKey() : "")
                .defaultHeader("anthropic-version", properties.getApiVersion())
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @PostConstruct
    public void logActiveModel() {
        log.info("Model provider: Anthropic [model={}, maxTokens={}]", properties.getModel(), properties.getMaxTokens());
        String key = properties.getApiKey();
        if (key == null || key.isBlank()) {
            log.error("Anthropic API key not set! Set env var: ANTHROPIC_API_KEY");
        }
    }

    @Override
    public ModelResponse complete(ModelRequest request) {
        Map<String, Object> body = buildRequestBody(request);

        log.debug("Sending {} messages and {} tools to Anthropic [model={}]",
                request.messages().size(), request.tools().size(), properties.getModel());

        String responseBody;
        try {
            responseBody = restClient.post()
                    .uri("/v1/messages")
                    .body(body)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw translate(e);
        } catch (ResourceAccessException e) {
            throw new TransientExternalException("Anthropic unreachable: " + e.getMessage(), e);
        }

        return parseResponse(responseBody);
    }

    Map<String, Object> buildRequestBody(ModelRequest request) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", properties.getModel());
        body.put("max_tokens", properties.getMaxTokens());
        body.put("temperature", properties.getTemperature());
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            body.put("system", request.systemPrompt());
        }
        body.put("messages", request.messages());
        if (!request.tools().isEmpty()) {
            body.put("tools", request.tools().stream().map(ToolDefinition::toWireSchema).toList());
        }
        return body;
    }

    ModelResponse parseResponse(String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody == null ? "" : responseBody);
        } catch (JsonProcessingException e) {
            throw new ModelClientException("Unreadable Anthropic response", e);
        }
        if (root == null || !root.path("content").isArray()) {
            throw new ModelClientException("Anthropic response has no content array");
        }

        List<ContentBlock> content = new ArrayList<>();
        for (JsonNode block : root.path("content")) {
            String type = block.path("type").asText();
            if ("text".equals(type)) {
                content.add(new TextBlock(block.path("text").asText("")));
            } else if ("tool_use".equals(type)) {
                Map<String, Object> input = block.hasNonNull("input")
                        ? objectMapper.convertValue(block.get("input"), MAP_TYPE)
                        : new HashMap<>();
                content.add(new ToolUseBlock(block.path("id").asText(null), block.path("name").asText(null), input));
            } else {
                log.debug("Ignoring Anthropic content block of type {}", type);
            }
        }

        JsonNode usage = root.path("usage");
        ModelResponse response = ModelResponse.builder()
                .content(content)
                .stopReason(root.path("stop_reason").asText(null))
                .inputTokens(usage.path("input_tokens").asInt(0))
                .outputTokens(usage.path("output_tokens").asInt(0))
                .build();

        log.debug("Token usage — input={} output={} stop={}",
                response.getInputTokens(), response.getOutputTokens(), response.getStopReason());
        return response;
    }

    private RuntimeException translate(RestClientResponseException e) {
        int status = e.getStatusCode().value();
        String detail = errorMessage(e.getResponseBodyAsString());
        if (status == 429 || status >= 500) {
            log.warn("Anthropic transient error {}: {}", status, detail);
            return new TransientExternalException("Anthropic error " + status + ": " + detail, e);
        }
        log.error("Anthropic rejected request with {}: {}", status, detail);
        return new ModelClientException("Anthropic error " + status + ": " + detail, e);
    }

    private String errorMessage(String body) {
        if (body == null || body.isBlank()) return "no body";
        try {
            JsonNode message = objectMapper.readTree(body).path("error").path("message");
            return message.isMissingNode() ? body : message.asText();
        } catch (JsonProcessingException ex) {
            return body;
        }
    }
}
