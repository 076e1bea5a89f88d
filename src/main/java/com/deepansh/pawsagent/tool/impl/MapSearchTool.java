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
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Nearby pet businesses via the Google Places API (New), nearest first.
 *
 * Only registered when GOOGLE_PLACES_API_KEY is set. The query is echoed back for the
 * model; the search itself is by place type around the given coordinates.
 *
 * Failure behavior matches {@link WebSearchTool}: 4xx is a failed result, 429/5xx/network
 * are thrown for the runner to retry.
 */
@Component
@Slf4j
public class MapSearchTool implements ToolHandler<MapSearchTool.Input> {

    private static final ToolPolicy POLICY = ToolPolicy.of(Duration.ofSeconds(15), 2, Duration.ofSeconds(1));

    static final List<String> DEFAULT_TYPES = List.of("veterinary_care", "pet_store");
    static final int DEFAULT_MAX_RESULTS = 10;

    private static final String PLACE_TYPES = "veterinary_care|pet_store|animal_hospital|pet_grooming";
    private static final String FIELD_MASK = String.join(",",
            "places.id", "places.displayName", "places.formattedAddress", "places.location",
            "places.rating", "places.userRatingCount", "places.businessStatus", "places.primaryType",
            "places.types", "places.nationalPhoneNumber", "places.internationalPhoneNumber",
            "places.websiteUri", "places.googleMapsUri");

    private final ToolProperties toolProperties;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public MapSearchTool(ToolProperties toolProperties, ObjectMapper objectMapper, RestClient.Builder restClientBuilder) {
        this.toolProperties = toolProperties;
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder.clone()
                .baseUrl(toolProperties.getMaps().getGooglePlaces().getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Data
    public static class Input {
        @NotBlank(message = "Search query is required")
        private String query;

        @NotNull(message = "Latitude is required")
        @DecimalMin(value = "-90", message = "Latitude must be between -90 and 90")
        @DecimalMax(value = "90", message = "Latitude must be between -90 and 90")
        private Double latitude;

        @NotNull(message = "Longitude is required")
        @DecimalMin(value = "-180", message = "Longitude must be between -180 and 180")
        @DecimalMax(value = "180", message = "Longitude must be between -180 and 180")
        private Double longitude;

        @Min(value = 1, message = "Max results must be between 1 and 20")
        @Max(value = 20, message = "Max results must be between 1 and 20")
        private Integer maxResults;

        private List<@Pattern(regexp = PLACE_TYPES, message = "Unsupported place type") String> types;
    }

    @Override
    public String getName() {
        return "map_search";
    }

    @Override
    public String getDescription() {
        return "Search for nearby pet-related businesses (veterinarians, pet stores, animal hospitals, pet grooming) "
                + "by location using Google Places API. Results are automatically ranked by distance from the "
                + "specified location. Use this ONLY when users ask about finding physical locations or businesses "
                + "near a specific address or coordinates. This is the ONLY tool for location-based searches.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "query", Map.of(
                                "type", "string",
                                "description", "Search query for the type of pet service location "
                                        + "(e.g., \"veterinarian\", \"pet store\", \"animal hospital\")"),
                        "latitude", Map.of(
                                "type", "number", "minimum", -90, "maximum", 90,
                                "description", "Latitude coordinate for the search center"),
                        "longitude", Map.of(
                                "type", "number", "minimum", -180, "maximum", 180,
                                "description", "Longitude coordinate for the search center"),
                        "maxResults", Map.of(
                                "type", "integer", "minimum", 1, "maximum", 20, "default", DEFAULT_MAX_RESULTS,
                                "description", "Maximum number of results to return (1-20)"),
                        "types", Map.of(
                                "type", "array",
                                "items", Map.of("type", "string", "enum", List.of(PLACE_TYPES.split("\\|"))),
                                "default", DEFAULT_TYPES,
                                "description", "Types of pet-related businesses to search for")
                ),
                "required", List.of("query", "latitude", "longitude"),
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
        return toolProperties.getMaps().isConfigured();
    }

    @Override
    public ToolResult execute(Input input, ToolContext context) {
        log.info("[{}] Map search: '{}' near ({}, {})",
                context.requestId(), input.getQuery(), input.getLatitude(), input.getLongitude());

        String responseBody;
        try {
            responseBody = restClient.post()
                    .uri("/v1/places:searchNearby")
                    .contentType(MediaType.APPLICATION_JSON)
                    .header("X-Goog-Api-Key", toolProperties.getMaps().getGooglePlaces().getApiKey())
                    .header("X-Goog-FieldMask", FIELD_MASK)
                    .body(buildRequestBody(input))
                    .retrieve()
                    .body(String.class);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == 429) {
                throw new TransientExternalException("Google Places rate limited", e);
            }
            log.warn("[{}] Google Places rejected search: {}", context.requestId(), e.getStatusCode());
            return ToolResult.failure("Google Places API error: HTTP " + e.getStatusCode().value()
                    + ": " + e.getResponseBodyAsString());
        } catch (HttpServerErrorException | ResourceAccessException e) {
            throw new TransientExternalException("Google Places unavailable: " + e.getMessage(), e);
        }

        List<Map<String, Object>> results;
        try {
            results = parsePlaces(responseBody);
        } catch (JsonProcessingException e) {
            log.warn("[{}] Unreadable Google Places response: {}", context.requestId(), e.getMessage());
            return ToolResult.failure("Map search failed: unreadable response");
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("query", input.getQuery());
        data.put("location", Map.of("latitude", input.getLatitude(), "longitude", input.getLongitude()));
        data.put("results", results);
        data.put("count", results.size());
        return ToolResult.success(data);
    }

    Map<String, Object> buildRequestBody(Input input) {
        Map<String, Object> circle = new LinkedHashMap<>();
        circle.put("center", Map.of("latitude", input.getLatitude(), "longitude", input.getLongitude()));
        circle.put("radius", toolProperties.getMaps().getGooglePlaces().getRadiusMeters());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("includedTypes", input.getTypes() != null && !input.getTypes().isEmpty()
                ? input.getTypes() : DEFAULT_TYPES);
        body.put("maxResultCount", input.getMaxResults() != null ? input.getMaxResults() : DEFAULT_MAX_RESULTS);
        body.put("rankPreference", "DISTANCE");
        body.put("locationRestriction", Map.of("circle", circle));
        return body;
    }

    private List<Map<String, Object>> parsePlaces(String responseBody) throws JsonProcessingException {
        List<Map<String, Object>> results = new ArrayList<>();
        if (responseBody == null || responseBody.isBlank()) {
            return results;
        }
        JsonNode places = objectMapper.readTree(responseBody).path("places");
        if (!places.isArray()) {
            return results;
        }

        for (JsonNode place : places) {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("id", place.path("id").asText());
            result.put("name", place.path("displayName").path("text").asText(""));
            result.put("address", place.path("formattedAddress").asText(""));
            JsonNode location = place.path("location");
            result.put("location", Map.of(
                    "latitude", location.path("latitude").asDouble(),
                    "longitude", location.path("longitude").asDouble()));
            if (place.hasNonNull("rating")) {
                result.put("rating", place.get("rating").asDouble());
            }
            if (place.hasNonNull("userRatingCount")) {
                result.put("ratingCount", place.get("userRatingCount").asInt());
            }
            putFirstText(result, "phone", place, "nationalPhoneNumber", "internationalPhoneNumber");
            putFirstText(result, "website", place, "websiteUri");
            putFirstText(result, "mapsUrl", place, "googleMapsUri");
            putFirstText(result, "businessStatus", place, "businessStatus");

            List<String> types = new ArrayList<>();
            place.path("types").forEach(type -> types.add(type.asText()));
            if (types.isEmpty()) {
                types.add(place.path("primaryType").asText("unknown"));
            }
            result.put("types", types);
            results.add(result);
        }
        return results;
    }

    private static void putFirstText(Map<String, Object> target, String key, JsonNode source, String... fields) {
        for (String field : fields) {
            if (source.hasNonNull(field) && !source.get(field).asText().isBlank()) {
                target.put(key, source.get(field).asText());
                return;
            }
        }
    }
}
