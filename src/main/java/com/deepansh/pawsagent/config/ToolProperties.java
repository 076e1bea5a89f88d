package com.deepansh.pawsagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Strongly-typed configuration for tools backed by external services.
 * Bound from application.yml under the "tools" prefix.
 * A tool whose service is not configured stays out of the capability set.
 */
@ConfigurationProperties(prefix = "tools")
@Data
public class ToolProperties {

    private WebSearch webSearch = new WebSearch();
    private Records records = new Records();
    private Maps maps = new Maps();

    @Data
    public static class WebSearch {
        private Tavily tavily = new Tavily();

        @Data
        public static class Tavily {
            private String apiKey = "";
            private String baseUrl = "https://api.tavily.com";
            private int maxResults = 5;
        }

        public boolean isConfigured() {
            return tavily.getApiKey() != null && !tavily.getApiKey().isBlank();
        }
    }

    @Data
    public static class Records {
        /** Base URL of the pet records service, e.g. http://records:3000/api */
        private String baseUrl = "";
        private String apiToken = "";

        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank();
        }
    }

    @Data
    public static class Maps {
        private GooglePlaces googlePlaces = new GooglePlaces();

        @Data
        public static class GooglePlaces {
            private String apiKey = "";
            private String baseUrl = "https://places.googleapis.com";
            /** Search circle around the given coordinates */
            private double radiusMeters = 5000;
        }

        public boolean isConfigured() {
            return googlePlaces.getApiKey() != null && !googlePlaces.getApiKey().isBlank();
        }
    }
}
