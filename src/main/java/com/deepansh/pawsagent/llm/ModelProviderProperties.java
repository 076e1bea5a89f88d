package com.deepansh.pawsagent.llm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Completion provider settings, bound from application.yml under "model".
 */
@ConfigurationProperties(prefix = "model")
@Data
public class ModelProviderProperties {
    private String baseUrl = "https://api.anthropic.com";
    private String apiKey;
    private String model = "claude-sonnet-4-20250514";
    private int maxTokens = 1500;
    private double temperature = 0.3;
    private String apiVersion = "2023-06-01";
}
