package com.amblue.agent.llm;

import lombok.Data;

/**
 * Holds config for a single LLM provider.
 * Populated from application.yml for openai / azure / groq.
 */
@Data
public class LlmProviderProperties {
    private String apiKey;
    /** For Azure: https://{resource}.openai.azure.com/openai/deployments/{deployment} */
    private String baseUrl;
    private String model;
    private int maxTokens;
    private double temperature;
    /** Azure only; switches auth to the api-key header and adds ?api-version= */
    private String apiVersion;

    public boolean isAzure() {
        return apiVersion != null && !apiVersion.isBlank();
    }
}
