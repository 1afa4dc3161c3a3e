package com.amblue.agent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the active LLM client based on the LLM_PROVIDER env var.
 * Wrapped by ResilientLlmClient, which is what the rest of the app injects.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Value("${llm.provider:openai}")
    private String provider;

    // OpenAI
    @Value("${openai.api-key:}") private String openAiKey;
    @Value("${openai.base-url:https://api.openai.com/v1}") private String openAiBaseUrl;
    @Value("${openai.model:gpt-4o}") private String openAiModel;
    @Value("${openai.max-tokens:4096}") private int openAiMaxTokens;
    @Value("${openai.temperature:0.0}") private double openAiTemp;

    // Azure OpenAI
    @Value("${azure.api-key:}") private String azureKey;
    @Value("${azure.endpoint:}") private String azureEndpoint;
    @Value("${azure.deployment:gpt-4o}") private String azureDeployment;
    @Value("${azure.api-version:2024-06-01}") private String azureApiVersion;
    @Value("${azure.max-tokens:4096}") private int azureMaxTokens;
    @Value("${azure.temperature:0.0}") private double azureTemp;

    // Groq
    @Value("${groq.api-key:}") private String groqKey;
    @Value("${groq.base-url:https://api.groq.com/openai/v1}") private String groqBaseUrl;
    @Value("${groq.model:llama-3.3-70b-versatile}") private String groqModel;
    @Value("${groq.max-tokens:4096}") private int groqMaxTokens;
    @Value("${groq.temperature:0.0}") private double groqTemp;

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", provider.toUpperCase());
        log.info("  Model               : {}", activeModel());
        log.info("================================================================");
    }

    @Bean("activeLlmClient")
    public LlmClient activeLlmClient(ObjectMapper objectMapper, RestClient.Builder restClientBuilder) {
        return switch (provider.toLowerCase()) {
            case "azure" -> {
                logKey("AZURE", azureKey, "AZURE_OPENAI_API_KEY");
                yield new GenericLlmClient(azureProps(), objectMapper, "azure", restClientBuilder.clone());
            }
            case "groq" -> {
                logKey("GROQ", groqKey, "GROQ_API_KEY");
                yield new GenericLlmClient(groqProps(), objectMapper, "groq", restClientBuilder.clone());
            }
            case "openai" -> {
                logKey("OPENAI", openAiKey, "OPENAI_API_KEY");
                yield new GenericLlmClient(openAiProps(), objectMapper, "openai", restClientBuilder.clone());
            }
            default -> throw new IllegalStateException(
                    "Unknown llm.provider '" + provider + "'. Use openai, azure or groq.");
        };
    }

    // ─── Props builders ───────────────────────────────────────────────────────

    private LlmProviderProperties openAiProps() {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(openAiKey); p.setBaseUrl(openAiBaseUrl); p.setModel(openAiModel);
        p.setMaxTokens(openAiMaxTokens); p.setTemperature(openAiTemp);
        return p;
    }

    private LlmProviderProperties azureProps() {
        LlmProviderProperties p = new LlmProviderProperties();
        String endpoint = azureEndpoint.endsWith("/") ? azureEndpoint.substring(0, azureEndpoint.length() - 1) : azureEndpoint;
        p.setApiKey(azureKey); p.setBaseUrl(endpoint + "/openai/deployments/" + azureDeployment);
        p.setModel(azureDeployment); p.setApiVersion(azureApiVersion);
        p.setMaxTokens(azureMaxTokens); p.setTemperature(azureTemp);
        return p;
    }

    private LlmProviderProperties groqProps() {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(groqKey); p.setBaseUrl(groqBaseUrl); p.setModel(groqModel);
        p.setMaxTokens(groqMaxTokens); p.setTemperature(groqTemp);
        return p;
    }

    private String activeModel() {
        return switch (provider.toLowerCase()) {
            case "azure" -> azureDeployment;
            case "groq" -> groqModel;
            default -> openAiModel;
        };
    }

    private void logKey(String name, String key, String envVar) {
        if (key == null || key.isBlank()) {
            log.error("  {} API key not set! Set env var: {}", name, envVar);
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
