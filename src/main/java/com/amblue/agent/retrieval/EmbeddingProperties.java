package com.amblue.agent.retrieval;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "embedding")
@Data
public class EmbeddingProperties {

    private String baseUrl = "https://api.openai.com/v1";
    private String apiKey;
    private String model = "text-embedding-3-small";

    /** Set for Azure OpenAI: baseUrl is then the embedding deployment URL */
    private String apiVersion;

    /** Query embeddings are deterministic, so they are cached in Redis */
    private boolean cacheEnabled = true;
    private Duration cacheTtl = Duration.ofDays(7);
}
