package com.amblue.agent.retrieval;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Embeds retrieval queries through an OpenAI-compatible /embeddings endpoint.
 *
 * Caching:
 * - The same text always yields the same vector, so results are cached
 * - Redis key: embed:{model}:{sha256(text)}
 * - Redis being down only costs an extra API call, never a failed search
 */
@Service
@Slf4j
public class EmbeddingService {

    private static final String CACHE_PREFIX = "embed:";

    private final RestClient restClient;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final EmbeddingProperties props;

    public EmbeddingService(EmbeddingProperties props,
                            RestClient.Builder restClientBuilder,
                            StringRedisTemplate redisTemplate,
                            ObjectMapper objectMapper) {
        this.props = props;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;

        RestClient.Builder builder = restClientBuilder.clone()
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Content-Type", "application/json");
        if (props.getApiVersion() != null && !props.getApiVersion().isBlank()) {
            builder.defaultHeader("api-key", props.getApiKey());
        } else {
            builder.defaultHeader("Authorization", "Bearer " + props.getApiKey());
        }
        this.restClient = builder.build();
    }

    /**
     * Embedding for a text string, from cache when possible.
     */
    public float[] embed(String text) {
        String cacheKey = CACHE_PREFIX + props.getModel() + ":" + sha256(text);

        if (props.isCacheEnabled()) {
            try {
                String cached = redisTemplate.opsForValue().get(cacheKey);
                if (cached != null) {
                    log.debug("Embedding cache hit for text length={}", text.length());
                    return objectMapper.readValue(cached, float[].class);
                }
            } catch (Exception e) {
                log.warn("Embedding cache read failed, fetching instead: {}", e.getMessage());
            }
        }

        float[] embedding = fetchEmbedding(text);

        if (props.isCacheEnabled()) {
            try {
                redisTemplate.opsForValue().set(
                        cacheKey, objectMapper.writeValueAsString(embedding), props.getCacheTtl());
            } catch (Exception e) {
                log.warn("Failed to cache embedding: {}", e.getMessage());
            }
        }
        return embedding;
    }

    @SuppressWarnings("unchecked")
    private float[] fetchEmbedding(String text) {
        log.debug("Fetching embedding for text length={}", text.length());

        Map<String, Object> response = restClient.post()
                .uri(uri -> {
                    uri.path("/embeddings");
                    if (props.getApiVersion() != null && !props.getApiVersion().isBlank()) {
                        uri.queryParam("api-version", props.getApiVersion());
                    }
                    return uri.build();
                })
                .body(Map.of("model", props.getModel(), "input", text))
                .retrieve()
                .body(new ParameterizedTypeReference<>() {});

        if (response == null || !(response.get("data") instanceof List<?> data) || data.isEmpty()) {
            throw new IllegalStateException("Embedding response carried no data");
        }
        List<Number> raw = (List<Number>) ((Map<String, Object>) data.get(0)).get("embedding");

        float[] result = new float[raw.size()];
        for (int i = 0; i < raw.size(); i++) {
            result[i] = raw.get(i).floatValue();
        }
        log.debug("Fetched embedding: {} dimensions", result.length);
        return result;
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
