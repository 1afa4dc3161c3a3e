package com.amblue.agent.retrieval;

import com.amblue.agent.config.ToolProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Document index over a MongoDB collection of embedded chunks.
 *
 * Scores with in-process cosine similarity, which works against any MongoDB
 * (no Atlas required) and is fine for a few thousand chunks. Only the scored
 * fields are fetched, and at most tools.retrieval.max-candidates chunks per
 * query. For Atlas, the
 * candidate scan can be swapped for a $vectorSearch aggregation stage on the
 * 'embedding' field without changing callers.
 */
@Component
@Slf4j
public class MongoDocumentIndex implements DocumentIndex {

    private final MongoTemplate mongoTemplate;
    private final EmbeddingService embeddingService;
    private final ToolProperties toolProperties;

    public MongoDocumentIndex(MongoTemplate mongoTemplate,
                              EmbeddingService embeddingService,
                              ToolProperties toolProperties) {
        this.mongoTemplate = mongoTemplate;
        this.embeddingService = embeddingService;
        this.toolProperties = toolProperties;
    }

    @Override
    public List<RetrievedDocument> similaritySearch(String query, int k) {
        ToolProperties.Retrieval props = toolProperties.getRetrieval();

        Query candidateQuery = new Query(Criteria.where("embedding").exists(true))
                .limit(props.getMaxCandidates());
        candidateQuery.fields().include("content", "source", "embedding");

        List<DocumentChunk> candidates = mongoTemplate.find(
                candidateQuery,
                DocumentChunk.class,
                props.getCollection());

        if (candidates.size() >= props.getMaxCandidates()) {
            log.warn("Candidate cap of {} reached in collection {}, later chunks are not scored",
                    props.getMaxCandidates(), props.getCollection());
        }

        if (candidates.isEmpty() || k <= 0) {
            log.debug("No embedded chunks in collection {}", props.getCollection());
            return List.of();
        }

        float[] queryEmbedding = embeddingService.embed(query);

        return candidates.stream()
                .filter(c -> c.getEmbedding() != null && !c.getEmbedding().isEmpty())
                .map(c -> new RetrievedDocument(c.getContent(), c.getSource(),
                        cosineSimilarity(queryEmbedding, c.getEmbedding())))
                .filter(d -> d.score() >= props.getMinScore())
                .sorted(Comparator.comparingDouble(RetrievedDocument::score).reversed())
                .limit(k)
                .toList();
    }

    static double cosineSimilarity(float[] a, List<Double> b) {
        if (a.length != b.size()) return 0.0;
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            double bi = b.get(i);
            dot   += a[i] * bi;
            normA += a[i] * a[i];
            normB += bi * bi;
        }
        return (normA == 0 || normB == 0) ? 0.0 : dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
