package com.amblue.agent.retrieval;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One embedded chunk of an ingested document.
 *
 * Collection: document_chunks (overridable with tools.retrieval.collection).
 * Written by the ingestion pipeline, which lives outside this service.
 */
@Document(collection = "document_chunks")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentChunk {

    @Id
    private String id;

    private String content;

    /** File name, URL or wiki page the chunk was cut from */
    private String source;

    /**
     * Same model and dimensions as {@link EmbeddingService} produces for queries.
     * For Atlas Vector Search: create a search index on this field.
     */
    private List<Double> embedding;

    private Map<String, Object> metadata;

    private Instant createdAt;
}
