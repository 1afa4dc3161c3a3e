package com.amblue.agent.retrieval;

import java.util.List;

/**
 * Top-k nearest-neighbour lookup over pre-embedded document chunks.
 * Ingestion happens elsewhere; this side only reads.
 */
public interface DocumentIndex {

    /**
     * @return at most {@code k} documents, most similar first; empty when nothing matches
     */
    List<RetrievedDocument> similaritySearch(String query, int k);
}
