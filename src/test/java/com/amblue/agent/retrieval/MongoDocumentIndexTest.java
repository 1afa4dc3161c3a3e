package com.amblue.agent.retrieval;

import com.amblue.agent.config.ToolProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoDocumentIndexTest {

    @Mock
    private MongoTemplate mongoTemplate;

    @Mock
    private EmbeddingService embeddingService;

    private ToolProperties props;
    private MongoDocumentIndex index;

    @BeforeEach
    void setUp() {
        props = new ToolProperties();
        index = new MongoDocumentIndex(mongoTemplate, embeddingService, props);
    }

    @Test
    void similaritySearch_ranksByCosineAndLimitsToK() {
        when(mongoTemplate.find(any(Query.class), eq(DocumentChunk.class), eq("document_chunks"))).thenReturn(List.of(
                chunk("orthogonal", List.of(0.0, 1.0)),
                chunk("exact", List.of(1.0, 0.0)),
                chunk("close", List.of(0.9, 0.1))));
        when(embeddingService.embed("cost")).thenReturn(new float[]{1f, 0f});

        List<RetrievedDocument> docs = index.similaritySearch("cost", 2);

        assertThat(docs).extracting(RetrievedDocument::content).containsExactly("exact", "close");
        assertThat(docs.get(0).score()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void similaritySearch_dropsResultsBelowMinScore() {
        props.getRetrieval().setMinScore(0.5);
        when(mongoTemplate.find(any(Query.class), eq(DocumentChunk.class), anyString())).thenReturn(List.of(
                chunk("exact", List.of(1.0, 0.0)),
                chunk("orthogonal", List.of(0.0, 1.0))));
        when(embeddingService.embed("cost")).thenReturn(new float[]{1f, 0f});

        assertThat(index.similaritySearch("cost", 5)).extracting(RetrievedDocument::content).containsExactly("exact");
    }

    @Test
    void similaritySearch_emptyCollection_returnsNothingWithoutEmbedding() {
        when(mongoTemplate.find(any(Query.class), eq(DocumentChunk.class), anyString())).thenReturn(List.of());

        assertThat(index.similaritySearch("anything", 5)).isEmpty();
        verify(embeddingService, never()).embed(anyString());
    }

    @Test
    void similaritySearch_capsCandidatesAndFetchesOnlyScoredFields() {
        props.getRetrieval().setMaxCandidates(50);
        when(mongoTemplate.find(any(Query.class), eq(DocumentChunk.class), anyString())).thenReturn(List.of());

        index.similaritySearch("vm cost", 3);

        ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(captor.capture(), eq(DocumentChunk.class), eq("document_chunks"));
        assertThat(captor.getValue().getLimit()).isEqualTo(50);
        assertThat(captor.getValue().getFieldsObject().keySet())
                .containsExactlyInAnyOrder("content", "source", "embedding");
    }

    @Test
    void cosineSimilarity_mismatchedDimensions_isZero() {
        assertThat(MongoDocumentIndex.cosineSimilarity(new float[]{1f, 0f, 0f}, List.of(1.0, 0.0))).isZero();
        assertThat(MongoDocumentIndex.cosineSimilarity(new float[]{0f, 0f}, List.of(1.0, 0.0))).isZero();
    }

    private static DocumentChunk chunk(String content, List<Double> embedding) {
        DocumentChunk chunk = new DocumentChunk();
        chunk.setContent(content);
        chunk.setSource(content + ".md");
        chunk.setEmbedding(embedding);
        return chunk;
    }
}
