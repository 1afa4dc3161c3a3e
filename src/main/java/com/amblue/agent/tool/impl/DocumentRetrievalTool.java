package com.amblue.agent.tool.impl;

import com.amblue.agent.config.ToolProperties;
import com.amblue.agent.retrieval.DocumentIndex;
import com.amblue.agent.retrieval.RetrievedDocument;
import com.amblue.agent.tool.AgentTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Similarity search over the document index. Passages come back numbered with
 * their source so the model can attribute what it says.
 */
@Component
@Slf4j
public class DocumentRetrievalTool implements AgentTool {

    static final String NO_DOCUMENTS = "No documents are found.";

    private final DocumentIndex documentIndex;
    private final ToolProperties toolProperties;

    public DocumentRetrievalTool(DocumentIndex documentIndex, ToolProperties toolProperties) {
        this.documentIndex = documentIndex;
        this.toolProperties = toolProperties;
    }

    @Override
    public String getName() {
        return "retrieve_documents";
    }

    @Override
    public String getDescription() {
        return """
                Retrieve relevant documents from the knowledge base for a search query.
                Use this for questions about documentation, concepts and product knowledge
                that are not stored in the database. Rephrase the query with alternative terms
                if the first results are not relevant.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "query", Map.of(
                                "type", "string",
                                "description", "The search query used to find relevant documents"
                        )
                ),
                "required", List.of("query")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String query = String.valueOf(arguments.get("query"));
        try {
            List<RetrievedDocument> docs = documentIndex.similaritySearch(query, toolProperties.getRetrieval().getTopK());
            if (docs.isEmpty()) {
                log.debug("No documents found for query: {}", query);
                return NO_DOCUMENTS;
            }

            log.debug("{} documents retrieved", docs.size());
            List<String> parts = new ArrayList<>(docs.size());
            for (int i = 0; i < docs.size(); i++) {
                RetrievedDocument doc = docs.get(i);
                String source = doc.source() != null ? doc.source() : "unknown";
                parts.add("Document " + (i + 1) + " (source: " + source + "):\n" + doc.content());
            }
            return String.join("\n\n", parts);
        } catch (Exception e) {
            log.error("Document retrieval failed for query: {}", query, e);
            return "ERROR: Document retrieval failed: " + e.getMessage();
        }
    }
}
