package com.amblue.agent.retrieval;

public record RetrievedDocument(String content, String source, double score) {}
