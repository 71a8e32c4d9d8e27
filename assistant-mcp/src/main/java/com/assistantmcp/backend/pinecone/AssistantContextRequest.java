package com.assistantmcp.backend.pinecone;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssistantContextRequest(
    @JsonProperty("query") String query, @JsonProperty("top_k") Integer topK) {}
