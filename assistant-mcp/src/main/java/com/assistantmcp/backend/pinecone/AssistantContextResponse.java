package com.assistantmcp.backend.pinecone;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/** Snippets are kept as raw JSON; nothing downstream interprets their fields. */
public record AssistantContextResponse(List<JsonNode> snippets, JsonNode usage) {

  public AssistantContextResponse {
    snippets = snippets == null ? List.of() : List.copyOf(snippets);
  }
}
