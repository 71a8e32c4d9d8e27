package com.assistantmcp.backend.router;

import io.modelcontextprotocol.spec.McpSchema;
import java.util.List;
import java.util.Map;
import reactor.core.publisher.Mono;

/** One tool served by {@link PineconeAssistantRouter}; failures are {@link RouterException}s. */
public interface ToolHandler {

  McpSchema.Tool descriptor();

  default String name() {
    return descriptor().name();
  }

  Mono<List<McpSchema.Content>> handle(Map<String, Object> arguments);
}
