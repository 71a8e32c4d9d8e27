package com.assistantmcp.backend.mcp;

import com.assistantmcp.backend.router.PineconeAssistantRouter;
import io.modelcontextprotocol.server.McpServerFeatures;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

/** Registers the router's tools with the Spring AI MCP server (stdio or SSE transport). */
@Configuration
class McpServerConfiguration {

  private static final Logger log = LoggerFactory.getLogger(McpServerConfiguration.class);

  @Bean
  List<McpServerFeatures.AsyncToolSpecification> assistantToolSpecifications(
      PineconeAssistantRouter router) {
    return AssistantToolSpecifications.from(router);
  }

  @EventListener(ApplicationReadyEvent.class)
  void onReady() {
    log.info("Server initialized and ready to handle requests");
  }
}
