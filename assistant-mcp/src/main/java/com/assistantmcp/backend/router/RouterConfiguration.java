package com.assistantmcp.backend.router;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class RouterConfiguration {

  @Bean
  PineconeAssistantRouter pineconeAssistantRouter(
      List<ToolHandler> toolHandlers, ObjectProvider<MeterRegistry> meterRegistry) {
    return new PineconeAssistantRouter(toolHandlers, meterRegistry.getIfAvailable());
  }
}
