package com.assistantmcp.backend;

import com.assistantmcp.backend.config.PineconeBackendProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PineconeBackendProperties.class)
public class AssistantMcpApplication {

  public static void main(String[] args) {
    SpringApplication.run(AssistantMcpApplication.class, args);
  }
}
