package com.assistantmcp.backend.pinecone;

import com.assistantmcp.backend.config.PineconeBackendProperties;
import com.assistantmcp.backend.config.ReactorClientHttpConnectorBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
class PineconeClientConfiguration {

  private static final Logger log = LoggerFactory.getLogger(PineconeClientConfiguration.class);

  @Bean
  WebClient pineconeWebClient(PineconeBackendProperties properties) {
    log.info("Creating Pinecone client [Host: {}]", properties.resolvedBaseUrl());
    return WebClient.builder()
        .baseUrl(properties.resolvedBaseUrl())
        .defaultHeader(PineconeClient.API_KEY_HEADER, properties.getApiKey().trim())
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
        .defaultHeader(PineconeClient.API_VERSION_HEADER, properties.getApiVersion().trim())
        .clientConnector(ReactorClientHttpConnectorBuilder.from(properties).build())
        .build();
  }

  @Bean
  PineconeClient pineconeClient(
      WebClient pineconeWebClient,
      ObjectMapper objectMapper,
      PineconeBackendProperties properties) {
    PineconeClient client =
        new PineconeClient(pineconeWebClient, objectMapper, properties.getRequestTimeout());
    log.info("Successfully initialized Pinecone client");
    return client;
  }
}
