package com.assistantmcp.backend.config;

import io.netty.channel.ChannelOption;
import java.time.Duration;
import org.springframework.http.client.reactive.ClientHttpConnector;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

/** Builds the Reactor Netty connector shared by every outbound Pinecone call. */
public class ReactorClientHttpConnectorBuilder {

  private static final String POOL_NAME = "pinecone";

  private Duration connectTimeout = Duration.ofSeconds(10);
  private Duration readTimeout = Duration.ofSeconds(60);

  public static ReactorClientHttpConnectorBuilder from(PineconeBackendProperties properties) {
    return new ReactorClientHttpConnectorBuilder()
        .connectTimeout(properties.getConnectTimeout())
        .readTimeout(properties.getReadTimeout());
  }

  public ReactorClientHttpConnectorBuilder connectTimeout(Duration connectTimeout) {
    if (connectTimeout != null) {
      this.connectTimeout = connectTimeout;
    }
    return this;
  }

  public ReactorClientHttpConnectorBuilder readTimeout(Duration readTimeout) {
    if (readTimeout != null) {
      this.readTimeout = readTimeout;
    }
    return this;
  }

  public ClientHttpConnector build() {
    HttpClient client =
        HttpClient.create(ConnectionProvider.create(POOL_NAME))
            .responseTimeout(readTimeout)
            .proxyWithSystemProperties()
            .compress(true)
            .keepAlive(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis());
    return new ReactorClientHttpConnector(client);
  }
}
