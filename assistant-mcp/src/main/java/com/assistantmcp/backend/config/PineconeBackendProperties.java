package com.assistantmcp.backend.config;

import java.time.Duration;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "pinecone.backend")
public class PineconeBackendProperties implements InitializingBean {

  public static final String DEFAULT_BASE_URL = "https://prod-1-data.ke.pinecone.io";
  public static final String DEFAULT_API_VERSION = "2025-04";

  private String apiKey;
  private String baseUrl = DEFAULT_BASE_URL;
  private String apiVersion = DEFAULT_API_VERSION;
  private Duration connectTimeout = Duration.ofSeconds(10);
  private Duration readTimeout = Duration.ofSeconds(60);
  private Duration requestTimeout = Duration.ofSeconds(60);

  @Override
  public void afterPropertiesSet() {
    if (!StringUtils.hasText(apiKey)) {
      throw new IllegalStateException("Missing environment variable: PINECONE_API_KEY");
    }
    if (!StringUtils.hasText(baseUrl)) {
      baseUrl = DEFAULT_BASE_URL;
    }
    if (!StringUtils.hasText(apiVersion)) {
      throw new IllegalStateException("pinecone.backend.api-version must not be blank");
    }
    if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalStateException("pinecone.backend.request-timeout must be positive");
    }
  }

  /** Base URL without a trailing slash, so paths can be appended verbatim. */
  public String resolvedBaseUrl() {
    String value = baseUrl.trim();
    while (value.endsWith("/")) {
      value = value.substring(0, value.length() - 1);
    }
    return value;
  }

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getApiVersion() {
    return apiVersion;
  }

  public void setApiVersion(String apiVersion) {
    this.apiVersion = apiVersion;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(Duration connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  public Duration getReadTimeout() {
    return readTimeout;
  }

  public void setReadTimeout(Duration readTimeout) {
    this.readTimeout = readTimeout;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  public void setRequestTimeout(Duration requestTimeout) {
    this.requestTimeout = requestTimeout;
  }
}
