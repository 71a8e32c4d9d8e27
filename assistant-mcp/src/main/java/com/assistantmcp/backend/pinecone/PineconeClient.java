package com.assistantmcp.backend.pinecone;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

public class PineconeClient {

  public static final String API_KEY_HEADER = "Api-Key";
  public static final String API_VERSION_HEADER = "X-Pinecone-API-Version";

  static final String CONTEXT_PATH = "/assistant/chat/{assistantName}/context";

  private static final Logger log = LoggerFactory.getLogger(PineconeClient.class);

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final Duration requestTimeout;

  public PineconeClient(WebClient pineconeWebClient, ObjectMapper objectMapper, Duration requestTimeout) {
    this.webClient = Objects.requireNonNull(pineconeWebClient, "pineconeWebClient");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
  }

  public Mono<AssistantContextResponse> assistantContext(
      String assistantName, String query, Integer topK) {
    AssistantContextRequest body = new AssistantContextRequest(query, topK);
    return webClient
        .post()
        .uri(CONTEXT_PATH, assistantName)
        .contentType(MediaType.APPLICATION_JSON)
        .accept(MediaType.APPLICATION_JSON)
        .bodyValue(body)
        .exchangeToMono(response -> handleResponse(assistantName, response))
        .timeout(requestTimeout)
        .onErrorMap(ex -> !(ex instanceof PineconeClientException), this::toTransportFailure)
        .doOnError(
            PineconeClientException.class,
            ex -> log.warn("Pinecone request for assistant {} failed: {}", assistantName, ex.getMessage()));
  }

  private Mono<AssistantContextResponse> handleResponse(
      String assistantName, ClientResponse response) {
    HttpStatusCode status = response.statusCode();
    if (status.is2xxSuccessful()) {
      return response.bodyToMono(String.class).defaultIfEmpty("").map(this::decode);
    }
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("")
        .flatMap(errorBody -> Mono.error(toFailure(assistantName, status, errorBody)));
  }

  private PineconeClientException toFailure(
      String assistantName, HttpStatusCode status, String errorBody) {
    if (status.value() == HttpStatus.NOT_FOUND.value()) {
      return PineconeClientException.notFound("assistant \"" + assistantName + "\"");
    }
    return PineconeClientException.api(status.value(), errorBody);
  }

  private PineconeClientException toTransportFailure(Throwable ex) {
    if (ex instanceof TimeoutException) {
      return PineconeClientException.transport("no response within " + requestTimeout, ex);
    }
    return PineconeClientException.transport(ex);
  }

  AssistantContextResponse decode(String body) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException ex) {
      throw PineconeClientException.decode(ex.getOriginalMessage(), ex);
    }
    if (root == null || !root.isObject()) {
      throw PineconeClientException.decode("expected a JSON object", null);
    }
    JsonNode snippets = root.get("snippets");
    if (snippets == null || !snippets.isArray()) {
      throw PineconeClientException.decode("field `snippets` must be an array", null);
    }
    if (!root.has("usage")) {
      throw PineconeClientException.decode("missing field `usage`", null);
    }
    List<JsonNode> items = new ArrayList<>(snippets.size());
    snippets.forEach(items::add);
    return new AssistantContextResponse(items, root.get("usage"));
  }
}
