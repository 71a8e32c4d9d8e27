package com.assistantmcp.backend.router;

import static com.assistantmcp.backend.router.AssistantContextArguments.PARAM_ASSISTANT_NAME;
import static com.assistantmcp.backend.router.AssistantContextArguments.PARAM_QUERY;
import static com.assistantmcp.backend.router.AssistantContextArguments.PARAM_TOP_K;

import com.assistantmcp.backend.pinecone.AssistantContextResponse;
import com.assistantmcp.backend.pinecone.PineconeClient;
import com.assistantmcp.backend.pinecone.PineconeClientException;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@Order(0)
public class AssistantContextToolHandler implements ToolHandler {

  public static final String TOOL_NAME = "assistant_context";

  static final String DESCRIPTION =
      "Retrieves relevant document snippets from your Pinecone Assistant knowledge base. "
          + "Returns an array of text snippets from the most relevant documents. "
          + "You can use the 'top_k' parameter to control result count (default: 15). "
          + "Recommended top_k: a few (5-8) for simple/narrow queries, "
          + "10-20 for complex/broad topics.";

  static final String INPUT_SCHEMA =
      """
      {
        "type": "object",
        "properties": {
          "%s": {
            "type": "string",
            "description": "Name of an existing Pinecone assistant"
          },
          "%s": {
            "type": "string",
            "description": "The query to retrieve context for."
          },
          "%s": {
            "type": "integer",
            "description": "The number of context snippets to retrieve. Defaults to 15."
          }
        },
        "required": ["%s", "%s"]
      }
      """
          .formatted(
              PARAM_ASSISTANT_NAME,
              PARAM_QUERY,
              PARAM_TOP_K,
              PARAM_ASSISTANT_NAME,
              PARAM_QUERY);

  private static final Logger log = LoggerFactory.getLogger(AssistantContextToolHandler.class);

  private final PineconeClient client;
  private final McpSchema.Tool descriptor;

  public AssistantContextToolHandler(PineconeClient client) {
    this.client = Objects.requireNonNull(client, "client");
    this.descriptor = new McpSchema.Tool(TOOL_NAME, DESCRIPTION, INPUT_SCHEMA);
  }

  @Override
  public McpSchema.Tool descriptor() {
    return descriptor;
  }

  @Override
  public Mono<List<McpSchema.Content>> handle(Map<String, Object> arguments) {
    return Mono.defer(
        () -> {
          log.debug("Processing {} arguments", TOOL_NAME);
          AssistantContextArguments request = AssistantContextArguments.from(arguments);
          if (request.topK() == null && arguments.get(PARAM_TOP_K) != null) {
            log.debug("Ignoring non-integer {} value: {}", PARAM_TOP_K, arguments.get(PARAM_TOP_K));
          }
          log.info(
              "Making request to Pinecone API for assistant: {} with top_k: {}",
              request.assistantName(),
              request.topK());
          return client
              .assistantContext(request.assistantName(), request.query(), request.topK())
              .map(this::toContent)
              .onErrorMap(
                  PineconeClientException.class,
                  ex -> RouterException.executionError("Pinecone error: " + ex.getMessage(), ex));
        });
  }

  private List<McpSchema.Content> toContent(AssistantContextResponse response) {
    log.info(
        "Successfully received response from Pinecone API ({} snippets)",
        response.snippets().size());
    return response.snippets().stream()
        .<McpSchema.Content>map(snippet -> new McpSchema.TextContent(snippet.toString()))
        .toList();
  }
}
