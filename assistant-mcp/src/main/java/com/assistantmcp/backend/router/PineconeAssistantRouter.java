package com.assistantmcp.backend.router;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

/**
 * Protocol-facing router of the Pinecone Assistant MCP server.
 *
 * <p>Advertises the registered tools, dispatches calls by tool name and reports resources and
 * prompts as empty surfaces. Holds no per-call state; all methods are safe for concurrent use.
 */
public class PineconeAssistantRouter {

  public static final String SERVER_NAME = "pinecone-assistant";

  public static final String INSTRUCTIONS =
      "This server connects to an existing Pinecone Assistant, "
          + "a RAG system for retrieving relevant document snippets. "
          + "Use the "
          + AssistantContextToolHandler.TOOL_NAME
          + " tool to access contextual information from its knowledge base";

  static final String CALLS_METRIC = "assistant_mcp_tool_calls_total";
  static final String DURATION_METRIC = "assistant_mcp_tool_call_duration";
  static final String UNKNOWN_TOOL_TAG = "unknown";

  private static final Logger log = LoggerFactory.getLogger(PineconeAssistantRouter.class);

  private final Map<String, ToolHandler> handlers;
  private final List<McpSchema.Tool> tools;
  private final MeterRegistry meterRegistry;

  public PineconeAssistantRouter(List<ToolHandler> toolHandlers, @Nullable MeterRegistry meterRegistry) {
    Map<String, ToolHandler> byName = new LinkedHashMap<>();
    List<McpSchema.Tool> descriptors = new ArrayList<>();
    for (ToolHandler handler : toolHandlers) {
      String name = handler.name();
      if (byName.putIfAbsent(name, handler) != null) {
        throw new IllegalStateException("Duplicate tool name: " + name);
      }
      descriptors.add(handler.descriptor());
    }
    this.handlers = Collections.unmodifiableMap(byName);
    this.tools = List.copyOf(descriptors);
    this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
    log.info("Created Pinecone assistant router with tools {}", handlers.keySet());
  }

  public String name() {
    return SERVER_NAME;
  }

  public String instructions() {
    return INSTRUCTIONS;
  }

  public McpSchema.ServerCapabilities capabilities() {
    log.debug("Building server capabilities");
    return McpSchema.ServerCapabilities.builder().tools(false).build();
  }

  public List<McpSchema.Tool> listTools() {
    log.debug("Listing available tools");
    return tools;
  }

  public Mono<List<McpSchema.Content>> callTool(String toolName, @Nullable Map<String, Object> arguments) {
    log.info("Calling tool: {}", toolName);
    ToolHandler handler = toolName == null ? null : handlers.get(toolName);
    if (handler == null) {
      log.error("Tool not found: {}", toolName);
      counter(UNKNOWN_TOOL_TAG, "not_found").increment();
      return Mono.error(RouterException.toolNotFound(toolName));
    }
    Map<String, Object> safeArguments = arguments == null ? Map.of() : arguments;
    Timer timer = meterRegistry.timer(DURATION_METRIC, "tool", toolName);
    return Mono.defer(
        () -> {
          Timer.Sample sample = Timer.start(meterRegistry);
          return handler
              .handle(safeArguments)
              .doOnSuccess(content -> counter(toolName, "success").increment())
              .doOnError(ex -> counter(toolName, outcome(ex)).increment())
              .doFinally(signal -> sample.stop(timer));
        });
  }

  public List<McpSchema.Resource> listResources() {
    return List.of();
  }

  public Mono<String> readResource(String uri) {
    return Mono.error(RouterException.resourceNotFound(uri));
  }

  public List<McpSchema.Prompt> listPrompts() {
    return List.of();
  }

  public Mono<String> getPrompt(String promptName) {
    return Mono.error(RouterException.promptNotFound(promptName));
  }

  private Counter counter(String toolName, String outcome) {
    return meterRegistry.counter(CALLS_METRIC, "tool", toolName, "outcome", outcome);
  }

  private static String outcome(Throwable ex) {
    if (ex instanceof RouterException routerException) {
      RouterException.Kind kind = routerException.getKind();
      if (kind == RouterException.Kind.INVALID_PARAMETERS) {
        return "invalid_parameters";
      }
      if (kind.isNotFound()) {
        return "not_found";
      }
    }
    return "error";
  }
}
