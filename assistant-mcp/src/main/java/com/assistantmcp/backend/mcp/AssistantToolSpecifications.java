package com.assistantmcp.backend.mcp;

import com.assistantmcp.backend.router.PineconeAssistantRouter;
import com.assistantmcp.backend.router.RouterException;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpError;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.List;
import java.util.Map;
import reactor.core.publisher.Mono;

/**
 * Exposes the router's tools as MCP async tool specifications.
 *
 * <p>Backend failures and invalid arguments both come back as a tool result flagged {@code
 * isError}, told apart by the {@code Pinecone error:} and {@code Invalid parameters:} prefixes.
 * The MCP session answers every handler error with {@code -32603}, so a JSON-RPC error cannot
 * carry the distinction. Not-found failures stay JSON-RPC errors.
 */
public final class AssistantToolSpecifications {

  static final String INVALID_PARAMETERS_PREFIX = "Invalid parameters: ";

  private AssistantToolSpecifications() {}

  public static List<McpServerFeatures.AsyncToolSpecification> from(
      PineconeAssistantRouter router) {
    return router.listTools().stream()
        .map(
            tool ->
                new McpServerFeatures.AsyncToolSpecification(
                    tool, (exchange, arguments) -> call(router, tool.name(), arguments)))
        .toList();
  }

  static Mono<McpSchema.CallToolResult> call(
      PineconeAssistantRouter router, String toolName, Map<String, Object> arguments) {
    return router
        .callTool(toolName, arguments)
        .map(content -> new McpSchema.CallToolResult(content, false))
        .onErrorResume(RouterException.class, AssistantToolSpecifications::toProtocolFailure);
  }

  private static Mono<McpSchema.CallToolResult> toProtocolFailure(RouterException ex) {
    switch (ex.getKind()) {
      case EXECUTION_ERROR:
        return Mono.just(errorResult(ex.getMessage()));
      case INVALID_PARAMETERS:
        return Mono.just(errorResult(INVALID_PARAMETERS_PREFIX + ex.getMessage()));
      default:
        return Mono.error(
            new McpError(
                new McpSchema.JSONRPCResponse.JSONRPCError(
                    McpSchema.ErrorCodes.INVALID_PARAMS, ex.getMessage(), null)));
    }
  }

  private static McpSchema.CallToolResult errorResult(String message) {
    List<McpSchema.Content> content = List.of(new McpSchema.TextContent(message));
    return new McpSchema.CallToolResult(content, true);
  }
}
