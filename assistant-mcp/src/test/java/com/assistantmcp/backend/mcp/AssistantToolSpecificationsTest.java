package com.assistantmcp.backend.mcp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.assistantmcp.backend.pinecone.AssistantContextResponse;
import com.assistantmcp.backend.pinecone.PineconeClient;
import com.assistantmcp.backend.pinecone.PineconeClientException;
import com.assistantmcp.backend.router.AssistantContextToolHandler;
import com.assistantmcp.backend.router.PineconeAssistantRouter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpError;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

class AssistantToolSpecificationsTest {

  private PineconeClient client;
  private PineconeAssistantRouter router;

  @BeforeEach
  void setUp() {
    client = mock(PineconeClient.class);
    router = new PineconeAssistantRouter(List.of(new AssistantContextToolHandler(client)), null);
  }

  @Test
  void registersOneSpecificationPerTool() {
    List<McpServerFeatures.AsyncToolSpecification> specifications =
        AssistantToolSpecifications.from(router);

    assertThat(specifications)
        .extracting(specification -> specification.tool().name())
        .containsExactly("assistant_context");
  }

  @Test
  void successfulCallIsNotAnError() throws Exception {
    ObjectMapper objectMapper = new ObjectMapper();
    when(client.assistantContext("docs", "q", null))
        .thenReturn(
            Mono.just(
                new AssistantContextResponse(
                    List.of(objectMapper.readTree("{\"text\":\"a\"}")),
                    objectMapper.readTree("{}"))));

    McpSchema.CallToolResult result =
        AssistantToolSpecifications.call(
                router, "assistant_context", Map.of("assistant_name", "docs", "query", "q"))
            .block();

    assertThat(result).isNotNull();
    assertThat(result.isError()).isFalse();
    assertThat(result.content()).hasSize(1);
    assertThat(((McpSchema.TextContent) result.content().get(0)).text())
        .isEqualTo("{\"text\":\"a\"}");
  }

  @Test
  void backendFailureBecomesErrorResult() {
    when(client.assistantContext("docs", "q", null))
        .thenReturn(Mono.error(PineconeClientException.api(401, "{\"error\":\"Unauthorized\"}")));

    McpSchema.CallToolResult result =
        AssistantToolSpecifications.call(
                router, "assistant_context", Map.of("assistant_name", "docs", "query", "q"))
            .block();

    assertThat(result).isNotNull();
    assertThat(result.isError()).isTrue();
    assertThat(((McpSchema.TextContent) result.content().get(0)).text())
        .contains("401")
        .contains("Unauthorized");
  }

  @Test
  void invalidParametersBecomePrefixedErrorResult() {
    McpSchema.CallToolResult result =
        AssistantToolSpecifications.call(
                router, "assistant_context", Map.of("assistant_name", "docs"))
            .block();

    assertThat(result).isNotNull();
    assertThat(result.isError()).isTrue();
    assertThat(((McpSchema.TextContent) result.content().get(0)).text())
        .isEqualTo("Invalid parameters: query must be a string");
    verifyNoInteractions(client);
  }

  @Test
  void unknownToolBecomesProtocolError() {
    assertThatThrownBy(() -> AssistantToolSpecifications.call(router, "other", Map.of()).block())
        .isInstanceOfSatisfying(
            McpError.class,
            ex -> assertThat(ex.getJsonRpcError().message()).isEqualTo("Tool other not found"));
  }
}
