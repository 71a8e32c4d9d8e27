package com.assistantmcp.backend.router;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AssistantContextArgumentsTest {

  @Test
  void decodesRequiredAndOptionalFields() {
    AssistantContextArguments arguments =
        AssistantContextArguments.from(
            Map.of("assistant_name", "docs", "query", "refund policy", "top_k", 5));

    assertThat(arguments.assistantName()).isEqualTo("docs");
    assertThat(arguments.query()).isEqualTo("refund policy");
    assertThat(arguments.topK()).isEqualTo(5);
  }

  @Test
  void rejectsMissingAssistantName() {
    assertThatThrownBy(() -> AssistantContextArguments.from(Map.of("query", "q")))
        .isInstanceOfSatisfying(
            RouterException.class,
            ex -> {
              assertThat(ex.getKind()).isEqualTo(RouterException.Kind.INVALID_PARAMETERS);
              assertThat(ex.getMessage()).isEqualTo("assistant_name must be a string");
            });
  }

  @Test
  void rejectsNonStringQuery() {
    assertThatThrownBy(
            () -> AssistantContextArguments.from(Map.of("assistant_name", "docs", "query", 42)))
        .isInstanceOfSatisfying(
            RouterException.class,
            ex -> {
              assertThat(ex.getKind()).isEqualTo(RouterException.Kind.INVALID_PARAMETERS);
              assertThat(ex.getMessage()).isEqualTo("query must be a string");
            });
  }

  @Test
  void rejectsNullArguments() {
    assertThatThrownBy(() -> AssistantContextArguments.from(null))
        .isInstanceOf(RouterException.class)
        .hasMessage("assistant_name must be a string");
  }

  @Test
  void rejectsExplicitNullValue() {
    Map<String, Object> arguments = new HashMap<>();
    arguments.put("assistant_name", null);
    arguments.put("query", "q");

    assertThatThrownBy(() -> AssistantContextArguments.from(arguments))
        .isInstanceOf(RouterException.class)
        .hasMessage("assistant_name must be a string");
  }

  @Test
  void acceptsEmptyStrings() {
    AssistantContextArguments arguments =
        AssistantContextArguments.from(Map.of("assistant_name", "", "query", ""));

    assertThat(arguments.assistantName()).isEmpty();
    assertThat(arguments.query()).isEmpty();
    assertThat(arguments.topK()).isNull();
  }

  @Test
  void dropsTopKThatIsNotANonNegativeInteger() {
    assertThat(AssistantContextArguments.optionalTopK(null)).isNull();
    assertThat(AssistantContextArguments.optionalTopK(-1)).isNull();
    assertThat(AssistantContextArguments.optionalTopK(2.5d)).isNull();
    assertThat(AssistantContextArguments.optionalTopK(3.0d)).isNull();
    assertThat(AssistantContextArguments.optionalTopK(new BigDecimal("4"))).isNull();
    assertThat(AssistantContextArguments.optionalTopK("5")).isNull();
    assertThat(AssistantContextArguments.optionalTopK(true)).isNull();
    assertThat(AssistantContextArguments.optionalTopK(List.of(1))).isNull();
    assertThat(AssistantContextArguments.optionalTopK(Long.MAX_VALUE)).isNull();
    assertThat(AssistantContextArguments.optionalTopK(new BigInteger("99999999999999999999")))
        .isNull();
  }

  @Test
  void keepsIntegralTopKValues() {
    assertThat(AssistantContextArguments.optionalTopK(0)).isZero();
    assertThat(AssistantContextArguments.optionalTopK(15L)).isEqualTo(15);
    assertThat(AssistantContextArguments.optionalTopK(BigInteger.TEN)).isEqualTo(10);
    assertThat(AssistantContextArguments.optionalTopK((long) Integer.MAX_VALUE))
        .isEqualTo(Integer.MAX_VALUE);
  }

  @Test
  void malformedTopKDoesNotFailTheCall() {
    AssistantContextArguments arguments =
        AssistantContextArguments.from(
            Map.of("assistant_name", "docs", "query", "q", "top_k", "ten"));

    assertThat(arguments.topK()).isNull();
  }
}
