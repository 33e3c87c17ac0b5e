package io.bunting.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class FlagTypeTest {

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  @Test
  void wireNamesMatchExactly() {
    assertThat(FlagType.fromWireName("bool")).contains(FlagType.BOOL);
    assertThat(FlagType.fromWireName("boolean")).isEmpty();
    assertThat(FlagType.fromWireName("BOOL")).isEmpty();
  }

  @Test
  void acceptsValuesOfItsKind() {
    assertThat(FlagType.BOOL.accepts(NODES.booleanNode(true))).isTrue();
    assertThat(FlagType.BOOL.accepts(NODES.textNode("true"))).isFalse();
    assertThat(FlagType.STRING.accepts(NODES.textNode("x"))).isTrue();
    assertThat(FlagType.INT.accepts(NODES.numberNode(3))).isTrue();
    assertThat(FlagType.INT.accepts(NODES.numberNode(3.0))).isTrue();
    assertThat(FlagType.INT.accepts(NODES.numberNode(3.5))).isFalse();
    assertThat(FlagType.DOUBLE.accepts(NODES.numberNode(3))).isTrue();
    assertThat(FlagType.DOUBLE.accepts(NODES.textNode("3.0"))).isFalse();
    assertThat(FlagType.STRING.accepts(NODES.nullNode())).isFalse();
    assertThat(FlagType.STRING.accepts(null)).isFalse();
  }

  @Test
  void jsonAcceptsStructuresAndJsonText() {
    assertThat(FlagType.JSON.accepts(NODES.objectNode())).isTrue();
    assertThat(FlagType.JSON.accepts(NODES.arrayNode())).isTrue();
    assertThat(FlagType.JSON.accepts(NODES.textNode("{\"a\":1}"))).isTrue();
    assertThat(FlagType.JSON.accepts(NODES.textNode("{a:1"))).isFalse();
  }

  @Test
  void datesAcceptTheUsualIsoForms() {
    assertThat(FlagType.parseDate("2025-03-01")).isEqualTo(Instant.parse("2025-03-01T00:00:00Z"));
    assertThat(FlagType.parseDate("2025-03-01T12:00:00"))
        .isEqualTo(Instant.parse("2025-03-01T12:00:00Z"));
    assertThat(FlagType.parseDate("2025-03-01T12:00:00+02:00"))
        .isEqualTo(Instant.parse("2025-03-01T10:00:00Z"));
    assertThat(FlagType.parseDate("2025-03-01T12:00:00Z"))
        .isEqualTo(Instant.parse("2025-03-01T12:00:00Z"));
    assertThat(FlagType.parseDate("yesterday")).isNull();
    assertThat(FlagType.DATE.accepts(NODES.textNode("2025-13-01"))).isFalse();
  }
}
