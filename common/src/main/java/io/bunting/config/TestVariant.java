package io.bunting.config;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * Delegates to the test named {@code test}. The served value is the assigned group's value for
 * the environment unless {@code value} overrides it.
 */
public record TestVariant(int order, String test, Optional<JsonNode> value) implements Variant {

  public TestVariant {
    requireNonNull(test, "test");
    requireNonNull(value, "value");
  }

  @Override
  public Type type() {
    return Type.TEST;
  }
}
