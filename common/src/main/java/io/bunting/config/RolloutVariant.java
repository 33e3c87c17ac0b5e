package io.bunting.config;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * Delegates to the rollout named {@code rollout}. Users inside the rollout get {@code value}, or
 * the rollout's own value for the environment when the variant carries none.
 */
public record RolloutVariant(int order, String rollout, Optional<JsonNode> value)
    implements Variant {

  public RolloutVariant {
    requireNonNull(rollout, "rollout");
    requireNonNull(value, "value");
  }

  @Override
  public Type type() {
    return Type.ROLLOUT;
  }
}
