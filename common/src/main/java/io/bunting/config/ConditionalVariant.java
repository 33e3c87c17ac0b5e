package io.bunting.config;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Serves {@code value} when every condition matches. */
public record ConditionalVariant(int order, JsonNode value, List<Condition> conditions)
    implements Variant {

  public ConditionalVariant {
    requireNonNull(value, "value");
    conditions = ImmutableList.copyOf(conditions);
  }

  @Override
  public Type type() {
    return Type.CONDITIONAL;
  }
}
