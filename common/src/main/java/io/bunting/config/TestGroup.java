package io.bunting.config;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.Maps;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/** One weighted arm of a test. */
public record TestGroup(String name, int percentage, Map<Environment, JsonNode> values) {

  public TestGroup {
    requireNonNull(name, "name");
    checkArgument(percentage >= 0, "percentage must not be negative: %s", percentage);
    values = values.isEmpty() ? Map.of() : Maps.immutableEnumMap(new EnumMap<>(values));
  }

  public Optional<JsonNode> valueFor(Environment environment) {
    return Optional.ofNullable(values.get(environment));
  }
}
