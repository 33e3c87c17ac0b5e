package io.bunting.config;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record RolloutDefinition(
    String name,
    String description,
    String salt,
    List<Condition> conditions,
    int percentage,
    Map<Environment, JsonNode> values) {

  public RolloutDefinition {
    requireNonNull(name, "name");
    description = description == null ? "" : description;
    requireNonNull(salt, "salt");
    conditions = ImmutableList.copyOf(conditions);
    values = values.isEmpty() ? Map.of() : Maps.immutableEnumMap(new EnumMap<>(values));
  }

  public Optional<JsonNode> valueFor(Environment environment) {
    return Optional.ofNullable(values.get(environment));
  }
}
