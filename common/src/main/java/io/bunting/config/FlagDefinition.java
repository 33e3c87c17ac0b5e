package io.bunting.config;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public record FlagDefinition(
    FlagType type, String description, Map<Environment, EnvironmentConfig> environments) {

  private static final Set<Environment> ALL_ENVIRONMENTS =
      Sets.immutableEnumSet(EnumSet.allOf(Environment.class));

  public FlagDefinition {
    requireNonNull(type, "type");
    description = description == null ? "" : description;
    checkArgument(
        environments.keySet().containsAll(ALL_ENVIRONMENTS),
        "Flag must be configured for every environment, missing %s",
        Sets.difference(ALL_ENVIRONMENTS, environments.keySet()));
    environments = Maps.immutableEnumMap(new EnumMap<>(environments));
  }

  public EnvironmentConfig environment(Environment environment) {
    return environments.get(environment);
  }
}
