package io.bunting.config;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import java.util.List;

public record EnvironmentConfig(JsonNode defaultValue, List<Variant> variants) {

  public EnvironmentConfig {
    requireNonNull(defaultValue, "defaultValue");
    variants = ImmutableList.copyOf(variants);
  }

  public List<Variant> sortedVariants() {
    return Variant.sorted(variants);
  }
}
