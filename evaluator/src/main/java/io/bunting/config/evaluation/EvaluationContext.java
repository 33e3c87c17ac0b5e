package io.bunting.config.evaluation;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Who a flag is evaluated for. {@code localId} is the stable per-install identifier hashed by
 * {@link Bucketing}; attributes are keyed by condition type wire name ({@code app_version},
 * {@code platform}, {@code cohort}, ...) or by custom attribute name.
 */
public record EvaluationContext(String localId, Map<String, List<String>> attributes) {

  public static final String COHORT_ATTRIBUTE = "cohort";

  public EvaluationContext {
    requireNonNull(localId, "localId");
    final ImmutableMap.Builder<String, List<String>> copy = ImmutableMap.builder();
    attributes.forEach((name, values) -> copy.put(name, ImmutableList.copyOf(values)));
    attributes = copy.buildKeepingLast();
  }

  public static EvaluationContext of(String localId) {
    return new EvaluationContext(localId, Map.of());
  }

  /** Returns a copy with {@code name} set to the given values, replacing earlier ones. */
  public EvaluationContext with(String name, String... values) {
    final Map<String, List<String>> updated = new LinkedHashMap<>(attributes);
    updated.put(name, List.of(values));
    return new EvaluationContext(localId, updated);
  }

  public List<String> values(String name) {
    return attributes.getOrDefault(name, List.of());
  }

  public Optional<String> first(String name) {
    final List<String> values = values(name);
    return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
  }
}
