package io.bunting.config;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSortedMap;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;

/**
 * The compiled configuration an SDK fetches. Instances are immutable; {@code configVersion} and
 * {@code publishedAt} stay empty until {@link #withPublication(String, Instant)} is called at
 * publish time, so a compiled artifact can be previewed and diffed first.
 */
public record ConfigArtifact(
    int schemaVersion,
    Optional<String> configVersion,
    Optional<Instant> publishedAt,
    String appIdentifier,
    SortedMap<String, CohortDefinition> cohorts,
    SortedMap<String, FlagDefinition> flags,
    SortedMap<String, TestDefinition> tests,
    SortedMap<String, RolloutDefinition> rollouts) {

  public static final int SCHEMA_VERSION = 2;

  public ConfigArtifact {
    requireNonNull(configVersion, "configVersion");
    requireNonNull(publishedAt, "publishedAt");
    requireNonNull(appIdentifier, "appIdentifier");
    cohorts = ImmutableSortedMap.copyOf(cohorts);
    flags = ImmutableSortedMap.copyOf(flags);
    tests = ImmutableSortedMap.copyOf(tests);
    rollouts = ImmutableSortedMap.copyOf(rollouts);
  }

  public static ConfigArtifact unpublished(
      String appIdentifier,
      Map<String, CohortDefinition> cohorts,
      Map<String, FlagDefinition> flags,
      Map<String, TestDefinition> tests,
      Map<String, RolloutDefinition> rollouts) {
    return new ConfigArtifact(
        SCHEMA_VERSION,
        Optional.empty(),
        Optional.empty(),
        appIdentifier,
        ImmutableSortedMap.copyOf(cohorts),
        ImmutableSortedMap.copyOf(flags),
        ImmutableSortedMap.copyOf(tests),
        ImmutableSortedMap.copyOf(rollouts));
  }

  public ConfigArtifact withPublication(String configVersion, Instant publishedAt) {
    return new ConfigArtifact(
        schemaVersion,
        Optional.of(configVersion),
        Optional.of(publishedAt),
        appIdentifier,
        cohorts,
        flags,
        tests,
        rollouts);
  }

  /** The same content with publication metadata cleared, for comparing compiled states. */
  public ConfigArtifact withoutPublication() {
    return new ConfigArtifact(
        schemaVersion,
        Optional.empty(),
        Optional.empty(),
        appIdentifier,
        cohorts,
        flags,
        tests,
        rollouts);
  }

  public boolean isPublished() {
    return configVersion.isPresent();
  }
}
