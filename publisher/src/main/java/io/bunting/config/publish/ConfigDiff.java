package io.bunting.config.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import io.bunting.config.ArtifactCodec;
import io.bunting.config.ConfigArtifact;
import io.bunting.config.publish.ConfigChange.Action;
import io.bunting.config.publish.ConfigChange.EntityKind;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.apache.commons.lang3.StringUtils;

/** Compares a compiled artifact with the latest published one. */
public final class ConfigDiff {

  private static final int MAX_DETAIL_VALUE_LENGTH = 80;
  private static final List<String> COMPARED_FIELDS =
      List.of("app_identifier", "flags", "cohorts", "tests", "rollouts");

  private ConfigDiff() {}

  /**
   * Added, modified and removed flags, cohorts, tests and rollouts, in that order and sorted by
   * key within each kind. With nothing published, every entity is added.
   */
  public static List<ConfigChange> changes(
      ConfigArtifact current, Optional<ConfigArtifact> published) {
    final ObjectNode currentTree = ArtifactCodec.toTree(current);
    final Optional<ObjectNode> publishedTree = published.map(ArtifactCodec::toTree);
    final List<ConfigChange> changes = new ArrayList<>();
    for (EntityKind kind : EntityKind.values()) {
      final String section = section(kind);
      final JsonNode before =
          publishedTree
              .<JsonNode>map(tree -> tree.path(section))
              .orElse(ArtifactCodec.nodes().objectNode());
      changes.addAll(compareSection(kind, currentTree.path(section), before));
    }
    return ImmutableList.copyOf(changes);
  }

  /** Whether publishing {@code current} would change anything clients see. */
  public static boolean hasChanges(ConfigArtifact current, Optional<ConfigArtifact> published) {
    if (published.isEmpty()) {
      return true;
    }
    final ObjectNode after = ArtifactCodec.toTree(current);
    final ObjectNode before = ArtifactCodec.toTree(published.get());
    return COMPARED_FIELDS.stream()
        .anyMatch(field -> !sameJson(before.get(field), after.get(field)));
  }

  /** Keys of tests and rollouts present in both artifacts whose salt differs. */
  public static List<String> saltChanges(ConfigArtifact current, ConfigArtifact published) {
    final Set<String> changed = new TreeSet<>();
    current
        .tests()
        .forEach(
            (key, test) -> {
              if (published.tests().containsKey(key)
                  && !published.tests().get(key).salt().equals(test.salt())) {
                changed.add(key);
              }
            });
    current
        .rollouts()
        .forEach(
            (key, rollout) -> {
              if (published.rollouts().containsKey(key)
                  && !published.rollouts().get(key).salt().equals(rollout.salt())) {
                changed.add(key);
              }
            });
    return ImmutableList.copyOf(changed);
  }

  private static List<ConfigChange> compareSection(
      EntityKind kind, JsonNode current, JsonNode published) {
    final Set<String> keys =
        ImmutableSortedSet.copyOf(Sets.union(fieldNames(current), fieldNames(published)));
    final List<ConfigChange> changes = new ArrayList<>();
    for (String key : keys) {
      final JsonNode after = current.get(key);
      final JsonNode before = published.get(key);
      if (before == null) {
        changes.add(new ConfigChange(kind, Action.ADDED, key, name(kind, key, after), List.of()));
      } else if (after == null) {
        changes.add(
            new ConfigChange(kind, Action.REMOVED, key, name(kind, key, before), List.of()));
      } else if (!sameJson(before, after)) {
        changes.add(
            new ConfigChange(
                kind, Action.MODIFIED, key, name(kind, key, after), details(before, after)));
      }
    }
    return changes;
  }

  private static List<String> details(JsonNode before, JsonNode after) {
    final List<String> details = new ArrayList<>();
    for (String field : fieldNames(before)) {
      if (!after.has(field)) {
        details.add("Removed: " + field);
      }
    }
    for (String field : fieldNames(after)) {
      if (!before.has(field)) {
        details.add("Added: " + field);
      } else if (!sameJson(before.get(field), after.get(field))) {
        details.add(
            String.format(
                "Changed: %s (%s → %s)",
                field, render(before.get(field)), render(after.get(field))));
      }
    }
    return details;
  }

  private static String name(EntityKind kind, String key, JsonNode entity) {
    final String name =
        kind == EntityKind.FLAG
            ? key
            : StringUtils.defaultIfEmpty(entity.path("name").asText(), key);
    return kind.label() + ": " + name;
  }

  private static String render(JsonNode value) {
    return StringUtils.abbreviate(ArtifactCodec.write(value), MAX_DETAIL_VALUE_LENGTH);
  }

  private static Set<String> fieldNames(JsonNode node) {
    final Set<String> names = new LinkedHashSet<>();
    node.fieldNames().forEachRemaining(names::add);
    return names;
  }

  private static String section(EntityKind kind) {
    return switch (kind) {
      case FLAG -> "flags";
      case COHORT -> "cohorts";
      case TEST -> "tests";
      case ROLLOUT -> "rollouts";
    };
  }

  // numeric nodes of different widths compare unequal as trees but print the same
  private static boolean sameJson(JsonNode before, JsonNode after) {
    if (before == null || after == null) {
      return before == after;
    }
    return ArtifactCodec.write(before).equals(ArtifactCodec.write(after));
  }
}
