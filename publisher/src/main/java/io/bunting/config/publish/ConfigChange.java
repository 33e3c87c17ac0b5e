package io.bunting.config.publish;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * One entity that differs between the compiled config and the latest publication. {@code details}
 * lists the top-level fields that were added, removed or changed; it is empty for added and
 * removed entities.
 */
public record ConfigChange(
    EntityKind kind, Action action, String key, String name, List<String> details) {

  public enum EntityKind {
    FLAG("Flag"),
    COHORT("Cohort"),
    TEST("Test"),
    ROLLOUT("Rollout");

    private final String label;

    EntityKind(String label) {
      this.label = label;
    }

    public String label() {
      return label;
    }
  }

  public enum Action {
    ADDED,
    MODIFIED,
    REMOVED
  }

  public ConfigChange {
    requireNonNull(kind, "kind");
    requireNonNull(action, "action");
    requireNonNull(key, "key");
    requireNonNull(name, "name");
    details = ImmutableList.copyOf(details);
  }
}
