package io.bunting.config;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A named, reusable set of ANDed conditions. Never contains a cohort condition itself. */
public record CohortDefinition(String name, String description, List<Condition> conditions) {

  public CohortDefinition {
    requireNonNull(name, "name");
    description = description == null ? "" : description;
    conditions = ImmutableList.copyOf(conditions);
    checkArgument(
        conditions.stream().noneMatch(c -> c.type().kind() == ConditionType.Kind.COHORT),
        "cohort '%s' must not reference other cohorts",
        name);
  }
}
