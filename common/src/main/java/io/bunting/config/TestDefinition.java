package io.bunting.config;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

public record TestDefinition(
    String name,
    String description,
    String salt,
    List<Condition> conditions,
    List<TestGroup> groups) {

  public TestDefinition {
    requireNonNull(name, "name");
    description = description == null ? "" : description;
    requireNonNull(salt, "salt");
    conditions = ImmutableList.copyOf(conditions);
    groups = ImmutableList.copyOf(groups);
  }

  public int totalPercentage() {
    return groups.stream().mapToInt(TestGroup::percentage).sum();
  }
}
