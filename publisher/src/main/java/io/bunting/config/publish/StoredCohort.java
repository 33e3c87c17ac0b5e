package io.bunting.config.publish;

import com.google.common.collect.ImmutableList;
import java.util.List;

public record StoredCohort(
    String key, String name, String description, List<StoredCondition> conditions) {

  public StoredCohort {
    conditions = conditions == null ? List.of() : ImmutableList.copyOf(conditions);
  }
}
