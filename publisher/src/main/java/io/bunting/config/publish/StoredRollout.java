package io.bunting.config.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import io.bunting.config.Salts;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** A rollout as stored. A null {@code percentage} compiles to 0. */
public record StoredRollout(
    String key,
    String name,
    String description,
    String salt,
    boolean archived,
    List<StoredCondition> conditions,
    Integer percentage,
    Map<String, JsonNode> values) {

  public StoredRollout {
    conditions = conditions == null ? List.of() : ImmutableList.copyOf(conditions);
    values = values == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(values));
  }

  public StoredRollout withSalt(String salt) {
    return new StoredRollout(
        key, name, description, salt, archived, conditions, percentage, values);
  }

  public StoredRollout withNewSalt() {
    return withSalt(Salts.generate());
  }

  public StoredRollout withPercentage(Integer percentage) {
    return new StoredRollout(
        key, name, description, salt, archived, conditions, percentage, values);
  }
}
