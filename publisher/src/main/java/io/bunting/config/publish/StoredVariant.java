package io.bunting.config.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A variant as the record store holds it. A null {@code type} means {@code conditional} and a null
 * {@code order} means 0. Only the fields of the variant's tag are read by the compiler.
 */
public record StoredVariant(
    String type,
    Integer order,
    JsonNode value,
    List<StoredCondition> conditions,
    String test,
    String rollout) {

  public StoredVariant {
    conditions = conditions == null ? List.of() : ImmutableList.copyOf(conditions);
  }

  public static StoredVariant conditional(
      int order, JsonNode value, List<StoredCondition> conditions) {
    return new StoredVariant("conditional", order, value, conditions, null, null);
  }

  public static StoredVariant test(int order, String test) {
    return new StoredVariant("test", order, null, List.of(), test, null);
  }

  public static StoredVariant rollout(int order, String rollout) {
    return new StoredVariant("rollout", order, null, List.of(), null, rollout);
  }
}
