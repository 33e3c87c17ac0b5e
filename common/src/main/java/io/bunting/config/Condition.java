package io.bunting.config;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;

/**
 * A typed targeting predicate. {@code attribute} names the user attribute consulted by {@link
 * ConditionType#CUSTOM_ATTRIBUTE} conditions and is empty for every other type.
 */
public record Condition(
    String id,
    ConditionType type,
    ConditionOperator operator,
    List<String> values,
    Optional<String> attribute) {

  public Condition {
    requireNonNull(id, "id");
    requireNonNull(type, "type");
    requireNonNull(operator, "operator");
    values = ImmutableList.copyOf(values);
    requireNonNull(attribute, "attribute");
  }

  public static Condition of(
      String id, ConditionType type, ConditionOperator operator, String... values) {
    return new Condition(id, type, operator, List.of(values), Optional.empty());
  }

  public static Condition custom(
      String id, String attribute, ConditionOperator operator, String... values) {
    return new Condition(
        id, ConditionType.CUSTOM_ATTRIBUTE, operator, List.of(values), Optional.of(attribute));
  }
}
