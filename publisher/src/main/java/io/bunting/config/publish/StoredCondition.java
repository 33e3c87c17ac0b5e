package io.bunting.config.publish;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A condition as the record store holds it. Type and operator are free text until compiled, and
 * {@code attribute} is null for every type but {@code custom_attribute}.
 */
public record StoredCondition(
    String id, String type, String operator, List<String> values, String attribute) {

  public StoredCondition {
    values = values == null ? List.of() : ImmutableList.copyOf(values);
  }

  public static StoredCondition of(String id, String type, String operator, String... values) {
    return new StoredCondition(id, type, operator, List.of(values), null);
  }
}
