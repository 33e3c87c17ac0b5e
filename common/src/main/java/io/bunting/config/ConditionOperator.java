package io.bunting.config;

import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

public enum ConditionOperator {
  EQUALS("equals"),
  DOES_NOT_EQUAL("does_not_equal", "not_equals", "does_not_equals"),
  GREATER_THAN("greater_than"),
  GREATER_THAN_OR_EQUAL("greater_than_or_equal"),
  LESS_THAN("less_than"),
  LESS_THAN_OR_EQUAL("less_than_or_equal"),
  BETWEEN("between"),
  IN("in"),
  NOT_IN("not_in"),
  IS_IN_COHORT("is_in_cohort"),
  IS_NOT_IN_COHORT("is_not_in_cohort"),
  CUSTOM("custom");

  private final String wireName;
  private final Set<String> aliases;

  ConditionOperator(String wireName, String... aliases) {
    this.wireName = wireName;
    this.aliases = ImmutableSet.copyOf(aliases);
  }

  public String wireName() {
    return wireName;
  }

  /** Looks up an operator by its canonical name or one of the legacy spellings it replaced. */
  public static Optional<ConditionOperator> fromWireName(String name) {
    return Arrays.stream(values())
        .filter(op -> op.wireName.equals(name) || op.aliases.contains(name))
        .findFirst();
  }

  @Override
  public String toString() {
    return wireName;
  }
}
