package io.bunting.config;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * One override rule inside a flag's per-environment configuration. Variants are evaluated by
 * ascending {@link #order()}; the first match wins.
 */
public sealed interface Variant permits ConditionalVariant, TestVariant, RolloutVariant {

  Comparator<Variant> BY_ORDER = Comparator.comparingInt(Variant::order);

  enum Type {
    CONDITIONAL("conditional"),
    TEST("test"),
    ROLLOUT("rollout");

    private final String wireName;

    Type(String wireName) {
      this.wireName = wireName;
    }

    public String wireName() {
      return wireName;
    }

    public static Optional<Type> fromWireName(String wireName) {
      return Arrays.stream(values()).filter(t -> t.wireName.equals(wireName)).findFirst();
    }

    @Override
    public String toString() {
      return wireName;
    }
  }

  Type type();

  int order();

  /** Stable sort by order; variants sharing an order keep their relative position. */
  static List<Variant> sorted(List<Variant> variants) {
    return variants.stream().sorted(BY_ORDER).toList();
  }
}
