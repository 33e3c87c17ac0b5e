package io.bunting.config.evaluation;

import static java.util.Objects.requireNonNull;

import io.bunting.config.Condition;
import io.bunting.config.ConditionOperator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Evaluates single targeting conditions against a context. */
public class ConditionEvaluator {

  private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

  private final CustomConditionResolver customResolver;

  public ConditionEvaluator(CustomConditionResolver customResolver) {
    this.customResolver = requireNonNull(customResolver, "customResolver");
  }

  /** ANDs the conditions, stopping at the first one that does not match. */
  public boolean matchesAll(
      List<Condition> conditions, EvaluationContext context, Supplier<Set<String>> cohorts) {
    for (Condition condition : conditions) {
      if (!matches(condition, context, cohorts)) {
        return false;
      }
    }
    return true;
  }

  /**
   * @param cohorts lazily computed cohort membership, consulted only by cohort conditions
   */
  public boolean matches(
      Condition condition, EvaluationContext context, Supplier<Set<String>> cohorts) {
    return switch (condition.type().kind()) {
      case VERSION -> matchesVersion(condition, context);
      case LIST -> matchesList(condition, context);
      case COHORT -> matchesCohort(condition, cohorts.get());
      case CUSTOM -> matchesCustom(condition, context);
    };
  }

  private static boolean matchesVersion(Condition condition, EvaluationContext context) {
    final Optional<String> userValue = context.first(condition.type().attributeName());
    final List<String> values = condition.values();
    if (userValue.isEmpty() || userValue.get().isEmpty() || values.isEmpty()) {
      return false;
    }
    final SemanticVersion version = SemanticVersion.fromVersionString(userValue.get());
    final SemanticVersion target = SemanticVersion.fromVersionString(values.get(0));
    return switch (condition.operator()) {
      case EQUALS -> version.compareTo(target) == 0;
      case DOES_NOT_EQUAL -> version.compareTo(target) != 0;
      case GREATER_THAN -> version.compareTo(target) > 0;
      case GREATER_THAN_OR_EQUAL -> version.compareTo(target) >= 0;
      case LESS_THAN -> version.compareTo(target) < 0;
      case LESS_THAN_OR_EQUAL -> version.compareTo(target) <= 0;
      case BETWEEN ->
          values.size() >= 2
              && version.compareTo(target) >= 0
              && version.compareTo(SemanticVersion.fromVersionString(values.get(1))) <= 0;
      default -> unsupported(condition);
    };
  }

  private static boolean matchesList(Condition condition, EvaluationContext context) {
    final Optional<String> userValue = context.first(condition.type().attributeName());
    if (userValue.isEmpty() || userValue.get().isEmpty()) {
      return false;
    }
    final List<String> values = condition.values();
    return switch (condition.operator()) {
      case IN -> values.contains(userValue.get());
      case NOT_IN -> !values.contains(userValue.get());
      case EQUALS -> !values.isEmpty() && values.get(0).equals(userValue.get());
      case DOES_NOT_EQUAL -> !values.isEmpty() && !values.get(0).equals(userValue.get());
      default -> unsupported(condition);
    };
  }

  private static boolean matchesCohort(Condition condition, Set<String> cohorts) {
    final ConditionOperator operator = condition.operator();
    return switch (operator) {
      case IN, IS_IN_COHORT -> condition.values().stream().anyMatch(cohorts::contains);
      case NOT_IN, IS_NOT_IN_COHORT -> condition.values().stream().noneMatch(cohorts::contains);
      default -> unsupported(condition);
    };
  }

  private boolean matchesCustom(Condition condition, EvaluationContext context) {
    final Optional<Boolean> resolved = customResolver.resolve(condition, context);
    if (resolved.isEmpty()) {
      log.debug("Custom condition {} was not resolved, treating as no match", condition.id());
      return false;
    }
    return resolved.get();
  }

  private static boolean unsupported(Condition condition) {
    log.debug(
        "Operator {} is not supported for {} conditions (condition {})",
        condition.operator(),
        condition.type(),
        condition.id());
    return false;
  }
}
