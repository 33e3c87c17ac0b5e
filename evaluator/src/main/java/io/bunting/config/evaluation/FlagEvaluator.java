package io.bunting.config.evaluation;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableSet;
import io.bunting.config.CohortDefinition;
import io.bunting.config.ConditionalVariant;
import io.bunting.config.ConfigArtifact;
import io.bunting.config.Environment;
import io.bunting.config.EnvironmentConfig;
import io.bunting.config.Exceptions.FlagNotFoundException;
import io.bunting.config.FlagDefinition;
import io.bunting.config.RolloutDefinition;
import io.bunting.config.RolloutVariant;
import io.bunting.config.TestDefinition;
import io.bunting.config.TestVariant;
import io.bunting.config.Variant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a flag's value for one user.
 *
 * <p>The variants of the selected environment are walked by ascending order and the first one
 * that matches supplies the value; when none matches the environment default is returned. A
 * test or rollout variant whose definition is missing from the artifact never matches. Instances
 * hold no per-call state and can be shared between threads.
 */
public class FlagEvaluator {

  private static final Logger log = LoggerFactory.getLogger(FlagEvaluator.class);

  private final ConditionEvaluator conditions;

  public FlagEvaluator() {
    this(CustomConditionResolver.NONE);
  }

  public FlagEvaluator(CustomConditionResolver customResolver) {
    this.conditions = new ConditionEvaluator(customResolver);
  }

  /**
   * @throws IllegalArgumentException if {@code environment} is not a canonical environment name
   * @throws FlagNotFoundException if the artifact has no such flag
   */
  public FlagEvaluation evaluate(
      ConfigArtifact artifact, String environment, String flagKey, EvaluationContext context) {
    return evaluate(artifact, Environment.fromWireName(environment), flagKey, context);
  }

  /**
   * @throws FlagNotFoundException if the artifact has no such flag
   */
  public FlagEvaluation evaluate(
      ConfigArtifact artifact,
      Environment environment,
      String flagKey,
      EvaluationContext context) {
    requireNonNull(environment, "environment");
    requireNonNull(context, "context");
    final FlagDefinition flag = artifact.flags().get(flagKey);
    if (flag == null) {
      throw new FlagNotFoundException(flagKey);
    }
    final EnvironmentConfig config = flag.environment(environment);
    final Supplier<Set<String>> cohorts =
        Suppliers.memoize(() -> cohortsFor(artifact, context));

    for (Variant variant : config.sortedVariants()) {
      final Optional<FlagEvaluation> evaluation =
          evaluateVariant(artifact, environment, variant, context, cohorts);
      if (evaluation.isPresent()) {
        log.debug(
            "Flag {} resolved by {} variant with order {}",
            flagKey,
            variant.type(),
            variant.order());
        return evaluation.get();
      }
    }
    return FlagEvaluation.defaultValue(config.defaultValue());
  }

  /**
   * The user's cohorts: the explicit {@code cohort} attribute values together with every cohort
   * of the artifact whose conditions all match.
   */
  public Set<String> cohortsFor(ConfigArtifact artifact, EvaluationContext context) {
    final ImmutableSet.Builder<String> cohorts = ImmutableSet.builder();
    cohorts.addAll(context.values(EvaluationContext.COHORT_ATTRIBUTE));
    final Supplier<Set<String>> explicitOnly =
        () -> ImmutableSet.copyOf(context.values(EvaluationContext.COHORT_ATTRIBUTE));
    for (Map.Entry<String, CohortDefinition> entry : artifact.cohorts().entrySet()) {
      final CohortDefinition cohort = entry.getValue();
      // an empty cohort matches nobody
      if (!cohort.conditions().isEmpty()
          && conditions.matchesAll(cohort.conditions(), context, explicitOnly)) {
        cohorts.add(entry.getKey());
      }
    }
    return cohorts.build();
  }

  private Optional<FlagEvaluation> evaluateVariant(
      ConfigArtifact artifact,
      Environment environment,
      Variant variant,
      EvaluationContext context,
      Supplier<Set<String>> cohorts) {
    if (variant instanceof ConditionalVariant conditional) {
      if (conditions.matchesAll(conditional.conditions(), context, cohorts)) {
        return Optional.of(
            FlagEvaluation.matched(conditional.value(), EvaluationReason.CONDITIONAL, variant));
      }
      return Optional.empty();
    } else if (variant instanceof TestVariant test) {
      return evaluateTest(artifact, environment, test, context, cohorts);
    } else if (variant instanceof RolloutVariant rollout) {
      return evaluateRollout(artifact, environment, rollout, context, cohorts);
    }
    throw new IllegalStateException("Unknown variant " + variant);
  }

  private Optional<FlagEvaluation> evaluateTest(
      ConfigArtifact artifact,
      Environment environment,
      TestVariant variant,
      EvaluationContext context,
      Supplier<Set<String>> cohorts) {
    final TestDefinition test = artifact.tests().get(variant.test());
    if (test == null) {
      log.warn("Variant references test {} which is not in the artifact", variant.test());
      return Optional.empty();
    }
    if (!conditions.matchesAll(test.conditions(), context, cohorts)) {
      return Optional.empty();
    }
    final Optional<String> groupName =
        Bucketing.assignGroup(
            test.salt(),
            context.localId(),
            test.groups().stream()
                .map(group -> new Bucketing.Weight(group.name(), group.percentage()))
                .toList());
    if (groupName.isEmpty()) {
      return Optional.empty();
    }
    final Optional<JsonNode> value =
        variant
            .value()
            .or(
                () ->
                    test.groups().stream()
                        .filter(group -> group.name().equals(groupName.get()))
                        .findFirst()
                        .flatMap(group -> group.valueFor(environment)));
    return value.map(v -> FlagEvaluation.testGroup(v, variant, groupName.get()));
  }

  private Optional<FlagEvaluation> evaluateRollout(
      ConfigArtifact artifact,
      Environment environment,
      RolloutVariant variant,
      EvaluationContext context,
      Supplier<Set<String>> cohorts) {
    final RolloutDefinition rollout = artifact.rollouts().get(variant.rollout());
    if (rollout == null) {
      log.warn("Variant references rollout {} which is not in the artifact", variant.rollout());
      return Optional.empty();
    }
    if (!conditions.matchesAll(rollout.conditions(), context, cohorts)) {
      return Optional.empty();
    }
    if (!Bucketing.isInRollout(rollout.salt(), context.localId(), rollout.percentage())) {
      return Optional.empty();
    }
    return variant
        .value()
        .or(() -> rollout.valueFor(environment))
        .map(value -> FlagEvaluation.matched(value, EvaluationReason.ROLLOUT, variant));
  }
}
