package io.bunting.config.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Strings;
import io.bunting.config.CohortDefinition;
import io.bunting.config.Condition;
import io.bunting.config.ConditionOperator;
import io.bunting.config.ConditionType;
import io.bunting.config.ConditionalVariant;
import io.bunting.config.ConfigArtifact;
import io.bunting.config.Environment;
import io.bunting.config.EnvironmentConfig;
import io.bunting.config.Exceptions.CompileException;
import io.bunting.config.FlagDefinition;
import io.bunting.config.FlagType;
import io.bunting.config.IdentifierKeys;
import io.bunting.config.KeyError;
import io.bunting.config.RolloutDefinition;
import io.bunting.config.RolloutVariant;
import io.bunting.config.TestDefinition;
import io.bunting.config.TestGroup;
import io.bunting.config.TestVariant;
import io.bunting.config.Variant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an {@link AppSnapshot} into an unpublished {@link ConfigArtifact}.
 *
 * <p>Archived flags, tests and rollouts are left out. Every structural problem found in the pass
 * is collected and reported together in one {@link CompileException}. Semantic checks such as
 * dangling references and percentages are left to {@link ConfigValidator}.
 */
public class ConfigCompiler {

  private static final Logger log = LoggerFactory.getLogger(ConfigCompiler.class);

  public ConfigArtifact compile(AppSnapshot snapshot) {
    final List<String> problems = new ArrayList<>();

    IdentifierKeys.validateAppIdentifier(snapshot.appIdentifier())
        .ifPresent(message -> problems.add(message + ": \"" + snapshot.appIdentifier() + "\""));

    final SortedMap<String, CohortDefinition> cohorts = new TreeMap<>();
    for (StoredCohort cohort : snapshot.cohorts()) {
      if (!checkKey("Cohort", cohort.key(), cohorts, problems)) {
        continue;
      }
      compileCohort(cohort, problems)
          .ifPresent(definition -> cohorts.put(cohort.key(), definition));
    }

    final SortedMap<String, FlagDefinition> flags = new TreeMap<>();
    for (StoredFlag flag : snapshot.flags()) {
      if (flag.archived()) {
        log.debug("Skipping archived flag {}", flag.key());
        continue;
      }
      if (!checkKey("Flag", flag.key(), flags, problems)) {
        continue;
      }
      compileFlag(flag, problems).ifPresent(definition -> flags.put(flag.key(), definition));
    }

    final SortedMap<String, TestDefinition> tests = new TreeMap<>();
    for (StoredTest test : snapshot.tests()) {
      if (test.archived()) {
        log.debug("Skipping archived test {}", test.key());
        continue;
      }
      if (!checkKey("Test", test.key(), tests, problems)) {
        continue;
      }
      compileTest(test, problems).ifPresent(definition -> tests.put(test.key(), definition));
    }

    final SortedMap<String, RolloutDefinition> rollouts = new TreeMap<>();
    for (StoredRollout rollout : snapshot.rollouts()) {
      if (rollout.archived()) {
        log.debug("Skipping archived rollout {}", rollout.key());
        continue;
      }
      if (!checkKey("Rollout", rollout.key(), rollouts, problems)) {
        continue;
      }
      compileRollout(rollout, problems)
          .ifPresent(definition -> rollouts.put(rollout.key(), definition));
    }

    if (!problems.isEmpty()) {
      log.info(
          "Compiling app {} failed with {} problem(s)",
          snapshot.appIdentifier(),
          problems.size());
      throw new CompileException(problems);
    }
    log.debug(
        "Compiled app {}: {} flags, {} cohorts, {} tests, {} rollouts",
        snapshot.appIdentifier(),
        flags.size(),
        cohorts.size(),
        tests.size(),
        rollouts.size());
    return ConfigArtifact.unpublished(snapshot.appIdentifier(), cohorts, flags, tests, rollouts);
  }

  // the key is validated before the lookup, sorted maps reject null keys
  private static boolean checkKey(
      String kind, String key, Map<String, ?> compiled, List<String> problems) {
    final Optional<KeyError> error = IdentifierKeys.validate(key);
    if (error.isPresent()) {
      problems.add(
          String.format("%s key \"%s\" is invalid: %s", kind, key, error.get().message()));
      return false;
    }
    if (compiled.containsKey(key)) {
      problems.add(String.format("%s key \"%s\" is used more than once", kind, key));
      return false;
    }
    return true;
  }

  private static Optional<CohortDefinition> compileCohort(
      StoredCohort cohort, List<String> problems) {
    final String where = "cohort \"" + cohort.key() + "\"";
    final int before = problems.size();
    final List<Condition> conditions = compileConditions(cohort.conditions(), where, problems);
    for (Condition condition : conditions) {
      if (condition.type().kind() == ConditionType.Kind.COHORT) {
        problems.add(
            String.format(
                "Condition \"%s\" in %s references another cohort", condition.id(), where));
      }
    }
    if (problems.size() > before) {
      return Optional.empty();
    }
    return Optional.of(
        new CohortDefinition(
            nameOrDisplayName(cohort.name(), cohort.key()), cohort.description(), conditions));
  }

  private static Optional<FlagDefinition> compileFlag(StoredFlag flag, List<String> problems) {
    final String key = flag.key();
    final Optional<FlagType> type =
        Optional.ofNullable(flag.type())
            .map(name -> name.toLowerCase(Locale.ROOT))
            .flatMap(FlagType::fromWireName);
    if (type.isEmpty()) {
      problems.add(String.format("Flag \"%s\" has unrecognized type \"%s\"", key, flag.type()));
    }

    final Map<Environment, EnvironmentConfig> environments = new EnumMap<>(Environment.class);
    for (Environment environment : Environment.values()) {
      final JsonNode defaultValue = flag.defaults().get(environment.wireName());
      final List<Variant> variants =
          compileVariants(
              flag.variants().getOrDefault(environment.wireName(), List.of()),
              String.format("flag \"%s\" (%s)", key, environment),
              problems);
      if (defaultValue == null || defaultValue.isNull() || defaultValue.isMissingNode()) {
        problems.add(
            String.format("Flag \"%s\" is missing a default value for %s", key, environment));
        continue;
      }
      environments.put(environment, new EnvironmentConfig(defaultValue, Variant.sorted(variants)));
    }
    for (String environmentName : flag.defaults().keySet()) {
      if (Environment.find(environmentName).isEmpty()) {
        problems.add(
            String.format(
                "Flag \"%s\" has a default for unknown environment \"%s\"",
                key, environmentName));
      }
    }

    if (type.isEmpty() || environments.size() != Environment.values().length) {
      return Optional.empty();
    }
    return Optional.of(new FlagDefinition(type.get(), flag.description(), environments));
  }

  private static List<Variant> compileVariants(
      List<StoredVariant> stored, String where, List<String> problems) {
    final List<Variant> variants = new ArrayList<>();
    for (int i = 0; i < stored.size(); i++) {
      final StoredVariant variant = stored.get(i);
      final String variantWhere = String.format("variant %d in %s", i + 1, where);
      final String tag =
          variant.type() == null ? "conditional" : variant.type().toLowerCase(Locale.ROOT);
      final int order = variant.order() == null ? 0 : variant.order();
      final Optional<JsonNode> value = presentValue(variant.value());
      final Optional<Variant.Type> type = Variant.Type.fromWireName(tag);
      if (type.isEmpty()) {
        problems.add(
            String.format("Unknown variant type \"%s\" for %s", variant.type(), variantWhere));
        continue;
      }
      switch (type.get()) {
        case CONDITIONAL -> {
          final List<Condition> conditions =
              compileConditions(variant.conditions(), variantWhere, problems);
          if (value.isEmpty()) {
            problems.add("Missing value for conditional " + variantWhere);
          } else {
            variants.add(new ConditionalVariant(order, value.get(), conditions));
          }
        }
        case TEST -> {
          if (Strings.isNullOrEmpty(variant.test())) {
            problems.add("Missing test name for test " + variantWhere);
          } else {
            variants.add(new TestVariant(order, variant.test(), value));
          }
        }
        case ROLLOUT -> {
          if (Strings.isNullOrEmpty(variant.rollout())) {
            problems.add("Missing rollout name for rollout " + variantWhere);
          } else {
            variants.add(new RolloutVariant(order, variant.rollout(), value));
          }
        }
      }
    }
    return variants;
  }

  private static Optional<TestDefinition> compileTest(StoredTest test, List<String> problems) {
    final String where = "test \"" + test.key() + "\"";
    final int before = problems.size();
    if (Strings.isNullOrEmpty(test.salt())) {
      problems.add("Missing salt for " + where);
    }
    final List<Condition> conditions = compileConditions(test.conditions(), where, problems);
    final List<TestGroup> groups = new ArrayList<>();
    for (StoredTestGroup group : test.groups()) {
      final String groupWhere = String.format("group \"%s\" of %s", group.name(), where);
      if (Strings.isNullOrEmpty(group.name())) {
        problems.add("Missing group name in " + where);
        continue;
      }
      if (group.percentage() < 0) {
        problems.add(
            String.format("Negative percentage %d for %s", group.percentage(), groupWhere));
        continue;
      }
      groups.add(
          new TestGroup(
              group.name(),
              group.percentage(),
              environmentValues(group.values(), groupWhere, problems)));
    }
    if (problems.size() > before) {
      return Optional.empty();
    }
    return Optional.of(
        new TestDefinition(
            nameOrDisplayName(test.name(), test.key()),
            test.description(),
            test.salt(),
            conditions,
            groups));
  }

  private static Optional<RolloutDefinition> compileRollout(
      StoredRollout rollout, List<String> problems) {
    final String where = "rollout \"" + rollout.key() + "\"";
    final int before = problems.size();
    if (Strings.isNullOrEmpty(rollout.salt())) {
      problems.add("Missing salt for " + where);
    }
    final List<Condition> conditions = compileConditions(rollout.conditions(), where, problems);
    final Map<Environment, JsonNode> values =
        environmentValues(rollout.values(), where, problems);
    if (problems.size() > before) {
      return Optional.empty();
    }
    return Optional.of(
        new RolloutDefinition(
            nameOrDisplayName(rollout.name(), rollout.key()),
            rollout.description(),
            rollout.salt(),
            conditions,
            rollout.percentage() == null ? 0 : rollout.percentage(),
            values));
  }

  private static List<Condition> compileConditions(
      List<StoredCondition> stored, String where, List<String> problems) {
    final List<Condition> conditions = new ArrayList<>();
    for (StoredCondition condition : stored) {
      final String conditionWhere = String.format("condition \"%s\" in %s", condition.id(), where);
      IdentifierKeys.validateConditionId(condition.id())
          .ifPresent(message -> problems.add(message + " (" + conditionWhere + ")"));
      final Optional<ConditionType> type =
          Optional.ofNullable(condition.type())
              .map(name -> name.toLowerCase(Locale.ROOT))
              .flatMap(ConditionType::fromWireName);
      if (type.isEmpty()) {
        problems.add(
            String.format(
                "Unknown condition type \"%s\" for %s", condition.type(), conditionWhere));
      }
      final Optional<ConditionOperator> operator =
          Optional.ofNullable(condition.operator())
              .map(name -> name.toLowerCase(Locale.ROOT))
              .flatMap(ConditionOperator::fromWireName);
      if (operator.isEmpty()) {
        problems.add(
            String.format(
                "Unknown condition operator \"%s\" for %s", condition.operator(), conditionWhere));
      }
      final Optional<String> attribute =
          Optional.ofNullable(Strings.emptyToNull(condition.attribute()));
      if (type.isPresent() && type.get() == ConditionType.CUSTOM_ATTRIBUTE && attribute.isEmpty()) {
        problems.add("Missing attribute name for custom " + conditionWhere);
        continue;
      }
      if (condition.id() == null || type.isEmpty() || operator.isEmpty()) {
        continue;
      }
      conditions.add(
          new Condition(
              condition.id(),
              type.get(),
              operator.get(),
              condition.values(),
              type.get() == ConditionType.CUSTOM_ATTRIBUTE ? attribute : Optional.empty()));
    }
    return conditions;
  }

  private static Map<Environment, JsonNode> environmentValues(
      Map<String, JsonNode> stored, String where, List<String> problems) {
    final Map<Environment, JsonNode> values = new EnumMap<>(Environment.class);
    stored.forEach(
        (name, value) -> {
          final Optional<Environment> environment = Environment.find(name);
          if (environment.isEmpty()) {
            problems.add(String.format("Unknown environment \"%s\" in %s", name, where));
          } else {
            presentValue(value).ifPresent(v -> values.put(environment.get(), v));
          }
        });
    return values;
  }

  private static Optional<JsonNode> presentValue(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return Optional.empty();
    }
    return Optional.of(value);
  }

  private static String nameOrDisplayName(String name, String key) {
    return Strings.isNullOrEmpty(name) ? IdentifierKeys.displayName(key) : name;
  }
}
