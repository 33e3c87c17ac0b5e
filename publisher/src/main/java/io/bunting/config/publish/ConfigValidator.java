package io.bunting.config.publish;

import com.fasterxml.jackson.databind.JsonNode;
import io.bunting.config.ArtifactCodec;
import io.bunting.config.ConditionOperator;
import io.bunting.config.ConditionType;
import io.bunting.config.ConfigArtifact;
import io.bunting.config.Environment;
import io.bunting.config.FlagType;
import io.bunting.config.IdentifierKeys;
import io.bunting.config.KeyError;
import io.bunting.config.publish.ValidationIssue.Code;
import io.bunting.config.publish.ValidationIssue.Subject;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks an artifact for problems that would make it unsafe to publish.
 *
 * <p>Validation runs over the wire tree rather than the typed model, so values the typed model
 * cannot represent (a flag type of {@code "boolean"}, a condition without a type) are reported
 * instead of failing a parse. Validation never throws; every problem becomes a {@link
 * ValidationIssue}.
 */
public class ConfigValidator {

  private static final Logger log = LoggerFactory.getLogger(ConfigValidator.class);

  public ValidationResult validate(ConfigArtifact artifact) {
    return validate(ArtifactCodec.toTree(artifact));
  }

  public ValidationResult validate(JsonNode root) {
    final List<ValidationIssue> issues = new ArrayList<>();
    if (root == null || !root.isObject()) {
      issues.add(
          new ValidationIssue(
              Code.MALFORMED_ARTIFACT, Subject.ARTIFACT, "", "Artifact is not a JSON object"));
      return ValidationResult.of(issues);
    }
    new Pass(root, issues).run();
    final ValidationResult result = ValidationResult.of(issues);
    log.debug(
        "Validated artifact for {}: {} error(s), {} warning(s)",
        root.path("app_identifier").asText("?"),
        result.errors().size(),
        result.warnings().size());
    return result;
  }

  /** One validation run; holds the reference sets the checks resolve names against. */
  private static final class Pass {
    private final JsonNode root;
    private final List<ValidationIssue> issues;
    private final Set<String> cohortKeys;
    private final Set<String> testKeys;
    private final Set<String> rolloutKeys;

    Pass(JsonNode root, List<ValidationIssue> issues) {
      this.root = root;
      this.issues = issues;
      this.cohortKeys = keys("cohorts");
      this.testKeys = keys("tests");
      this.rolloutKeys = keys("rollouts");
    }

    void run() {
      checkArtifact();
      entries("cohorts").forEach(this::checkCohort);
      entries("flags").forEach(this::checkFlag);
      entries("tests").forEach(this::checkTest);
      entries("rollouts").forEach(this::checkRollout);
    }

    private void checkArtifact() {
      final JsonNode schemaVersion = root.get("schema_version");
      if (schemaVersion == null
          || !schemaVersion.canConvertToInt()
          || schemaVersion.intValue() != ConfigArtifact.SCHEMA_VERSION) {
        report(
            Code.MALFORMED_ARTIFACT,
            Subject.ARTIFACT,
            "",
            String.format(
                "Artifact has schema_version %s, expected %d",
                schemaVersion, ConfigArtifact.SCHEMA_VERSION));
      }
      final String appIdentifier = root.path("app_identifier").asText("");
      IdentifierKeys.validateAppIdentifier(appIdentifier)
          .ifPresent(message -> report(Code.INVALID_KEY, Subject.ARTIFACT, appIdentifier, message));
      for (String section : List.of("cohorts", "flags", "tests", "rollouts")) {
        final JsonNode node = root.get(section);
        if (node != null && !node.isNull() && !node.isObject()) {
          report(
              Code.MALFORMED_ARTIFACT,
              Subject.ARTIFACT,
              section,
              String.format("Artifact field \"%s\" is not an object", section));
        }
      }
    }

    private void checkCohort(String key, JsonNode cohort) {
      checkKey(Subject.COHORT, "Cohort", key);
      final String name = cohort.path("name").asText(key);
      final JsonNode conditions = cohort.path("conditions");
      if (!conditions.isArray() || conditions.isEmpty()) {
        report(
            Code.EMPTY_COHORT,
            Subject.COHORT,
            key,
            String.format("Cohort \"%s\" has no conditions", name));
        return;
      }
      for (JsonNode condition : conditions) {
        final String id = condition.path("id").asText("");
        final Optional<String> type = text(condition, "type");
        if (type.isEmpty()) {
          report(
              Code.INVALID_CONDITION,
              Subject.COHORT,
              key,
              String.format("Condition \"%s\" in cohort \"%s\" has no type", id, name));
        } else if (type.get().equals(ConditionType.COHORT.wireName())) {
          report(
              Code.CIRCULAR_COHORT_REFERENCE,
              Subject.COHORT,
              key,
              String.format(
                  "Cohort \"%s\" references other cohorts in condition \"%s\"", name, id));
        } else {
          checkCondition(condition, Subject.COHORT, key, "cohort \"" + name + "\"");
        }
      }
    }

    private void checkFlag(String key, JsonNode flag) {
      checkKey(Subject.FLAG, "Flag", key);
      final Optional<FlagType> type = text(flag, "type").flatMap(FlagType::fromWireName);
      if (type.isEmpty()) {
        report(
            Code.INVALID_TYPE,
            Subject.FLAG,
            key,
            String.format("Flag \"%s\" has invalid type \"%s\"", key, flag.path("type").asText()));
      }
      for (Environment environment : Environment.values()) {
        final JsonNode config = flag.get(environment.wireName());
        if (config == null || !config.isObject()) {
          report(
              Code.MISSING_DEFAULT,
              Subject.FLAG,
              key,
              String.format(
                  "Flag \"%s\" has no configuration for %s environment", key, environment));
          continue;
        }
        checkDefault(key, environment, config.get("default"), type);
        final JsonNode variants = config.path("variants");
        if (variants.isArray()) {
          for (int i = 0; i < variants.size(); i++) {
            checkVariant(key, environment, i + 1, variants.get(i));
          }
        }
      }
    }

    private void checkDefault(
        String key, Environment environment, JsonNode value, Optional<FlagType> type) {
      if (value == null || value.isNull()) {
        report(
            Code.MISSING_DEFAULT,
            Subject.FLAG,
            key,
            String.format(
                "Flag \"%s\" is missing default value for %s environment", key, environment));
        return;
      }
      if (type.isEmpty()) {
        return;
      }
      if (type.get() == FlagType.JSON
          && value.isTextual()
          && !ArtifactCodec.isValidJson(value.textValue())) {
        report(
            Code.INVALID_JSON,
            Subject.FLAG,
            key,
            String.format(
                "Flag \"%s\" has invalid JSON default value in %s environment", key, environment));
      } else if (!type.get().accepts(value)) {
        report(
            Code.INVALID_DEFAULT_VALUE,
            Subject.FLAG,
            key,
            String.format(
                "Flag \"%s\" default value %s in %s environment is not a valid %s",
                key, ArtifactCodec.write(value), environment, type.get()));
      }
    }

    private void checkVariant(String key, Environment environment, int index, JsonNode variant) {
      final String where = String.format("variant %d in flag \"%s\" (%s)", index, key, environment);
      if (!variant.isObject() || !variant.path("type").isTextual()) {
        report(
            Code.MALFORMED_ARTIFACT,
            Subject.FLAG,
            key,
            String.format("Expected a variant object with a type for %s", where));
        return;
      }
      final String tag = variant.get("type").textValue();
      switch (tag) {
        case "conditional" -> {
          final JsonNode conditions = variant.path("conditions");
          if (!variant.has("value")) {
            report(
                Code.MALFORMED_ARTIFACT,
                Subject.FLAG,
                key,
                String.format("Conditional %s has no value", where));
          }
          if (!conditions.isArray() || conditions.isEmpty()) {
            report(
                Code.EMPTY_VARIANT,
                Subject.FLAG,
                key,
                String.format(
                    "Variant %d in flag \"%s\" (%s) has no conditions", index, key, environment));
          } else {
            checkConditions(conditions, Subject.FLAG, key, where);
          }
        }
        case "test" -> {
          final String test = variant.path("test").asText("");
          if (!testKeys.contains(test)) {
            report(
                Code.MISSING_TEST_REFERENCE,
                Subject.FLAG,
                key,
                String.format("Test \"%s\" referenced in %s does not exist", test, where));
          }
        }
        case "rollout" -> {
          final String rollout = variant.path("rollout").asText("");
          if (!rolloutKeys.contains(rollout)) {
            report(
                Code.MISSING_ROLLOUT_REFERENCE,
                Subject.FLAG,
                key,
                String.format("Rollout \"%s\" referenced in %s does not exist", rollout, where));
          }
        }
        default ->
            report(
                Code.MALFORMED_ARTIFACT,
                Subject.FLAG,
                key,
                String.format("Unknown variant type \"%s\" for %s", tag, where));
      }
    }

    private void checkTest(String key, JsonNode test) {
      checkKey(Subject.TEST, "Test", key);
      checkSalt(Subject.TEST, "Test", key, test);
      checkConditions(test.path("conditions"), Subject.TEST, key, "test \"" + key + "\"");
      long total = 0;
      for (JsonNode group : test.path("groups")) {
        final JsonNode percentage = group.get("percentage");
        if (!isPercentage(percentage)) {
          report(
              Code.INVALID_PERCENTAGE,
              Subject.TEST,
              key,
              String.format(
                  "Group \"%s\" of test \"%s\" has invalid percentage %s",
                  group.path("name").asText(), key, percentage));
        } else {
          total += percentage.intValue();
        }
      }
      if (total > 100) {
        report(
            Code.INVALID_PERCENTAGE,
            Subject.TEST,
            key,
            String.format("Groups of test \"%s\" add up to %d%%, above 100%%", key, total));
      }
    }

    private void checkRollout(String key, JsonNode rollout) {
      checkKey(Subject.ROLLOUT, "Rollout", key);
      checkSalt(Subject.ROLLOUT, "Rollout", key, rollout);
      checkConditions(rollout.path("conditions"), Subject.ROLLOUT, key, "rollout \"" + key + "\"");
      final JsonNode percentage = rollout.get("percentage");
      if (!isPercentage(percentage)) {
        report(
            Code.INVALID_PERCENTAGE,
            Subject.ROLLOUT,
            key,
            String.format(
                "Rollout \"%s\" has percentage %s, expected 0 to 100", key, percentage));
      }
    }

    private void checkSalt(Subject subject, String kind, String key, JsonNode node) {
      if (text(node, "salt").isEmpty()) {
        report(
            Code.MALFORMED_ARTIFACT,
            subject,
            key,
            String.format("%s \"%s\" has no salt", kind, key));
      }
    }

    private void checkConditions(JsonNode conditions, Subject subject, String key, String where) {
      for (JsonNode condition : conditions) {
        if (text(condition, "type").isEmpty()) {
          report(
              Code.INVALID_CONDITION,
              subject,
              key,
              String.format(
                  "Condition \"%s\" in %s has no type", condition.path("id").asText(""), where));
        } else {
          checkCondition(condition, subject, key, where);
        }
      }
    }

    /** Checks a condition whose type is present. */
    private void checkCondition(JsonNode condition, Subject subject, String key, String where) {
      final String id = condition.path("id").asText("");
      final String typeName = condition.path("type").asText();
      final Optional<ConditionType> type = ConditionType.fromWireName(typeName);
      if (type.isEmpty()) {
        report(
            Code.INVALID_CONDITION,
            subject,
            key,
            String.format("Condition \"%s\" in %s has unknown type \"%s\"", id, where, typeName));
        return;
      }
      final String operator = condition.path("operator").asText("");
      if (ConditionOperator.fromWireName(operator).isEmpty()) {
        report(
            Code.INVALID_CONDITION,
            subject,
            key,
            String.format(
                "Condition \"%s\" in %s has unknown operator \"%s\"", id, where, operator));
      }
      if (type.get() == ConditionType.COHORT) {
        for (JsonNode value : condition.path("values")) {
          if (!cohortKeys.contains(value.asText())) {
            report(
                Code.MISSING_COHORT_REFERENCE,
                subject,
                key,
                String.format(
                    "Cohort \"%s\" referenced in %s does not exist", value.asText(), where));
          }
        }
      }
    }

    private void checkKey(Subject subject, String kind, String key) {
      final Optional<KeyError> keyError = IdentifierKeys.validate(key);
      keyError.ifPresent(
          e ->
              report(
                  Code.INVALID_KEY,
                  subject,
                  key,
                  String.format("%s key \"%s\" is invalid: %s", kind, key, e.message())));
    }

    private Set<String> keys(String section) {
      final Set<String> keys = new HashSet<>();
      root.path(section).fieldNames().forEachRemaining(keys::add);
      return keys;
    }

    private Map<String, JsonNode> entries(String section) {
      final Map<String, JsonNode> entries = new LinkedHashMap<>();
      final JsonNode node = root.path(section);
      if (!node.isObject()) {
        return entries;
      }
      final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        final Map.Entry<String, JsonNode> entry = fields.next();
        if (entry.getValue().isObject()) {
          entries.put(entry.getKey(), entry.getValue());
        } else {
          report(
              Code.MALFORMED_ARTIFACT,
              Subject.ARTIFACT,
              entry.getKey(),
              String.format("Entry \"%s\" in %s is not an object", entry.getKey(), section));
        }
      }
      return entries;
    }

    private static boolean isPercentage(JsonNode node) {
      return node != null
          && node.isIntegralNumber()
          && node.canConvertToInt()
          && node.intValue() >= 0
          && node.intValue() <= 100;
    }

    private static Optional<String> text(JsonNode node, String field) {
      final JsonNode value = node.get(field);
      if (value == null || !value.isTextual() || value.textValue().isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(value.textValue());
    }

    private void report(Code code, Subject subject, String key, String message) {
      issues.add(new ValidationIssue(code, subject, key, message));
    }
  }
}
