package io.bunting.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Reads and writes the artifact wire format.
 *
 * <p>Output is canonical: top-level fields in a fixed order, every keyed map sorted by key, each
 * nested object in a fixed field order, no insignificant whitespace. Two equal artifacts therefore
 * serialize to the same bytes, which is what signatures are computed over.
 */
public final class ArtifactCodec {

  private static final ObjectMapper MAPPER =
      new ObjectMapper().enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY);
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
  private static final DateTimeFormatter PUBLISHED_AT_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  private ArtifactCodec() {}

  public static String toJson(ConfigArtifact artifact) {
    return write(toTree(artifact));
  }

  public static ObjectNode toTree(ConfigArtifact artifact) {
    final ObjectNode root = NODES.objectNode();
    root.put("schema_version", artifact.schemaVersion());
    root.set("config_version", artifact.configVersion().map(NODES::textNode).orElse(null));
    root.set(
        "published_at",
        artifact
            .publishedAt()
            .map(instant -> NODES.textNode(formatInstant(instant)))
            .orElse(null));
    root.put("app_identifier", artifact.appIdentifier());

    final ObjectNode cohorts = root.putObject("cohorts");
    artifact.cohorts().forEach((key, cohort) -> cohorts.set(key, cohortToTree(cohort)));
    final ObjectNode flags = root.putObject("flags");
    artifact.flags().forEach((key, flag) -> flags.set(key, flagToTree(flag)));
    final ObjectNode tests = root.putObject("tests");
    artifact.tests().forEach((key, test) -> tests.set(key, testToTree(test)));
    final ObjectNode rollouts = root.putObject("rollouts");
    artifact.rollouts().forEach((key, rollout) -> rollouts.set(key, rolloutToTree(rollout)));
    return root;
  }

  /**
   * @throws Exceptions.ArtifactParseException if the text is not JSON or not a well-formed
   *     artifact
   */
  public static ConfigArtifact fromJson(String json) {
    return fromTree(readTree(json));
  }

  /**
   * Strict parse of a wire tree. Unknown flag types, variant tags, condition types and operators
   * are rejected rather than skipped; use the publisher's validator for a full problem report.
   *
   * @throws Exceptions.ArtifactParseException if the tree is not a well-formed artifact
   */
  public static ConfigArtifact fromTree(JsonNode root) {
    requireObject(root, "artifact");
    final int schemaVersion = requireInt(root, "schema_version", "artifact");
    if (schemaVersion != ConfigArtifact.SCHEMA_VERSION) {
      throw new Exceptions.ArtifactParseException(
          String.format(
              "Unsupported schema_version %d, expected %d",
              schemaVersion, ConfigArtifact.SCHEMA_VERSION));
    }
    final Optional<String> configVersion = optionalText(root, "config_version");
    final Optional<Instant> publishedAt =
        optionalText(root, "published_at").map(ArtifactCodec::parseInstant);
    final String appIdentifier = requireText(root, "app_identifier", "artifact");

    final SortedMap<String, CohortDefinition> cohorts = new TreeMap<>();
    fields(root, "cohorts").forEach((key, node) -> cohorts.put(key, cohortFromTree(key, node)));
    final SortedMap<String, FlagDefinition> flags = new TreeMap<>();
    fields(root, "flags").forEach((key, node) -> flags.put(key, flagFromTree(key, node)));
    final SortedMap<String, TestDefinition> tests = new TreeMap<>();
    fields(root, "tests").forEach((key, node) -> tests.put(key, testFromTree(key, node)));
    final SortedMap<String, RolloutDefinition> rollouts = new TreeMap<>();
    fields(root, "rollouts")
        .forEach((key, node) -> rollouts.put(key, rolloutFromTree(key, node)));

    return new ConfigArtifact(
        schemaVersion, configVersion, publishedAt, appIdentifier, cohorts, flags, tests, rollouts);
  }

  /**
   * @throws Exceptions.ArtifactParseException if the text is not a single JSON document
   */
  public static JsonNode readTree(String json) {
    if (json == null) {
      throw new Exceptions.ArtifactParseException("Artifact JSON is null");
    }
    try {
      final JsonNode node = MAPPER.readTree(json);
      if (node == null || node.isMissingNode()) {
        throw new Exceptions.ArtifactParseException("Artifact JSON is empty");
      }
      return node;
    } catch (JsonProcessingException e) {
      throw new Exceptions.ArtifactParseException("Malformed artifact JSON", e);
    }
  }

  public static boolean isValidJson(String text) {
    if (text == null || text.isBlank()) {
      return false;
    }
    try {
      MAPPER.readTree(text);
      return true;
    } catch (JsonProcessingException e) {
      return false;
    }
  }

  /** Compact serialization of any tree, preserving its field order. */
  public static String write(JsonNode node) {
    try {
      return MAPPER.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialize JSON tree", e);
    }
  }

  public static String formatInstant(Instant instant) {
    return PUBLISHED_AT_FORMAT.format(instant);
  }

  public static JsonNodeFactory nodes() {
    return NODES;
  }

  static ObjectNode conditionToTree(Condition condition) {
    final ObjectNode node = NODES.objectNode();
    node.put("id", condition.id());
    node.put("type", condition.type().wireName());
    node.put("operator", condition.operator().wireName());
    final ArrayNode values = node.putArray("values");
    condition.values().forEach(values::add);
    condition.attribute().ifPresent(attribute -> node.put("attribute", attribute));
    return node;
  }

  private static ArrayNode conditionsToTree(List<Condition> conditions) {
    final ArrayNode array = NODES.arrayNode();
    conditions.forEach(condition -> array.add(conditionToTree(condition)));
    return array;
  }

  private static ObjectNode cohortToTree(CohortDefinition cohort) {
    final ObjectNode node = NODES.objectNode();
    node.put("name", cohort.name());
    node.put("description", cohort.description());
    node.set("conditions", conditionsToTree(cohort.conditions()));
    return node;
  }

  private static ObjectNode flagToTree(FlagDefinition flag) {
    final ObjectNode node = NODES.objectNode();
    node.put("type", flag.type().wireName());
    node.put("description", flag.description());
    for (Environment environment : Environment.values()) {
      node.set(environment.wireName(), environmentToTree(flag.environment(environment)));
    }
    return node;
  }

  private static ObjectNode environmentToTree(EnvironmentConfig config) {
    final ObjectNode node = NODES.objectNode();
    node.set("default", config.defaultValue());
    final ArrayNode variants = node.putArray("variants");
    config.sortedVariants().forEach(variant -> variants.add(variantToTree(variant)));
    return node;
  }

  private static ObjectNode variantToTree(Variant variant) {
    final ObjectNode node = NODES.objectNode();
    node.put("type", variant.type().wireName());
    node.put("order", variant.order());
    if (variant instanceof ConditionalVariant conditional) {
      node.set("value", conditional.value());
      node.set("conditions", conditionsToTree(conditional.conditions()));
    } else if (variant instanceof TestVariant test) {
      test.value().ifPresent(value -> node.set("value", value));
      node.put("test", test.test());
    } else if (variant instanceof RolloutVariant rollout) {
      rollout.value().ifPresent(value -> node.set("value", value));
      node.put("rollout", rollout.rollout());
    }
    return node;
  }

  private static ObjectNode testToTree(TestDefinition test) {
    final ObjectNode node = NODES.objectNode();
    node.put("name", test.name());
    node.put("description", test.description());
    node.put("type", Variant.Type.TEST.wireName());
    node.put("salt", test.salt());
    node.set("conditions", conditionsToTree(test.conditions()));
    final ArrayNode groups = node.putArray("groups");
    for (TestGroup group : test.groups()) {
      final ObjectNode groupNode = groups.addObject();
      groupNode.put("name", group.name());
      groupNode.put("percentage", group.percentage());
      groupNode.set("values", valuesToTree(group.values()));
    }
    return node;
  }

  private static ObjectNode rolloutToTree(RolloutDefinition rollout) {
    final ObjectNode node = NODES.objectNode();
    node.put("name", rollout.name());
    node.put("description", rollout.description());
    node.put("type", Variant.Type.ROLLOUT.wireName());
    node.put("salt", rollout.salt());
    node.set("conditions", conditionsToTree(rollout.conditions()));
    node.put("percentage", rollout.percentage());
    node.set("values", valuesToTree(rollout.values()));
    return node;
  }

  private static ObjectNode valuesToTree(Map<Environment, JsonNode> values) {
    final ObjectNode node = NODES.objectNode();
    for (Environment environment : Environment.values()) {
      final JsonNode value = values.get(environment);
      if (value != null) {
        node.set(environment.wireName(), value);
      }
    }
    return node;
  }

  private static CohortDefinition cohortFromTree(String key, JsonNode node) {
    final String where = "cohort '" + key + "'";
    requireObject(node, where);
    final String name = requireText(node, "name", where);
    final List<Condition> conditions = conditionsFromTree(node.get("conditions"), where);
    final String description = optionalText(node, "description").orElse("");
    return construct(where, () -> new CohortDefinition(name, description, conditions));
  }

  private static FlagDefinition flagFromTree(String key, JsonNode node) {
    final String where = "flag '" + key + "'";
    requireObject(node, where);
    final String typeName = requireText(node, "type", where);
    final FlagType type =
        FlagType.fromWireName(typeName)
            .orElseThrow(
                () ->
                    new Exceptions.ArtifactParseException(
                        String.format("Unknown type '%s' in %s", typeName, where)));
    final Map<Environment, EnvironmentConfig> environments = new EnumMap<>(Environment.class);
    for (Environment environment : Environment.values()) {
      final String envWhere = where + " " + environment.wireName();
      final JsonNode envNode = node.get(environment.wireName());
      requireObject(envNode, envWhere);
      final JsonNode defaultValue = envNode.get("default");
      if (defaultValue == null) {
        throw new Exceptions.ArtifactParseException("Missing default in " + envWhere);
      }
      final List<Variant> variants = new ArrayList<>();
      for (JsonNode variantNode : arrayOrEmpty(envNode.get("variants"), envWhere)) {
        variants.add(variantFromTree(variantNode, envWhere));
      }
      environments.put(environment, new EnvironmentConfig(defaultValue, variants));
    }
    return construct(
        where,
        () -> new FlagDefinition(type, optionalText(node, "description").orElse(""), environments));
  }

  private static Variant variantFromTree(JsonNode node, String where) {
    requireObject(node, "variant in " + where);
    final String tag = requireText(node, "type", "variant in " + where);
    final Variant.Type type =
        Variant.Type.fromWireName(tag)
            .orElseThrow(
                () ->
                    new Exceptions.ArtifactParseException(
                        String.format("Unknown variant type '%s' in %s", tag, where)));
    final int order = node.path("order").asInt(0);
    final Optional<JsonNode> value = Optional.ofNullable(node.get("value"));
    return switch (type) {
      case CONDITIONAL ->
          new ConditionalVariant(
              order,
              value.orElseThrow(
                  () ->
                      new Exceptions.ArtifactParseException(
                          "Conditional variant without value in " + where)),
              conditionsFromTree(node.get("conditions"), where));
      case TEST -> new TestVariant(order, requireText(node, "test", where), value);
      case ROLLOUT -> new RolloutVariant(order, requireText(node, "rollout", where), value);
    };
  }

  private static TestDefinition testFromTree(String key, JsonNode node) {
    final String where = "test '" + key + "'";
    requireObject(node, where);
    final List<TestGroup> groups = new ArrayList<>();
    for (JsonNode groupNode : arrayOrEmpty(node.get("groups"), where)) {
      final String groupWhere = "group in " + where;
      requireObject(groupNode, groupWhere);
      final String name = requireText(groupNode, "name", groupWhere);
      final int percentage = requirePercentage(groupNode, groupWhere);
      final Map<Environment, JsonNode> values = valuesFromTree(groupNode.get("values"));
      groups.add(construct(groupWhere, () -> new TestGroup(name, percentage, values)));
    }
    return new TestDefinition(
        requireText(node, "name", where),
        optionalText(node, "description").orElse(""),
        requireText(node, "salt", where),
        conditionsFromTree(node.get("conditions"), where),
        groups);
  }

  private static RolloutDefinition rolloutFromTree(String key, JsonNode node) {
    final String where = "rollout '" + key + "'";
    requireObject(node, where);
    return new RolloutDefinition(
        requireText(node, "name", where),
        optionalText(node, "description").orElse(""),
        requireText(node, "salt", where),
        conditionsFromTree(node.get("conditions"), where),
        requirePercentage(node, where),
        valuesFromTree(node.get("values")));
  }

  private static Map<Environment, JsonNode> valuesFromTree(JsonNode node) {
    final Map<Environment, JsonNode> values = new EnumMap<>(Environment.class);
    if (node == null || !node.isObject()) {
      return values;
    }
    for (Environment environment : Environment.values()) {
      final JsonNode value = node.get(environment.wireName());
      if (value != null) {
        values.put(environment, value);
      }
    }
    return values;
  }

  private static List<Condition> conditionsFromTree(JsonNode node, String where) {
    final ImmutableList.Builder<Condition> conditions = ImmutableList.builder();
    for (JsonNode conditionNode : arrayOrEmpty(node, where)) {
      conditions.add(conditionFromTree(conditionNode, where));
    }
    return conditions.build();
  }

  static Condition conditionFromTree(JsonNode node, String where) {
    final String conditionWhere = "condition in " + where;
    requireObject(node, conditionWhere);
    final String typeName = requireText(node, "type", conditionWhere);
    final ConditionType type =
        ConditionType.fromWireName(typeName)
            .orElseThrow(
                () ->
                    new Exceptions.ArtifactParseException(
                        String.format(
                            "Unknown condition type '%s' in %s", typeName, conditionWhere)));
    final String operatorName = requireText(node, "operator", conditionWhere);
    final ConditionOperator operator =
        ConditionOperator.fromWireName(operatorName)
            .orElseThrow(
                () ->
                    new Exceptions.ArtifactParseException(
                        String.format(
                            "Unknown operator '%s' in %s", operatorName, conditionWhere)));
    final List<String> values = new ArrayList<>();
    for (JsonNode value : arrayOrEmpty(node.get("values"), conditionWhere)) {
      values.add(value.asText());
    }
    return new Condition(
        node.path("id").asText(""), type, operator, values, optionalText(node, "attribute"));
  }

  private static Map<String, JsonNode> fields(JsonNode root, String name) {
    final JsonNode node = root.get(name);
    final Map<String, JsonNode> fields = new TreeMap<>();
    if (node == null || node.isNull()) {
      return fields;
    }
    requireObject(node, name);
    final Iterator<Map.Entry<String, JsonNode>> iterator = node.fields();
    while (iterator.hasNext()) {
      final Map.Entry<String, JsonNode> entry = iterator.next();
      fields.put(entry.getKey(), entry.getValue());
    }
    return fields;
  }

  private static Iterable<JsonNode> arrayOrEmpty(JsonNode node, String where) {
    if (node == null || node.isNull()) {
      return List.of();
    }
    if (!node.isArray()) {
      throw new Exceptions.ArtifactParseException("Expected an array in " + where);
    }
    return node;
  }

  private static void requireObject(JsonNode node, String where) {
    if (node == null || !node.isObject()) {
      throw new Exceptions.ArtifactParseException("Expected an object for " + where);
    }
  }

  private static String requireText(JsonNode node, String field, String where) {
    final JsonNode value = node.get(field);
    if (value == null || !value.isTextual()) {
      throw new Exceptions.ArtifactParseException(
          String.format("Missing or non-string '%s' in %s", field, where));
    }
    return value.textValue();
  }

  private static int requireInt(JsonNode node, String field, String where) {
    final JsonNode value = node.get(field);
    if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
      throw new Exceptions.ArtifactParseException(
          String.format("Missing or non-integer '%s' in %s", field, where));
    }
    return value.intValue();
  }

  private static int requirePercentage(JsonNode node, String where) {
    final int percentage = requireInt(node, "percentage", where);
    if (percentage < 0 || percentage > 100) {
      throw new Exceptions.ArtifactParseException(
          String.format("Percentage %d in %s is outside 0 to 100", percentage, where));
    }
    return percentage;
  }

  // model records reject some shapes the JSON can still express
  private static <T> T construct(String where, Supplier<T> constructor) {
    try {
      return constructor.get();
    } catch (IllegalArgumentException e) {
      throw new Exceptions.ArtifactParseException(
          String.format("Invalid %s: %s", where, e.getMessage()), e);
    }
  }

  private static Optional<String> optionalText(JsonNode node, String field) {
    final JsonNode value = node.get(field);
    if (value == null || !value.isTextual()) {
      return Optional.empty();
    }
    return Optional.of(value.textValue());
  }

  private static Instant parseInstant(String text) {
    try {
      return Instant.parse(text);
    } catch (DateTimeParseException e) {
      throw new Exceptions.ArtifactParseException("Invalid published_at '" + text + "'", e);
    }
  }
}
