package io.bunting.config.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.bunting.config.ArtifactCodec;
import io.bunting.config.Environment;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A small app: a cohort-gated {@code dark_mode} flag and a {@code button_color} flag driven by a
 * test and a rollout.
 */
final class TestSnapshots {

  static final String APP_IDENTIFIER = "com.example.app";
  static final JsonNodeFactory NODES = ArtifactCodec.nodes();

  private TestSnapshots() {}

  static AppSnapshot snapshot() {
    return snapshot(APP_IDENTIFIER);
  }

  static AppSnapshot snapshot(String appIdentifier) {
    return AppSnapshot.builder(appIdentifier)
        .cohort(
            new StoredCohort(
                "staff",
                "Staff",
                "Employees at headquarters",
                List.of(StoredCondition.of("staff-region", "region", "in", "hq"))))
        .flag(
            flag("dark_mode", "BOOL", NODES.booleanNode(false))
                .withVariants(
                    "production",
                    List.of(
                        StoredVariant.conditional(
                            1,
                            NODES.booleanNode(true),
                            List.of(
                                StoredCondition.of(
                                    "in-staff", "cohort", "is_in_cohort", "staff"))))))
        .flag(
            flag("button_color", "string", NODES.textNode("grey"))
                .withVariants(
                    "production",
                    List.of(
                        StoredVariant.rollout(2, "new_checkout"),
                        StoredVariant.test(1, "onboarding"))))
        .test(
            new StoredTest(
                "onboarding",
                "Onboarding",
                "",
                "ob_salt",
                false,
                List.of(),
                List.of(
                    new StoredTestGroup("control", 50, everywhere(NODES.textNode("blue"))),
                    new StoredTestGroup("treatment", 50, everywhere(NODES.textNode("green"))))))
        .rollout(
            new StoredRollout(
                "new_checkout",
                "New checkout",
                "",
                "ro_salt",
                false,
                List.of(),
                30,
                everywhere(NODES.textNode("purple"))))
        .build();
  }

  static StoredFlag flag(String key, String type, JsonNode defaultValue) {
    return new StoredFlag(key, type, "", false, everywhere(defaultValue), Map.of());
  }

  static Map<String, JsonNode> everywhere(JsonNode value) {
    final Map<String, JsonNode> values = new LinkedHashMap<>();
    for (Environment environment : Environment.values()) {
      values.put(environment.wireName(), value);
    }
    return values;
  }
}
