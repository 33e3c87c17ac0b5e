package io.bunting.config.publish;

import static io.bunting.config.publish.TestSnapshots.NODES;
import static io.bunting.config.publish.TestSnapshots.flag;
import static io.bunting.config.publish.TestSnapshots.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.InstanceOfAssertFactories.type;

import com.fasterxml.jackson.databind.JsonNode;
import io.bunting.config.ConditionOperator;
import io.bunting.config.ConditionType;
import io.bunting.config.ConditionalVariant;
import io.bunting.config.ConfigArtifact;
import io.bunting.config.Environment;
import io.bunting.config.Exceptions.CompileException;
import io.bunting.config.FlagType;
import io.bunting.config.RolloutVariant;
import io.bunting.config.TestVariant;
import io.bunting.config.Variant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigCompilerTest {

  private final ConfigCompiler compiler = new ConfigCompiler();

  @Test
  void compilesSnapshotIntoUnpublishedSortedArtifact() {
    final ConfigArtifact artifact = compiler.compile(snapshot());

    assertThat(artifact.configVersion()).isEmpty();
    assertThat(artifact.publishedAt()).isEmpty();
    assertThat(artifact.appIdentifier()).isEqualTo(TestSnapshots.APP_IDENTIFIER);
    assertThat(artifact.flags().keySet()).containsExactly("button_color", "dark_mode");
    assertThat(artifact.flags().get("dark_mode").type()).isEqualTo(FlagType.BOOL);
    assertThat(artifact.cohorts().get("staff").conditions())
        .singleElement()
        .satisfies(
            condition -> {
              assertThat(condition.type()).isEqualTo(ConditionType.REGION);
              assertThat(condition.operator()).isEqualTo(ConditionOperator.IN);
            });
    assertThat(artifact.tests().get("onboarding").groups()).hasSize(2);
    assertThat(artifact.rollouts().get("new_checkout").percentage()).isEqualTo(30);
  }

  @Test
  void variantsAreSortedByOrder() {
    final List<Variant> variants =
        compiler
            .compile(snapshot())
            .flags()
            .get("button_color")
            .environment(Environment.PRODUCTION)
            .variants();

    assertThat(variants).extracting(Variant::order).containsExactly(1, 2);
    assertThat(variants.get(0)).isInstanceOf(TestVariant.class);
    assertThat(variants.get(1))
        .asInstanceOf(type(RolloutVariant.class))
        .satisfies(rollout -> assertThat(rollout.value()).isEmpty());
  }

  @Test
  void archivedEntitiesAreLeftOut() {
    final AppSnapshot snapshot =
        snapshot()
            .withFlag("dark_mode", flag -> flag.withArchived(true))
            .withRollout(
                "new_checkout",
                rollout ->
                    new StoredRollout(
                        rollout.key(),
                        rollout.name(),
                        rollout.description(),
                        rollout.salt(),
                        true,
                        rollout.conditions(),
                        rollout.percentage(),
                        rollout.values()));

    final ConfigArtifact artifact = compiler.compile(snapshot);

    assertThat(artifact.flags()).containsOnlyKeys("button_color");
    assertThat(artifact.rollouts()).isEmpty();
  }

  @Test
  void storedVariantWithoutTypeOrOrderIsConditionalAtOrderZero() {
    final StoredVariant untyped =
        new StoredVariant(
            null,
            null,
            NODES.booleanNode(true),
            List.of(StoredCondition.of("ios", "platform", "in", "ios")),
            null,
            null);
    final AppSnapshot snapshot =
        AppSnapshot.builder("com.example.app")
            .flag(
                flag("dark_mode", "bool", NODES.booleanNode(false))
                    .withVariants("staging", List.of(untyped)))
            .build();

    final Variant variant =
        compiler
            .compile(snapshot)
            .flags()
            .get("dark_mode")
            .environment(Environment.STAGING)
            .variants()
            .get(0);

    assertThat(variant).isInstanceOf(ConditionalVariant.class);
    assertThat(variant.order()).isZero();
  }

  @Test
  void legacyOperatorSpellingsAreNormalized() {
    final AppSnapshot snapshot =
        AppSnapshot.builder("com.example.app")
            .cohort(
                new StoredCohort(
                    "old_builds",
                    null,
                    null,
                    List.of(StoredCondition.of("v", "APP_VERSION", "does_not_equals", "1.0"))))
            .build();

    final ConfigArtifact artifact = compiler.compile(snapshot);

    assertThat(artifact.cohorts().get("old_builds").name()).isEqualTo("Old Builds");
    assertThat(artifact.cohorts().get("old_builds").conditions().get(0).operator())
        .isEqualTo(ConditionOperator.DOES_NOT_EQUAL);
  }

  @Test
  void rolloutWithoutPercentageCompilesToZero() {
    final ConfigArtifact artifact =
        compiler.compile(
            snapshot().withRollout("new_checkout", rollout -> rollout.withPercentage(null)));

    assertThat(artifact.rollouts().get("new_checkout").percentage()).isZero();
  }

  @Test
  void reportsEveryProblemInOnePass() {
    final Map<String, JsonNode> partialDefaults = new HashMap<>();
    partialDefaults.put("development", NODES.booleanNode(true));
    partialDefaults.put("staging", NODES.booleanNode(true));
    final AppSnapshot snapshot =
        AppSnapshot.builder("com.example.app")
            .flag(new StoredFlag("broken", "boolean", "", false, partialDefaults, Map.of()))
            .flag(flag("Bad-Key", "bool", NODES.booleanNode(true)))
            .test(snapshot().tests().get(0).withSalt(null))
            .build();

    assertThatThrownBy(() -> compiler.compile(snapshot))
        .asInstanceOf(type(CompileException.class))
        .satisfies(
            e ->
                assertThat(e.getProblems())
                    .hasSize(4)
                    .anySatisfy(p -> assertThat(p).contains("unrecognized type \"boolean\""))
                    .anySatisfy(p -> assertThat(p).contains("default value for production"))
                    .anySatisfy(p -> assertThat(p).contains("\"Bad-Key\" is invalid"))
                    .anySatisfy(p -> assertThat(p).contains("salt for test \"onboarding\"")));
  }

  @Test
  void nullDefaultCountsAsMissing() {
    final Map<String, JsonNode> defaults = TestSnapshots.everywhere(NODES.textNode("a"));
    defaults.put("staging", NODES.nullNode());

    assertThatThrownBy(
            () ->
                compiler.compile(
                    AppSnapshot.builder("com.example.app")
                        .flag(new StoredFlag("label", "string", "", false, defaults, Map.of()))
                        .build()))
        .isInstanceOf(CompileException.class)
        .hasMessageContaining("Flag \"label\" is missing a default value for staging");
  }

  @Test
  void unknownVariantTagAndConditionTypeAreProblems() {
    final StoredVariant unknownTag =
        new StoredVariant("experiment", 1, NODES.textNode("x"), List.of(), null, null);
    final StoredVariant unknownCondition =
        StoredVariant.conditional(
            2, NODES.textNode("y"), List.of(StoredCondition.of("c", "weather", "in", "rain")));
    final AppSnapshot snapshot =
        AppSnapshot.builder("com.example.app")
            .flag(
                flag("label", "string", NODES.textNode("a"))
                    .withVariants("development", List.of(unknownTag, unknownCondition)))
            .build();

    assertThatThrownBy(() -> compiler.compile(snapshot))
        .asInstanceOf(type(CompileException.class))
        .satisfies(
            e ->
                assertThat(e.getProblems())
                    .containsExactly(
                        "Unknown variant type \"experiment\" for variant 1 in flag \"label\""
                            + " (development)",
                        "Unknown condition type \"weather\" for condition \"c\" in variant 2 in"
                            + " flag \"label\" (development)"));
  }

  @Test
  void nullAndDuplicateKeysAreProblems() {
    final AppSnapshot snapshot =
        AppSnapshot.builder("com.example.app")
            .cohort(new StoredCohort(null, "Nobody", "", List.of()))
            .flag(flag(null, "bool", NODES.booleanNode(true)))
            .flag(flag("dark_mode", "bool", NODES.booleanNode(true)))
            .flag(flag("dark_mode", "bool", NODES.booleanNode(false)))
            .build();

    assertThatThrownBy(() -> compiler.compile(snapshot))
        .asInstanceOf(type(CompileException.class))
        .satisfies(
            e ->
                assertThat(e.getProblems())
                    .containsExactly(
                        "Cohort key \"null\" is invalid: Key cannot be empty",
                        "Flag key \"null\" is invalid: Key cannot be empty",
                        "Flag key \"dark_mode\" is used more than once"));
  }

  @Test
  void cohortReferencingAnotherCohortIsAProblem() {
    final AppSnapshot snapshot =
        AppSnapshot.builder("com.example.app")
            .cohort(
                new StoredCohort(
                    "staff", "Staff", "", List.of(StoredCondition.of("hq", "region", "in", "hq"))))
            .cohort(
                new StoredCohort(
                    "senior_staff",
                    "Senior staff",
                    "",
                    List.of(StoredCondition.of("s", "cohort", "is_in_cohort", "staff"))))
            .build();

    assertThatThrownBy(() -> compiler.compile(snapshot))
        .asInstanceOf(type(CompileException.class))
        .satisfies(
            e ->
                assertThat(e.getProblems())
                    .containsExactly(
                        "Condition \"s\" in cohort \"senior_staff\" references another cohort"));
  }

  @Test
  void invalidAppIdentifierIsAProblem() {
    assertThatThrownBy(() -> compiler.compile(AppSnapshot.builder("Com Example").build()))
        .isInstanceOf(CompileException.class)
        .hasMessageContaining("App identifier must contain only");
  }
}
