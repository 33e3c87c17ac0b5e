package io.bunting.config.openfeature;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.io.Resources;
import dev.openfeature.sdk.Client;
import dev.openfeature.sdk.ImmutableContext;
import dev.openfeature.sdk.OpenFeatureAPI;
import dev.openfeature.sdk.ProviderEvaluation;
import dev.openfeature.sdk.Reason;
import dev.openfeature.sdk.Value;
import dev.openfeature.sdk.exceptions.FlagNotFoundError;
import dev.openfeature.sdk.exceptions.ProviderNotReadyError;
import dev.openfeature.sdk.exceptions.TypeMismatchError;
import io.bunting.config.ArtifactCodec;
import io.bunting.config.Clock;
import io.bunting.config.ConfigArtifact;
import io.bunting.config.Environment;
import io.bunting.config.evaluation.EvaluationContext;
import io.bunting.config.evaluation.FlagEvaluation;
import io.bunting.config.evaluation.FlagEvaluator;
import io.bunting.config.signing.ConfigSigner;
import io.bunting.config.signing.SigningKey;
import io.bunting.config.signing.SigningKeys;
import io.bunting.config.signing.VerificationResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BuntingFeatureProviderTest {

  private static SigningKey key;
  private static SigningKey otherKey;
  private static String json;

  private final ConfigSigner signer = new ConfigSigner();
  private BuntingFeatureProvider provider;

  @BeforeAll
  static void setUpKeys() throws IOException {
    key = SigningKeys.generate(Clock.system()).withActive(true);
    otherKey = SigningKeys.generate(Clock.system()).withActive(true);
    json =
        Resources.toString(
            Resources.getResource("provider-artifact.json"), StandardCharsets.UTF_8);
  }

  @BeforeEach
  void setUp() {
    provider = new BuntingFeatureProvider(ProviderOptions.defaults());
  }

  private VerificationResult load(String artifactJson) {
    return provider.update(
        artifactJson, signer.sign(artifactJson, key).jws(), List.of(key.publicInfo()));
  }

  private static ImmutableContext user(String localId, Map<String, Value> attributes) {
    return new ImmutableContext(localId, attributes);
  }

  @Test
  void metadataNamesTheProvider() {
    assertThat(provider.getMetadata().getName()).isEqualTo("bunting-config");
  }

  @Test
  void nothingIsServedBeforeTheFirstVerifiedUpdate() {
    assertThat(provider.currentArtifact()).isEmpty();
    assertThatThrownBy(() -> provider.getBooleanEvaluation("dark_mode", false, user("u", Map.of())))
        .isInstanceOf(ProviderNotReadyError.class);
  }

  @Test
  void verifiedUpdateIsServed() {
    final VerificationResult result = load(json);

    assertThat(result.verified()).isTrue();
    assertThat(result.keyId()).contains(key.kid());
    assertThat(provider.currentArtifact().flatMap(ConfigArtifact::configVersion))
        .contains("2025-03-01.1");
  }

  @Test
  void darkModeFollowsCohortMembership() {
    load(json);

    final ProviderEvaluation<Boolean> staff =
        provider.getBooleanEvaluation(
            "dark_mode", false, user("user-1", Map.of("region", new Value("hq"))));
    final ProviderEvaluation<Boolean> visitor =
        provider.getBooleanEvaluation(
            "dark_mode", true, user("user-1", Map.of("region", new Value("eu"))));

    assertThat(staff.getValue()).isTrue();
    assertThat(staff.getReason()).isEqualTo(Reason.TARGETING_MATCH.name());
    assertThat(staff.getVariant()).isEqualTo("conditional-1");
    assertThat(staff.getFlagMetadata().getString("configVersion")).isEqualTo("2025-03-01.1");
    assertThat(visitor.getValue()).isFalse();
    assertThat(visitor.getReason()).isEqualTo(Reason.DEFAULT.name());
    assertThat(visitor.getVariant()).isEqualTo("default");
  }

  @Test
  void tamperedUpdateKeepsLastKnownGood() {
    load(json);
    final String next = json.replace("2025-03-01.1", "2025-03-02.1");
    final String jws = signer.sign(next, key).jws();
    final String tampered = next.replace("\"purple\"", "\"orange\"");

    final VerificationResult result = provider.update(tampered, jws, List.of(key.publicInfo()));

    assertThat(result.verified()).isFalse();
    assertThat(result.error()).isPresent();
    assertThat(provider.currentArtifact().flatMap(ConfigArtifact::configVersion))
        .contains("2025-03-01.1");
    assertThat(
            provider
                .getBooleanEvaluation(
                    "dark_mode", false, user("user-1", Map.of("region", new Value("hq"))))
                .getValue())
        .isTrue();
  }

  @Test
  void updateSignedByAnUnknownKeyIsRejected() {
    load(json);
    final String next = json.replace("2025-03-01.1", "2025-03-02.1");

    final VerificationResult result =
        provider.update(next, signer.sign(next, otherKey).jws(), List.of(key.publicInfo()));

    assertThat(result.verified()).isFalse();
    assertThat(provider.currentArtifact().flatMap(ConfigArtifact::configVersion))
        .contains("2025-03-01.1");
  }

  @Test
  void laterVerifiedUpdateReplacesTheArtifact() {
    load(json);
    final String next =
        json.replace("2025-03-01.1", "2025-03-02.1")
            .replace("\"default\": 0.25", "\"default\": 0.75");

    assertThat(load(next).verified()).isTrue();

    assertThat(provider.getDoubleEvaluation("sample_rate", 0.0, user("u", Map.of())).getValue())
        .isEqualTo(0.75);
  }

  @Test
  void updateAcceptsThePublicKeyExport() {
    final String exported =
        "[{\"kid\":\""
            + key.kid()
            + "\",\"pem\":"
            + ArtifactCodec.write(ArtifactCodec.nodes().textNode(key.publicKeyPem()))
            + ",\"algorithm\":\"RS256\",\"isActive\":true}]";

    final VerificationResult result = provider.update(json, signer.sign(json, key).jws(), exported);

    assertThat(result.verified()).isTrue();
  }

  @Test
  void unreadablePublicKeyExportIsAnUnverifiedUpdate() {
    final VerificationResult result =
        provider.update(json, signer.sign(json, key).jws(), "{\"not\": \"an array\"}");

    assertThat(result.verified()).isFalse();
    assertThat(provider.currentArtifact()).isEmpty();
  }

  @Test
  void signedButMalformedArtifactIsNotServed() {
    final String malformed = "{\"schema_version\": 1}";

    final VerificationResult result = load(malformed);

    assertThat(result.verified()).isFalse();
    assertThat(result.error()).hasValueSatisfying(e -> assertThat(e).contains("could not be read"));
    assertThat(provider.currentArtifact()).isEmpty();
  }

  @Test
  void signedArtifactWithANegativeGroupKeepsLastKnownGood() {
    load(json);
    final String next =
        json.replace("2025-03-01.1", "2025-03-02.1")
            .replace("\"percentage\": 30, \"values\"", "\"percentage\": -5, \"values\"");

    final VerificationResult result = load(next);

    assertThat(result.verified()).isFalse();
    assertThat(result.error()).hasValueSatisfying(e -> assertThat(e).contains("-5"));
    assertThat(provider.currentArtifact().flatMap(ConfigArtifact::configVersion))
        .contains("2025-03-01.1");
  }

  @Test
  void unknownFlagIsReportedAsNotFound() {
    load(json);

    assertThatThrownBy(() -> provider.getStringEvaluation("missing", "x", user("u", Map.of())))
        .isInstanceOf(FlagNotFoundError.class)
        .hasMessageContaining("missing");
  }

  @Test
  void kindMismatchIsReported() {
    load(json);

    assertThatThrownBy(() -> provider.getIntegerEvaluation("dark_mode", 0, user("u", Map.of())))
        .isInstanceOf(TypeMismatchError.class);
    assertThatThrownBy(() -> provider.getIntegerEvaluation("sample_rate", 0, user("u", Map.of())))
        .isInstanceOf(TypeMismatchError.class);
    assertThatThrownBy(() -> provider.getStringEvaluation("retry_limit", "", user("u", Map.of())))
        .isInstanceOf(TypeMismatchError.class);
  }

  @Test
  void numericAttributesMatchVersionConditions() {
    load(json);

    final ProviderEvaluation<Integer> newBuild =
        provider.getIntegerEvaluation(
            "retry_limit", 0, user("u", Map.of("build_number", new Value(250))));
    final ProviderEvaluation<Integer> oldBuild =
        provider.getIntegerEvaluation(
            "retry_limit", 0, user("u", Map.of("build_number", new Value(120))));

    assertThat(newBuild.getValue()).isEqualTo(5);
    assertThat(oldBuild.getValue()).isEqualTo(3);
  }

  @Test
  void integerFlagCanBeReadAsDouble() {
    load(json);

    assertThat(provider.getDoubleEvaluation("retry_limit", 0.0, user("u", Map.of())).getValue())
        .isEqualTo(3.0);
  }

  @Test
  void dottedPathReadsNestedJsonFields() {
    load(json);

    assertThat(
            provider
                .getStringEvaluation("checkout_copy.banner.title", "", user("u", Map.of()))
                .getValue())
        .isEqualTo("Welcome");
    assertThat(
            provider
                .getBooleanEvaluation("checkout_copy.banner.dismissable", true, user("u", Map.of()))
                .getValue())
        .isFalse();
    final Value whole =
        provider.getObjectEvaluation("checkout_copy", new Value(), user("u", Map.of())).getValue();
    assertThat(whole.asStructure().getValue("steps").asList()).hasSize(3);
  }

  @Test
  void jsonFlagsStoredAsTextAreServedAsStructures() {
    load(json);

    assertThat(
            provider.getStringEvaluation("legacy_copy.title", "", user("u", Map.of())).getValue())
        .isEqualTo("Old");
  }

  @Test
  void pathIntoMissingOrScalarFieldIsATypeMismatch() {
    load(json);

    assertThatThrownBy(
            () -> provider.getStringEvaluation("checkout_copy.footer", "", user("u", Map.of())))
        .isInstanceOf(TypeMismatchError.class);
    assertThatThrownBy(
            () -> provider.getStringEvaluation("dark_mode.enabled", "", user("u", Map.of())))
        .isInstanceOf(TypeMismatchError.class);
  }

  @Test
  void servesTheConfiguredEnvironment() {
    final BuntingFeatureProvider development =
        new BuntingFeatureProvider(ProviderOptions.forEnvironment("development"));
    development.update(json, signer.sign(json, key).jws(), List.of(key.publicInfo()));

    assertThat(
            development
                .getBooleanEvaluation(
                    "dark_mode", false, user("user-1", Map.of("region", new Value("eu"))))
                .getValue())
        .isTrue();
    assertThat(
            development.getIntegerEvaluation("retry_limit", 0, user("u", Map.of())).getValue())
        .isEqualTo(10);
  }

  @Test
  void splitsAgreeWithTheEvaluator() {
    load(json);
    final ConfigArtifact artifact = ArtifactCodec.fromJson(json);
    final FlagEvaluator evaluator = new FlagEvaluator();

    for (int i = 0; i < 200; i++) {
      final String localId = "user-" + i;
      final FlagEvaluation expected =
          evaluator.evaluate(
              artifact, Environment.PRODUCTION, "button_color", EvaluationContext.of(localId));
      final ProviderEvaluation<String> actual =
          provider.getStringEvaluation("button_color", "", user(localId, Map.of()));

      assertThat(actual.getValue()).isEqualTo(expected.value().textValue());
      assertThat(actual.getReason())
          .isEqualTo(BuntingFeatureProvider.toReason(expected.reason()).name());
      assertThat(actual.getVariant()).isEqualTo(BuntingFeatureProvider.variantName(expected));
    }
  }

  @Test
  void testGroupNameIsReportedAsTheVariant() {
    load(json);
    final ConfigArtifact artifact = ArtifactCodec.fromJson(json);
    final FlagEvaluator evaluator = new FlagEvaluator();

    for (int i = 0; i < 200; i++) {
      final String localId = "user-" + i;
      final FlagEvaluation expected =
          evaluator.evaluate(
              artifact, Environment.PRODUCTION, "button_color", EvaluationContext.of(localId));
      if (expected.testGroup().isPresent()) {
        final ProviderEvaluation<String> actual =
            provider.getStringEvaluation("button_color", "", user(localId, Map.of()));
        assertThat(actual.getVariant()).isIn("control", "treatment");
        assertThat(actual.getReason()).isEqualTo(Reason.SPLIT.name());
        return;
      }
    }
    throw new AssertionError("No user out of 200 was assigned to an onboarding group");
  }

  @Test
  void worksThroughTheOpenFeatureClient() {
    load(json);
    final OpenFeatureAPI api = OpenFeatureAPI.getInstance();
    api.setProviderAndWait(provider);
    try {
      final Client client = api.getClient();

      assertThat(
              client.getBooleanValue(
                  "dark_mode", false, user("user-1", Map.of("region", new Value("hq")))))
          .isTrue();
      assertThat(client.getStringValue("missing", "fallback", user("user-1", Map.of())))
          .isEqualTo("fallback");
    } finally {
      api.shutdown();
    }
  }
}
