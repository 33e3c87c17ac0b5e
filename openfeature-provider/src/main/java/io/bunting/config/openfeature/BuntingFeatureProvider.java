package io.bunting.config.openfeature;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import dev.openfeature.sdk.EvaluationContext;
import dev.openfeature.sdk.FeatureProvider;
import dev.openfeature.sdk.ImmutableMetadata;
import dev.openfeature.sdk.Metadata;
import dev.openfeature.sdk.ProviderEvaluation;
import dev.openfeature.sdk.Reason;
import dev.openfeature.sdk.Value;
import dev.openfeature.sdk.exceptions.FlagNotFoundError;
import dev.openfeature.sdk.exceptions.ProviderNotReadyError;
import dev.openfeature.sdk.exceptions.TypeMismatchError;
import io.bunting.config.ArtifactCodec;
import io.bunting.config.ConfigArtifact;
import io.bunting.config.Exceptions.ArtifactParseException;
import io.bunting.config.Exceptions.FlagNotFoundException;
import io.bunting.config.FlagDefinition;
import io.bunting.config.FlagType;
import io.bunting.config.evaluation.CustomConditionResolver;
import io.bunting.config.evaluation.EvaluationReason;
import io.bunting.config.evaluation.FlagEvaluation;
import io.bunting.config.evaluation.FlagEvaluator;
import io.bunting.config.signing.ConfigSigner;
import io.bunting.config.signing.PublicKeyInfo;
import io.bunting.config.signing.SigningKey;
import io.bunting.config.signing.VerificationResult;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenFeature provider that evaluates Bunting flags locally against a signed config artifact.
 *
 * <p>The provider does no fetching of its own. The application hands it every artifact it
 * downloads through {@link #update(String, String, List)}; an artifact is only served after its
 * signature verifies against the app's published keys. A rejected update leaves the previously
 * verified artifact in place, so a tampered or expired download never replaces a good config.
 *
 * <p><strong>Usage Example:</strong>
 *
 * <pre>{@code
 * BuntingFeatureProvider provider =
 *     new BuntingFeatureProvider(ProviderOptions.forEnvironment("production"));
 * provider.update(configJson, configJws, PublicKeyInfo.listFromJson(publicKeysJson));
 *
 * OpenFeatureAPI.getInstance().setProvider(provider);
 * Client client = OpenFeatureAPI.getInstance().getClient();
 * boolean darkMode =
 *     client.getBooleanValue("dark_mode", false, new ImmutableContext(localId, attributes));
 * }</pre>
 *
 * <p>Flag keys may carry a dotted path ({@code "checkout_copy.banner.title"}) to read a field
 * of a {@code json} flag. Context attributes are matched by condition type name, for example
 * {@code app_version}, {@code platform} or {@code region}, and by name for custom attributes.
 */
public class BuntingFeatureProvider implements FeatureProvider {

  private static final Logger log = LoggerFactory.getLogger(BuntingFeatureProvider.class);

  static final String PROVIDER_NAME = "bunting-config";
  static final String CONFIG_VERSION_METADATA = "configVersion";
  static final String EVALUATION_REASON_METADATA = "evaluationReason";

  private final ProviderOptions options;
  private final FlagEvaluator evaluator;
  private final ConfigSigner signer;
  private final AtomicReference<ConfigArtifact> current = new AtomicReference<>();

  public BuntingFeatureProvider(ProviderOptions options) {
    this(options, new FlagEvaluator(), new ConfigSigner());
  }

  public BuntingFeatureProvider(ProviderOptions options, CustomConditionResolver customResolver) {
    this(options, new FlagEvaluator(customResolver), new ConfigSigner());
  }

  @VisibleForTesting
  BuntingFeatureProvider(ProviderOptions options, FlagEvaluator evaluator, ConfigSigner signer) {
    this.options = requireNonNull(options, "options");
    this.evaluator = requireNonNull(evaluator, "evaluator");
    this.signer = requireNonNull(signer, "signer");
    LoggingConfigurator.configureLogging(options);
  }

  /**
   * Verifies a downloaded artifact and, when its signature checks out, starts serving it.
   *
   * @param json the artifact JSON exactly as downloaded
   * @param jws the embedded JWS delivered next to it
   * @param publicKeys the app's exported public keys
   * @return the verification outcome; on failure the last verified artifact keeps being served
   */
  public VerificationResult update(String json, String jws, List<PublicKeyInfo> publicKeys) {
    final List<SigningKey> candidates =
        publicKeys.stream().map(PublicKeyInfo::toVerificationKey).toList();
    final VerificationResult result = signer.verify(json, jws, candidates);
    if (!result.verified()) {
      log.warn(
          "Rejected config update: {}. Keeping config version {}",
          result.error().orElse("signature did not verify"),
          servedVersion());
      return result;
    }

    final ConfigArtifact artifact;
    try {
      artifact = ArtifactCodec.fromJson(json);
    } catch (ArtifactParseException e) {
      log.error(
          "Signed config from key {} could not be read. Keeping config version {}",
          result.keyId().orElse("?"),
          servedVersion(),
          e);
      return VerificationResult.unverified("Verified config could not be read: " + e.getMessage());
    }

    current.set(artifact);
    log.info(
        "Serving config version {} for app {}, verified with key {}",
        artifact.configVersion().orElse("unversioned"),
        artifact.appIdentifier(),
        result.keyId().orElse("?"));
    return result;
  }

  /**
   * Same as {@link #update(String, String, List)} with keys in the public key export format.
   * An unreadable key export is reported as an unverified update.
   */
  public VerificationResult update(String json, String jws, String publicKeysJson) {
    final List<PublicKeyInfo> publicKeys;
    try {
      publicKeys = PublicKeyInfo.listFromJson(publicKeysJson);
    } catch (ArtifactParseException e) {
      log.warn("Rejected config update, public keys unreadable: {}", e.getMessage());
      return VerificationResult.unverified("Public keys could not be read: " + e.getMessage());
    }
    return update(json, jws, publicKeys);
  }

  /** The artifact currently served, empty until the first verified update. */
  public Optional<ConfigArtifact> currentArtifact() {
    return Optional.ofNullable(current.get());
  }

  public ProviderOptions getOptions() {
    return options;
  }

  @Override
  public Metadata getMetadata() {
    return () -> PROVIDER_NAME;
  }

  @Override
  public ProviderEvaluation<Boolean> getBooleanEvaluation(
      String key, Boolean defaultValue, EvaluationContext ctx) {
    return getCastedEvaluation(key, ctx, Value::asBoolean);
  }

  @Override
  public ProviderEvaluation<String> getStringEvaluation(
      String key, String defaultValue, EvaluationContext ctx) {
    return getCastedEvaluation(key, ctx, Value::asString);
  }

  @Override
  public ProviderEvaluation<Integer> getIntegerEvaluation(
      String key, Integer defaultValue, EvaluationContext ctx) {
    // Value#asInteger would truncate doubles
    return getCastedEvaluation(
        key, ctx, value -> value.asObject() instanceof Integer ? value.asInteger() : null);
  }

  @Override
  public ProviderEvaluation<Double> getDoubleEvaluation(
      String key, Double defaultValue, EvaluationContext ctx) {
    return getCastedEvaluation(key, ctx, Value::asDouble);
  }

  @Override
  public ProviderEvaluation<Value> getObjectEvaluation(
      String key, Value defaultValue, EvaluationContext ctx) {
    final ConfigArtifact artifact = current.get();
    if (artifact == null) {
      throw new ProviderNotReadyError("No verified config has been loaded");
    }
    final FlagPath flagPath = FlagPath.parse(key);

    final FlagEvaluation evaluation;
    try {
      evaluation =
          evaluator.evaluate(
              artifact,
              options.getEnvironment(),
              flagPath.flag(),
              OpenFeatureUtils.toEvaluationContext(ctx));
    } catch (FlagNotFoundException e) {
      log.warn("No flag '{}' was found", flagPath.flag());
      throw new FlagNotFoundError(String.format("No flag '%s' was found", flagPath.flag()));
    }

    final JsonNode fullValue = structured(artifact.flags().get(flagPath.flag()), evaluation);
    final JsonNode value = OpenFeatureUtils.getValueForPath(flagPath.path(), fullValue);

    return ProviderEvaluation.<Value>builder()
        .value(value.isNull() ? defaultValue : OpenFeatureTypeMapper.from(value))
        .reason(toReason(evaluation.reason()).name())
        .variant(variantName(evaluation))
        .flagMetadata(
            ImmutableMetadata.builder()
                .addString(EVALUATION_REASON_METADATA, evaluation.reason().wireName())
                .addString(
                    CONFIG_VERSION_METADATA, artifact.configVersion().orElse("unversioned"))
                .build())
        .build();
  }

  private <T> ProviderEvaluation<T> getCastedEvaluation(
      String key, EvaluationContext ctx, Function<Value, T> cast) {
    final ProviderEvaluation<Value> objectEvaluation = getObjectEvaluation(key, new Value(), ctx);

    final T castedValue = cast.apply(objectEvaluation.getValue());
    if (castedValue == null) {
      log.warn(
          "Cannot cast value '{}' of flag '{}' to expected type", objectEvaluation.getValue(), key);
      throw new TypeMismatchError(
          String.format(
              "Cannot cast value '%s' of flag '%s' to expected type",
              objectEvaluation.getValue(), key));
    }

    return ProviderEvaluation.<T>builder()
        .value(castedValue)
        .variant(objectEvaluation.getVariant())
        .reason(objectEvaluation.getReason())
        .flagMetadata(objectEvaluation.getFlagMetadata())
        .build();
  }

  // json flags may hold their value as a JSON string
  private static JsonNode structured(FlagDefinition flag, FlagEvaluation evaluation) {
    final JsonNode value = evaluation.value();
    if (flag.type() == FlagType.JSON && value.isTextual()) {
      try {
        return ArtifactCodec.readTree(value.textValue());
      } catch (ArtifactParseException e) {
        throw new TypeMismatchError("Value of json flag is not valid JSON: " + e.getMessage());
      }
    }
    return value;
  }

  static Reason toReason(EvaluationReason reason) {
    return switch (reason) {
      case DEFAULT -> Reason.DEFAULT;
      case CONDITIONAL -> Reason.TARGETING_MATCH;
      case TEST, ROLLOUT -> Reason.SPLIT;
    };
  }

  static String variantName(FlagEvaluation evaluation) {
    if (evaluation.testGroup().isPresent()) {
      return evaluation.testGroup().get();
    }
    return evaluation
        .variant()
        .map(variant -> variant.type().wireName() + "-" + variant.order())
        .orElse(EvaluationReason.DEFAULT.wireName());
  }

  private String servedVersion() {
    final ConfigArtifact artifact = current.get();
    if (artifact == null) {
      return "none";
    }
    return artifact.configVersion().orElse("unversioned");
  }
}
