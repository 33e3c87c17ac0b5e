package io.bunting.config.publish;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import com.google.common.util.concurrent.Striped;
import io.bunting.config.ArtifactCodec;
import io.bunting.config.Clock;
import io.bunting.config.ConfigArtifact;
import io.bunting.config.publish.PublishException.AppMismatchException;
import io.bunting.config.publish.PublishException.ArtifactTooLargeException;
import io.bunting.config.publish.PublishException.PublicationNotFoundException;
import io.bunting.config.publish.PublishException.SaltChangeException;
import io.bunting.config.publish.PublishException.ValidationFailedException;
import io.bunting.config.publish.PublishException.VersionConflictException;
import io.bunting.config.publish.ValidationIssue.Code;
import io.bunting.config.publish.ValidationIssue.Subject;
import io.bunting.config.signing.ConfigSigner;
import io.bunting.config.signing.SignedConfig;
import io.bunting.config.signing.SigningKey;
import io.bunting.config.signing.SigningKeyService;
import io.bunting.config.signing.VerificationResult;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles, validates, signs and commits app configs.
 *
 * <p>Publishes of the same app are serialized by a striped lock. Across processes the store's
 * compare-and-insert on {@code (appId, version)} decides which publisher gets a version; the loser
 * re-reads the latest version and tries again, up to {@link
 * PublisherOptions#getMaxVersionAttempts()} times.
 */
public class ConfigPublisher {

  private static final Logger log = LoggerFactory.getLogger(ConfigPublisher.class);

  private final ConfigCompiler compiler;
  private final ConfigValidator validator;
  private final ConfigSigner signer;
  private final SigningKeyService keyService;
  private final PublicationStore store;
  private final ArtifactSink sink;
  private final PublisherOptions options;
  private final Clock clock;
  private final Striped<Lock> locks = Striped.lazyWeakLock(64);

  public ConfigPublisher(
      SigningKeyService keyService,
      PublicationStore store,
      ArtifactSink sink,
      PublisherOptions options) {
    this(
        new ConfigCompiler(),
        new ConfigValidator(),
        new ConfigSigner(options.getClock(), options.getSignatureTtl()),
        keyService,
        store,
        sink,
        options);
  }

  ConfigPublisher(
      ConfigCompiler compiler,
      ConfigValidator validator,
      ConfigSigner signer,
      SigningKeyService keyService,
      PublicationStore store,
      ArtifactSink sink,
      PublisherOptions options) {
    this.compiler = requireNonNull(compiler, "compiler");
    this.validator = requireNonNull(validator, "validator");
    this.signer = requireNonNull(signer, "signer");
    this.keyService = requireNonNull(keyService, "keyService");
    this.store = requireNonNull(store, "store");
    this.sink = requireNonNull(sink, "sink");
    this.options = requireNonNull(options, "options");
    this.clock = options.getClock();
  }

  /**
   * Compiles and validates the snapshot and compares it with the latest publication. Has no side
   * effects.
   *
   * @throws AppMismatchException if the snapshot belongs to another app
   * @throws io.bunting.config.Exceptions.CompileException if the snapshot cannot be compiled
   */
  public PublishPreview preview(String appId, AppSnapshot snapshot) {
    requireSameApp(appId, snapshot.appIdentifier());
    final ConfigArtifact artifact = compiler.compile(snapshot);
    final Optional<Publication> latest = store.latest(appId);
    final Optional<ConfigArtifact> published =
        latest.map(publication -> ArtifactCodec.fromJson(publication.json()));
    final List<String> saltChanges =
        published.map(before -> ConfigDiff.saltChanges(artifact, before)).orElse(List.of());
    final ValidationResult validation =
        validator
            .validate(artifact)
            .withWarnings(
                saltChanges.stream().map(key -> saltChangedWarning(artifact, key)).toList());
    return new PublishPreview(
        artifact,
        validation,
        ConfigDiff.changes(artifact, published),
        ConfigDiff.hasChanges(artifact, published),
        saltChanges,
        latest.map(Publication::version),
        ArtifactCodec.toJson(artifact).getBytes(UTF_8).length);
  }

  /**
   * Publishes the snapshot under a new version.
   *
   * @param acknowledgedSaltChanges keys of tests and rollouts whose salt may change
   * @throws AppMismatchException if the snapshot belongs to another app
   * @throws io.bunting.config.Exceptions.CompileException if the snapshot cannot be compiled
   * @throws ValidationFailedException if the compiled artifact has validation errors
   * @throws SaltChangeException if a published salt would change without acknowledgement
   * @throws io.bunting.config.Exceptions.SigningException if the app has no usable active key
   * @throws PublishException if the artifact is too large or no version could be allocated
   */
  public Publication publish(
      String appId, AppSnapshot snapshot, Set<String> acknowledgedSaltChanges) {
    requireSameApp(appId, snapshot.appIdentifier());
    final ConfigArtifact artifact = compiler.compile(snapshot);
    final ValidationResult validation = validator.validate(artifact);
    if (!validation.isValid()) {
      log.info(
          "Refusing to publish {}: {} validation error(s)", appId, validation.errors().size());
      throw new ValidationFailedException(appId, validation);
    }

    final Publication publication;
    final Lock lock = locks.get(appId);
    lock.lock();
    try {
      final Optional<Publication> latest = store.latest(appId);
      if (latest.isPresent()) {
        final List<String> unacknowledged =
            ConfigDiff.saltChanges(artifact, ArtifactCodec.fromJson(latest.get().json())).stream()
                .filter(key -> !acknowledgedSaltChanges.contains(key))
                .toList();
        if (!unacknowledged.isEmpty()) {
          throw new SaltChangeException(appId, unacknowledged);
        }
      }
      publication = commit(appId, artifact, Optional.empty());
    } finally {
      lock.unlock();
    }
    sink.accept(publication);
    return publication;
  }

  /**
   * Republishes the content of an earlier publication under a new version, signed with the
   * current active key. The earlier publication must still verify against the app's keys.
   *
   * @throws PublicationNotFoundException if there is no such publication
   * @throws PublishException if its signature does not verify or it names another app
   */
  public Publication rollback(String appId, ConfigVersion version) {
    final Publication target =
        store
            .find(appId, version)
            .orElseThrow(() -> new PublicationNotFoundException(appId, version));
    final VerificationResult verification = verifyStored(appId, target);
    if (!verification.verified()) {
      throw new PublishException(
          String.format(
              "Cannot rollback to publication %s with invalid signature: %s",
              version, verification.error().orElse("unknown error")));
    }
    final ConfigArtifact artifact = ArtifactCodec.fromJson(target.json()).withoutPublication();
    requireSameApp(appId, artifact.appIdentifier());

    final Publication publication;
    final Lock lock = locks.get(appId);
    lock.lock();
    try {
      store
          .latest(appId)
          .map(latest -> ConfigDiff.saltChanges(artifact, ArtifactCodec.fromJson(latest.json())))
          .filter(keys -> !keys.isEmpty())
          .ifPresent(
              keys ->
                  log.warn(
                      "Rollback of {} to {} restores earlier salts of {}", appId, version, keys));
      publication = commit(appId, artifact, Optional.of(version));
    } finally {
      lock.unlock();
    }
    sink.accept(publication);
    return publication;
  }

  /**
   * Checks the detached signature of a stored publication against the app's keys. The detached
   * form carries no expiry, so old publications keep verifying after their embedded JWS expired.
   *
   * @throws PublicationNotFoundException if there is no such publication
   */
  public VerificationResult verify(String appId, ConfigVersion version) {
    final Publication publication =
        store
            .find(appId, version)
            .orElseThrow(() -> new PublicationNotFoundException(appId, version));
    return verifyStored(appId, publication);
  }

  public Optional<Publication> latest(String appId) {
    return store.latest(appId);
  }

  /** Publications of the app, newest first. */
  public List<Publication> history(String appId) {
    return store.list(appId);
  }

  // apps are keyed by the identifier their artifacts carry
  private static void requireSameApp(String appId, String appIdentifier) {
    if (!appId.equals(appIdentifier)) {
      log.warn("Refusing to publish config of {} as {}", appIdentifier, appId);
      throw new AppMismatchException(appId, appIdentifier);
    }
  }

  private VerificationResult verifyStored(String appId, Publication publication) {
    final VerificationResult result =
        signer.verifyDetached(
            publication.json(), publication.detachedJws(), keyService.verificationKeys(appId));
    if (!result.verified()) {
      log.warn(
          "Publication {} of {} failed verification: {}",
          publication.version(),
          appId,
          result.error().orElse("unknown error"));
    }
    return result;
  }

  // caller holds the app's lock
  private Publication commit(
      String appId, ConfigArtifact artifact, Optional<ConfigVersion> rolledBackFrom) {
    final SigningKey key = keyService.activeKey(appId);
    final int attempts = options.getMaxVersionAttempts();
    for (int attempt = 1; attempt <= attempts; attempt++) {
      final Instant now = clock.get().truncatedTo(ChronoUnit.MILLIS);
      final LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
      final ConfigVersion version =
          store
              .latest(appId)
              .map(latest -> latest.version().next(today))
              .orElse(ConfigVersion.first(today));

      final String json = ArtifactCodec.toJson(artifact.withPublication(version.toString(), now));
      final int size = json.getBytes(UTF_8).length;
      if (size > options.getMaxArtifactBytes()) {
        throw new ArtifactTooLargeException(appId, size, options.getMaxArtifactBytes());
      }
      final SignedConfig embedded = signer.sign(json, key);
      final SignedConfig detached = signer.signDetached(json, key);
      final Publication publication =
          new Publication(
              appId,
              version,
              json,
              embedded.jws(),
              detached.jws(),
              key.kid(),
              key.algorithm(),
              now,
              rolledBackFrom);
      if (store.insertIfAbsent(publication)) {
        log.info(
            "Published {} version {} ({} bytes, key {}{})",
            appId,
            version,
            size,
            key.kid(),
            rolledBackFrom.map(from -> ", rollback of " + from).orElse(""));
        return publication;
      }
      log.warn(
          "Version {} of {} was taken concurrently, retrying (attempt {}/{})",
          version,
          appId,
          attempt,
          attempts);
    }
    throw new VersionConflictException(appId, attempts);
  }

  private static ValidationIssue saltChangedWarning(ConfigArtifact artifact, String key) {
    final boolean isTest = artifact.tests().containsKey(key);
    return new ValidationIssue(
        Code.SALT_CHANGED,
        isTest ? Subject.TEST : Subject.ROLLOUT,
        key,
        String.format(
            "Salt of %s \"%s\" changed; every user will be reassigned",
            isTest ? "test" : "rollout", key));
  }
}
