package io.bunting.config.signing;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTCreationException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.Claim;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Splitter;
import com.google.common.io.BaseEncoding;
import io.bunting.config.ArtifactCodec;
import io.bunting.config.Clock;
import io.bunting.config.Exceptions.SigningException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signs config strings as RS256 JWS and verifies them against candidate keys.
 *
 * <p>The embedded form carries the exact config string in the {@code config} claim together with
 * {@code iat} and {@code exp}. The detached form ({@code header..signature}) signs the base64url
 * encoded config string without embedding it; the caller supplies the string again on
 * verification.
 */
public class ConfigSigner {

  private static final Logger log = LoggerFactory.getLogger(ConfigSigner.class);

  public static final String CONFIG_CLAIM = "config";
  public static final Duration DEFAULT_TTL = Duration.ofHours(24);

  private static final BaseEncoding BASE64_URL = BaseEncoding.base64Url().omitPadding();
  private static final Splitter DOT_SPLITTER = Splitter.on('.');

  private final Clock clock;
  private final Duration ttl;
  private final java.time.Clock verificationClock;

  public ConfigSigner() {
    this(Clock.system(), DEFAULT_TTL);
  }

  public ConfigSigner(Clock clock, Duration ttl) {
    this.clock = requireNonNull(clock, "clock");
    this.ttl = requireNonNull(ttl, "ttl");
    this.verificationClock = new SupplierClock(clock);
  }

  /**
   * @throws SigningException if the key is inactive, has no private half or is malformed
   */
  public SignedConfig sign(String json, SigningKey key) {
    final Algorithm algorithm = signingAlgorithm(key);
    // JWT timestamps have second precision
    final Instant issuedAt = clock.get().truncatedTo(ChronoUnit.SECONDS);
    final Instant expiresAt = issuedAt.plus(ttl);
    try {
      final String jws =
          JWT.create()
              .withKeyId(key.kid())
              .withHeader(Map.of("typ", "JWT"))
              .withClaim(CONFIG_CLAIM, json)
              .withIssuedAt(issuedAt)
              .withExpiresAt(expiresAt)
              .sign(algorithm);
      log.debug("Signed config with key {}, expires at {}", key.kid(), expiresAt);
      return new SignedConfig(jws, key.kid(), key.algorithm(), issuedAt, Optional.of(expiresAt));
    } catch (JWTCreationException e) {
      throw new SigningException("Could not sign config with key " + key.kid(), e);
    }
  }

  /**
   * @throws SigningException if the key is inactive, has no private half or is malformed
   */
  public SignedConfig signDetached(String json, SigningKey key) {
    final Algorithm algorithm = signingAlgorithm(key);
    final ObjectNode header = ArtifactCodec.nodes().objectNode();
    header.put("alg", algorithm.getName());
    header.put("kid", key.kid());
    header.put("typ", "JWT");
    final String encodedHeader = BASE64_URL.encode(ArtifactCodec.write(header).getBytes(UTF_8));
    final String encodedPayload = BASE64_URL.encode(json.getBytes(UTF_8));
    try {
      final byte[] signature =
          algorithm.sign(encodedHeader.getBytes(UTF_8), encodedPayload.getBytes(UTF_8));
      return new SignedConfig(
          encodedHeader + ".." + BASE64_URL.encode(signature),
          key.kid(),
          key.algorithm(),
          clock.get(),
          Optional.empty());
    } catch (JWTCreationException e) {
      throw new SigningException("Could not create detached signature with key " + key.kid(), e);
    }
  }

  /**
   * Verifies an embedded JWS and checks that its {@code config} claim is exactly {@code json}.
   * Never throws; every failure is reported as unverified.
   */
  public VerificationResult verify(String json, String jws, List<SigningKey> candidates) {
    if (json == null || jws == null) {
      return VerificationResult.unverified("Missing config or JWS");
    }
    final DecodedJWT decoded;
    try {
      decoded = JWT.decode(jws);
    } catch (JWTVerificationException e) {
      return VerificationResult.unverified("Malformed JWS");
    }
    final List<SigningKey> keys = candidatesFor(decoded.getKeyId(), candidates);
    if (keys.isEmpty()) {
      return VerificationResult.unverified(noKeysMessage(decoded.getKeyId()));
    }
    for (SigningKey key : keys) {
      try {
        final DecodedJWT verified =
            ((JWTVerifier.BaseVerification) JWT.require(verificationAlgorithm(key)))
                .build(verificationClock)
                .verify(decoded);
        final Claim config = verified.getClaim(CONFIG_CLAIM);
        if (!config.isMissing() && json.equals(config.asString())) {
          return VerificationResult.verifiedBy(key.kid());
        }
        log.debug("Signature by {} is valid but covers a different config", key.kid());
      } catch (JWTVerificationException | SigningException e) {
        log.debug("Verification with key {} failed: {}", key.kid(), e.getMessage());
      }
    }
    return VerificationResult.unverified("Signature verification failed with all candidate keys");
  }

  /** Verifies a {@code header..signature} JWS over {@code json}. Never throws. */
  public VerificationResult verifyDetached(
      String json, String detachedJws, List<SigningKey> candidates) {
    final List<String> parts =
        detachedJws == null ? List.of() : DOT_SPLITTER.splitToList(detachedJws);
    if (parts.size() != 3 || !parts.get(1).isEmpty() || json == null) {
      return VerificationResult.unverified("Malformed detached JWS");
    }
    final String token =
        parts.get(0) + "." + BASE64_URL.encode(json.getBytes(UTF_8)) + "." + parts.get(2);
    final DecodedJWT decoded;
    try {
      decoded = JWT.decode(token);
    } catch (JWTVerificationException e) {
      return VerificationResult.unverified("Malformed detached JWS");
    }
    if (!SigningKey.RS256.equals(decoded.getAlgorithm())) {
      return VerificationResult.unverified("Unsupported algorithm " + decoded.getAlgorithm());
    }
    final List<SigningKey> keys = candidatesFor(decoded.getKeyId(), candidates);
    if (keys.isEmpty()) {
      return VerificationResult.unverified(noKeysMessage(decoded.getKeyId()));
    }
    for (SigningKey key : keys) {
      try {
        verificationAlgorithm(key).verify(decoded);
        return VerificationResult.verifiedBy(key.kid());
      } catch (JWTVerificationException | SigningException e) {
        log.debug("Detached verification with key {} failed: {}", key.kid(), e.getMessage());
      }
    }
    return VerificationResult.unverified("Signature verification failed with all candidate keys");
  }

  /** Keys whose id matches the header {@code kid}; otherwise every active candidate. */
  static List<SigningKey> candidatesFor(String kid, List<SigningKey> candidates) {
    if (kid != null) {
      final List<SigningKey> matching =
          candidates.stream().filter(key -> kid.equals(key.kid())).toList();
      if (!matching.isEmpty()) {
        return matching;
      }
    }
    return candidates.stream().filter(SigningKey::active).toList();
  }

  private static String noKeysMessage(String kid) {
    return kid == null ? "No active keys found" : "Key " + kid + " not found and no active keys";
  }

  private static Algorithm signingAlgorithm(SigningKey key) {
    if (!key.active()) {
      throw new SigningException("Signing key " + key.kid() + " is not active");
    }
    if (!SigningKey.RS256.equals(key.algorithm())) {
      throw new SigningException("Unsupported signing algorithm " + key.algorithm());
    }
    final String privatePem =
        key.privateKeyPem()
            .orElseThrow(
                () -> new SigningException("Signing key " + key.kid() + " has no private key"));
    return Algorithm.RSA256(
        SigningKeys.parsePublicKey(key.publicKeyPem()), SigningKeys.parsePrivateKey(privatePem));
  }

  private static Algorithm verificationAlgorithm(SigningKey key) {
    return Algorithm.RSA256(SigningKeys.parsePublicKey(key.publicKeyPem()), null);
  }

  /** Lets java-jwt check {@code exp} and {@code iat} against the injected clock. */
  private static final class SupplierClock extends java.time.Clock {
    private final Clock clock;

    private SupplierClock(Clock clock) {
      this.clock = clock;
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public java.time.Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return clock.get();
    }
  }
}
