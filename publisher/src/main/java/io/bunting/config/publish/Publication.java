package io.bunting.config.publish;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.time.Instant;
import java.util.Optional;

/**
 * A committed, signed artifact. {@code json} is the exact string both signatures cover;
 * {@code rolledBackFrom} names the version whose content was republished, if any.
 */
public record Publication(
    String appId,
    ConfigVersion version,
    String json,
    String jws,
    String detachedJws,
    String keyId,
    String algorithm,
    Instant publishedAt,
    Optional<ConfigVersion> rolledBackFrom) {

  public Publication {
    requireNonNull(appId, "appId");
    requireNonNull(version, "version");
    requireNonNull(json, "json");
    requireNonNull(jws, "jws");
    requireNonNull(detachedJws, "detachedJws");
    requireNonNull(keyId, "keyId");
    requireNonNull(algorithm, "algorithm");
    requireNonNull(publishedAt, "publishedAt");
    requireNonNull(rolledBackFrom, "rolledBackFrom");
  }

  public int sizeBytes() {
    return json.getBytes(UTF_8).length;
  }
}
