package io.bunting.config.signing;

import static java.util.Objects.requireNonNull;

import java.time.Instant;
import java.util.Optional;

/**
 * An RS256 key pair belonging to one app. {@code privateKeyPem} is empty for keys imported for
 * verification only.
 */
public record SigningKey(
    String kid,
    String algorithm,
    String publicKeyPem,
    Optional<String> privateKeyPem,
    boolean active,
    Instant createdAt) {

  public static final String RS256 = "RS256";

  public SigningKey {
    requireNonNull(kid, "kid");
    requireNonNull(algorithm, "algorithm");
    requireNonNull(publicKeyPem, "publicKeyPem");
    requireNonNull(privateKeyPem, "privateKeyPem");
    requireNonNull(createdAt, "createdAt");
  }

  public static SigningKey publicOnly(
      String kid, String publicKeyPem, boolean active, Instant createdAt) {
    return new SigningKey(kid, RS256, publicKeyPem, Optional.empty(), active, createdAt);
  }

  public SigningKey withActive(boolean active) {
    return new SigningKey(kid, algorithm, publicKeyPem, privateKeyPem, active, createdAt);
  }

  public SigningKey withoutPrivateKey() {
    return new SigningKey(kid, algorithm, publicKeyPem, Optional.empty(), active, createdAt);
  }

  public PublicKeyInfo publicInfo() {
    return new PublicKeyInfo(kid, publicKeyPem, algorithm, active);
  }

  @Override
  public String toString() {
    return String.format(
        "SigningKey{kid=%s, algorithm=%s, active=%s, createdAt=%s, privateKey=%s}",
        kid, algorithm, active, createdAt, privateKeyPem.isPresent() ? "<redacted>" : "<none>");
  }
}
