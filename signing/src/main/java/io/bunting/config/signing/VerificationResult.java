package io.bunting.config.signing;

import java.util.Optional;

/** Outcome of checking a signature. Anything other than {@link #verified} means unverified. */
public record VerificationResult(boolean verified, Optional<String> keyId, Optional<String> error) {

  public static VerificationResult verifiedBy(String keyId) {
    return new VerificationResult(true, Optional.of(keyId), Optional.empty());
  }

  public static VerificationResult unverified(String reason) {
    return new VerificationResult(false, Optional.empty(), Optional.of(reason));
  }
}
