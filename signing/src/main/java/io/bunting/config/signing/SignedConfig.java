package io.bunting.config.signing;

import java.time.Instant;
import java.util.Optional;

/**
 * A compact JWS over a config string. {@code expiresAt} is empty for detached signatures, which
 * carry no claims.
 */
public record SignedConfig(
    String jws, String keyId, String algorithm, Instant issuedAt, Optional<Instant> expiresAt) {}
