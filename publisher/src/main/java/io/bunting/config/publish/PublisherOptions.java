package io.bunting.config.publish;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import io.bunting.config.Clock;
import io.bunting.config.signing.ConfigSigner;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Configuration for {@link ConfigPublisher}.
 *
 * <p>Defaults: signatures expire 24 hours after issue, artifacts may be at most 1 MiB of UTF-8
 * JSON, version allocation is attempted 5 times before giving up, and time comes from the system
 * clock.
 */
public final class PublisherOptions {

  public static final String SIGNATURE_TTL_HOURS_ENV = "BUNTING_SIGNATURE_TTL_HOURS";
  public static final String MAX_CONFIG_BYTES_ENV = "BUNTING_MAX_CONFIG_BYTES";

  public static final int DEFAULT_MAX_ARTIFACT_BYTES = 1_048_576;
  public static final int DEFAULT_MAX_VERSION_ATTEMPTS = 5;

  private static final Clock SYSTEM_CLOCK = Clock.system();

  private final Duration signatureTtl;
  private final int maxArtifactBytes;
  private final int maxVersionAttempts;
  private final Clock clock;

  private PublisherOptions(Builder builder) {
    this.signatureTtl = builder.signatureTtl;
    this.maxArtifactBytes = builder.maxArtifactBytes;
    this.maxVersionAttempts = builder.maxVersionAttempts;
    this.clock = builder.clock;
  }

  public static PublisherOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Defaults overridden by {@value #SIGNATURE_TTL_HOURS_ENV} and {@value #MAX_CONFIG_BYTES_ENV}
   * when they are set.
   *
   * @throws IllegalArgumentException if a variable is set to something other than a positive
   *     integer
   */
  public static PublisherOptions fromEnvironment() {
    return fromEnvironment(System::getenv);
  }

  static PublisherOptions fromEnvironment(Function<String, String> environment) {
    final Builder builder = builder();
    Optional.ofNullable(environment.apply(SIGNATURE_TTL_HOURS_ENV))
        .map(value -> parsePositive(SIGNATURE_TTL_HOURS_ENV, value))
        .ifPresent(hours -> builder.signatureTtl(Duration.ofHours(hours)));
    Optional.ofNullable(environment.apply(MAX_CONFIG_BYTES_ENV))
        .map(value -> parsePositive(MAX_CONFIG_BYTES_ENV, value))
        .ifPresent(builder::maxArtifactBytes);
    return builder.build();
  }

  private static int parsePositive(String name, String value) {
    try {
      final int parsed = Integer.parseInt(value.trim());
      checkArgument(parsed > 0, "%s must be positive, was %s", name, value);
      return parsed;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("%s must be an integer, was '%s'", name, value), e);
    }
  }

  public Duration getSignatureTtl() {
    return signatureTtl;
  }

  public int getMaxArtifactBytes() {
    return maxArtifactBytes;
  }

  public int getMaxVersionAttempts() {
    return maxVersionAttempts;
  }

  public Clock getClock() {
    return clock;
  }

  @Override
  public String toString() {
    return "PublisherOptions{"
        + "signatureTtl="
        + signatureTtl
        + ", maxArtifactBytes="
        + maxArtifactBytes
        + ", maxVersionAttempts="
        + maxVersionAttempts
        + '}';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    final PublisherOptions that = (PublisherOptions) o;
    return maxArtifactBytes == that.maxArtifactBytes
        && maxVersionAttempts == that.maxVersionAttempts
        && signatureTtl.equals(that.signatureTtl)
        && clock.equals(that.clock);
  }

  @Override
  public int hashCode() {
    return Objects.hash(signatureTtl, maxArtifactBytes, maxVersionAttempts, clock);
  }

  public static class Builder {
    private Duration signatureTtl = ConfigSigner.DEFAULT_TTL;
    private int maxArtifactBytes = DEFAULT_MAX_ARTIFACT_BYTES;
    private int maxVersionAttempts = DEFAULT_MAX_VERSION_ATTEMPTS;
    private Clock clock = SYSTEM_CLOCK;

    public Builder signatureTtl(Duration signatureTtl) {
      requireNonNull(signatureTtl, "signatureTtl");
      checkArgument(!signatureTtl.isNegative() && !signatureTtl.isZero(), "TTL must be positive");
      this.signatureTtl = signatureTtl;
      return this;
    }

    public Builder maxArtifactBytes(int maxArtifactBytes) {
      checkArgument(maxArtifactBytes > 0, "maxArtifactBytes must be positive");
      this.maxArtifactBytes = maxArtifactBytes;
      return this;
    }

    public Builder maxVersionAttempts(int maxVersionAttempts) {
      checkArgument(maxVersionAttempts > 0, "maxVersionAttempts must be positive");
      this.maxVersionAttempts = maxVersionAttempts;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = requireNonNull(clock, "clock");
      return this;
    }

    public PublisherOptions build() {
      return new PublisherOptions(this);
    }
  }
}
