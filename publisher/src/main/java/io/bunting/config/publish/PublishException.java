package io.bunting.config.publish;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A publish or rollback was refused. Nothing was committed. */
public class PublishException extends RuntimeException {

  public PublishException(String message) {
    super(message);
  }

  public PublishException(String message, Throwable cause) {
    super(message, cause);
  }

  /** The config names a different app than the one it would be signed and stored for. */
  public static class AppMismatchException extends PublishException {
    public AppMismatchException(String appId, String appIdentifier) {
      super(
          String.format(
              "Config for app \"%s\" cannot be published as app \"%s\"", appIdentifier, appId));
    }
  }

  /** The compiled artifact has validation errors. */
  public static class ValidationFailedException extends PublishException {
    private final ValidationResult result;

    public ValidationFailedException(String appId, ValidationResult result) {
      super(
          String.format(
              "Config for %s has %d validation error(s): %s",
              appId, result.errors().size(), result.errors()));
      this.result = result;
    }

    public ValidationResult getResult() {
      return result;
    }
  }

  /**
   * The publish would change the salt of tests or rollouts that are already published, which
   * reassigns their users. The caller has to acknowledge each key explicitly.
   */
  public static class SaltChangeException extends PublishException {
    private final ImmutableList<String> keys;

    public SaltChangeException(String appId, List<String> keys) {
      super(
          String.format(
              "Publishing %s would change the salt of %s; acknowledge the change to proceed",
              appId, keys));
      this.keys = ImmutableList.copyOf(keys);
    }

    public List<String> getKeys() {
      return keys;
    }
  }

  public static class ArtifactTooLargeException extends PublishException {
    private final int sizeBytes;
    private final int maxBytes;

    public ArtifactTooLargeException(String appId, int sizeBytes, int maxBytes) {
      super(
          String.format(
              "Config for %s is %d bytes, more than the maximum of %d bytes",
              appId, sizeBytes, maxBytes));
      this.sizeBytes = sizeBytes;
      this.maxBytes = maxBytes;
    }

    public int getSizeBytes() {
      return sizeBytes;
    }

    public int getMaxBytes() {
      return maxBytes;
    }
  }

  /** Every attempt to claim a fresh version lost against a concurrent publisher. */
  public static class VersionConflictException extends PublishException {
    public VersionConflictException(String appId, int attempts) {
      super(
          String.format(
              "Could not allocate a config version for %s after %d attempts", appId, attempts));
    }
  }

  public static class PublicationNotFoundException extends PublishException {
    public PublicationNotFoundException(String appId, ConfigVersion version) {
      super(String.format("No publication %s for app %s", version, appId));
    }
  }
}
