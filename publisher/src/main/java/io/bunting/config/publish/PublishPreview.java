package io.bunting.config.publish;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import io.bunting.config.ConfigArtifact;
import java.util.List;
import java.util.Optional;

/**
 * What a publish of the current snapshot would do. {@code validation} includes the {@code
 * salt_changed} warnings; {@code saltChanges} lists the keys that would need acknowledging.
 */
public record PublishPreview(
    ConfigArtifact artifact,
    ValidationResult validation,
    List<ConfigChange> changes,
    boolean hasChanges,
    List<String> saltChanges,
    Optional<ConfigVersion> latestVersion,
    int sizeBytes) {

  public PublishPreview {
    requireNonNull(artifact, "artifact");
    requireNonNull(validation, "validation");
    changes = ImmutableList.copyOf(changes);
    saltChanges = ImmutableList.copyOf(saltChanges);
    requireNonNull(latestVersion, "latestVersion");
  }

  public boolean canPublish() {
    return validation.isValid();
  }
}
