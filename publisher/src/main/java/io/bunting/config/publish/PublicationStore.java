package io.bunting.config.publish;

import java.util.List;
import java.util.Optional;

/**
 * Persists publications per app. Implementations must make {@link #insertIfAbsent} an atomic
 * compare-and-insert on {@code (appId, version)}; the publisher relies on it to allocate versions
 * safely across processes.
 */
public interface PublicationStore {

  Optional<Publication> latest(String appId);

  Optional<Publication> find(String appId, ConfigVersion version);

  /** All publications of the app, newest first. */
  List<Publication> list(String appId);

  /**
   * @return false if a publication with the same app and version already exists
   */
  boolean insertIfAbsent(Publication publication);
}
