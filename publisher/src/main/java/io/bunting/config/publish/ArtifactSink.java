package io.bunting.config.publish;

/**
 * Receives every committed publication, for example to upload it to object storage. Called after
 * the commit and outside the publish lock. An exception from the sink reaches the caller of the
 * publish, but the publication stays committed.
 */
@FunctionalInterface
public interface ArtifactSink {

  ArtifactSink NONE = publication -> {};

  void accept(Publication publication);
}
