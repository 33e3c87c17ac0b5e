package io.bunting.config.publish;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * How often clients of an app may refetch the artifact and how long a cached copy stays usable.
 * Carried on the snapshot for the distribution layer; it is not part of the artifact.
 */
public record FetchPolicy(int minIntervalSeconds, int hardTtlDays) {

  public static final FetchPolicy DEFAULT = new FetchPolicy(3600, 30);

  public FetchPolicy {
    checkArgument(minIntervalSeconds >= 0, "minIntervalSeconds must not be negative");
    checkArgument(hardTtlDays > 0, "hardTtlDays must be positive");
  }
}
