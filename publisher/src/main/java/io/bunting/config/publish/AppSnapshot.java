package io.bunting.config.publish;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Everything the record store holds for one app at a point in time. The compiler turns a snapshot
 * into an artifact; the snapshot itself is never published.
 */
public record AppSnapshot(
    String appIdentifier,
    FetchPolicy fetchPolicy,
    List<StoredFlag> flags,
    List<StoredCohort> cohorts,
    List<StoredTest> tests,
    List<StoredRollout> rollouts) {

  public AppSnapshot {
    requireNonNull(appIdentifier, "appIdentifier");
    fetchPolicy = fetchPolicy == null ? FetchPolicy.DEFAULT : fetchPolicy;
    flags = ImmutableList.copyOf(flags);
    cohorts = ImmutableList.copyOf(cohorts);
    tests = ImmutableList.copyOf(tests);
    rollouts = ImmutableList.copyOf(rollouts);
  }

  public static Builder builder(String appIdentifier) {
    return new Builder(appIdentifier);
  }

  public AppSnapshot withFlag(String key, UnaryOperator<StoredFlag> change) {
    return new AppSnapshot(
        appIdentifier,
        fetchPolicy,
        flags.stream().map(f -> f.key().equals(key) ? change.apply(f) : f).toList(),
        cohorts,
        tests,
        rollouts);
  }

  public AppSnapshot withTest(String key, UnaryOperator<StoredTest> change) {
    return new AppSnapshot(
        appIdentifier,
        fetchPolicy,
        flags,
        cohorts,
        tests.stream().map(t -> t.key().equals(key) ? change.apply(t) : t).toList(),
        rollouts);
  }

  public AppSnapshot withRollout(String key, UnaryOperator<StoredRollout> change) {
    return new AppSnapshot(
        appIdentifier,
        fetchPolicy,
        flags,
        cohorts,
        tests,
        rollouts.stream().map(r -> r.key().equals(key) ? change.apply(r) : r).toList());
  }

  public static class Builder {
    private final String appIdentifier;
    private FetchPolicy fetchPolicy = FetchPolicy.DEFAULT;
    private final List<StoredFlag> flags = new ArrayList<>();
    private final List<StoredCohort> cohorts = new ArrayList<>();
    private final List<StoredTest> tests = new ArrayList<>();
    private final List<StoredRollout> rollouts = new ArrayList<>();

    public Builder(String appIdentifier) {
      this.appIdentifier = appIdentifier;
    }

    public Builder fetchPolicy(FetchPolicy fetchPolicy) {
      this.fetchPolicy = fetchPolicy;
      return this;
    }

    public Builder flag(StoredFlag flag) {
      flags.add(flag);
      return this;
    }

    public Builder cohort(StoredCohort cohort) {
      cohorts.add(cohort);
      return this;
    }

    public Builder test(StoredTest test) {
      tests.add(test);
      return this;
    }

    public Builder rollout(StoredRollout rollout) {
      rollouts.add(rollout);
      return this;
    }

    public AppSnapshot build() {
      return new AppSnapshot(appIdentifier, fetchPolicy, flags, cohorts, tests, rollouts);
    }
  }
}
