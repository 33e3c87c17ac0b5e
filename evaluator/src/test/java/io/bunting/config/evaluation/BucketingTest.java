package io.bunting.config.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class BucketingTest {

  @Test
  void matchesKnownVectors() {
    assertThat(Bucketing.bucketFor("salt", "user-1")).isEqualTo(44);
    assertThat(Bucketing.bucketFor("abc", "00000000-0000-0000-0000-000000000000")).isEqualTo(23);
    assertThat(Bucketing.bucketFor("a1b2c3d4e5f6g", "user-42")).isEqualTo(75);
  }

  @Test
  void isDeterministic() {
    for (int i = 0; i < 100; i++) {
      assertThat(Bucketing.bucketFor("dark", "u1")).isEqualTo(52);
    }
  }

  @Test
  void staysInRangeForEdgeInputs() {
    assertThat(Bucketing.bucketFor("x", "")).isEqualTo(53);
    assertThat(Bucketing.bucketFor("s", "ユーザー")).isEqualTo(60);
    assertThat(Bucketing.bucketFor("", "")).isBetween(1, 100);
    for (int i = 0; i < 5_000; i++) {
      assertThat(Bucketing.bucketFor("range", "id-" + i)).isBetween(1, 100);
    }
  }

  @Test
  void rolloutBoundaries() {
    assertThat(Bucketing.isInRollout("salt", "user-1", 0)).isFalse();
    assertThat(Bucketing.isInRollout("salt", "user-1", -5)).isFalse();
    assertThat(Bucketing.isInRollout("salt", "user-1", 100)).isTrue();
    assertThat(Bucketing.isInRollout("salt", "user-1", 150)).isTrue();
    assertThat(Bucketing.isInRollout("salt", "user-1", 43)).isFalse();
    assertThat(Bucketing.isInRollout("salt", "user-1", 44)).isTrue();
  }

  @Test
  void rolloutIsMonotonicInPercentage() {
    for (int i = 0; i < 500; i++) {
      final String localId = "user-" + i;
      boolean seenIn = false;
      for (int pct = 0; pct <= 100; pct++) {
        final boolean in = Bucketing.isInRollout("mono", localId, pct);
        if (seenIn) {
          assertThat(in).as("%s at %d%%", localId, pct).isTrue();
        }
        seenIn = in;
      }
    }
  }

  @Test
  void thirtyPercentRolloutCoversAboutThirtyPercentOfUsers() {
    int in = 0;
    for (int i = 0; i < 10_000; i++) {
      if (Bucketing.isInRollout("abc", "user-" + i, 30)) {
        in++;
      }
    }
    assertThat(in / 10_000.0).isCloseTo(0.30, within(0.02));
  }

  @Test
  void fullWeightsAlwaysAssignAGroup() {
    final List<Bucketing.Weight> weights =
        List.of(
            new Bucketing.Weight("a", 25),
            new Bucketing.Weight("b", 25),
            new Bucketing.Weight("c", 50));
    for (int i = 0; i < 5_000; i++) {
      assertThat(Bucketing.assignGroup("partition", "id-" + i, weights)).isPresent();
    }
  }

  @Test
  void partialWeightsLeaveTheRemainderUnassigned() {
    final List<Bucketing.Weight> weights =
        List.of(new Bucketing.Weight("control", 50), new Bucketing.Weight("treatment", 30));
    int unassigned = 0;
    for (int i = 0; i < 10_000; i++) {
      if (Bucketing.assignGroup("partition", "id-" + i, weights).isEmpty()) {
        unassigned++;
      }
    }
    assertThat(unassigned / 10_000.0).isCloseTo(0.20, within(0.02));
  }

  @Test
  void assignsByCumulativeScanInDeclaredOrder() {
    // bucket 44 for ("salt", "user-1")
    assertThat(
            Bucketing.assignGroup(
                "salt",
                "user-1",
                List.of(new Bucketing.Weight("first", 40), new Bucketing.Weight("second", 10))))
        .contains("second");
    assertThat(
            Bucketing.assignGroup(
                "salt",
                "user-1",
                List.of(new Bucketing.Weight("first", 44), new Bucketing.Weight("second", 10))))
        .contains("first");
    assertThat(Bucketing.assignGroup("salt", "user-1", List.of())).isEqualTo(Optional.empty());
  }
}
