package io.bunting.config.evaluation;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.primitives.Ints;
import java.util.List;
import java.util.Optional;

/**
 * Deterministic assignment of users to percentage buckets. SDKs on every platform reimplement
 * this, so the hash input and arithmetic are part of the wire contract.
 */
public final class Bucketing {

  public static final int BUCKET_COUNT = 100;

  private static final HashFunction HASH_FUNCTION = Hashing.sha256();

  private Bucketing() {}

  /** A named weight for {@link #assignGroup(String, String, List)}. */
  public record Weight(String name, int percentage) {}

  /**
   * Hashes {@code salt + ":" + localId}, reads the first four digest bytes as an unsigned
   * big-endian integer and maps it onto 1..100.
   */
  public static int bucketFor(String salt, String localId) {
    final HashCode hashCode = HASH_FUNCTION.hashString(salt + ":" + localId, UTF_8);
    final byte[] digest = hashCode.asBytes();
    final long prefix =
        Integer.toUnsignedLong(Ints.fromBytes(digest[0], digest[1], digest[2], digest[3]));
    return (int) (prefix % BUCKET_COUNT) + 1;
  }

  public static boolean isInRollout(String salt, String localId, int percentage) {
    if (percentage <= 0) {
      return false;
    }
    if (percentage >= BUCKET_COUNT) {
      return true;
    }
    return bucketFor(salt, localId) <= percentage;
  }

  /**
   * Walks the weights in declared order and returns the first whose cumulative percentage covers
   * the user's bucket. Empty when the bucket lies beyond the total, which happens when the
   * weights sum to less than 100.
   */
  public static Optional<String> assignGroup(String salt, String localId, List<Weight> weights) {
    final int bucket = bucketFor(salt, localId);
    int running = 0;
    for (Weight weight : weights) {
      running += weight.percentage();
      if (bucket <= running) {
        return Optional.of(weight.name());
      }
    }
    return Optional.empty();
  }
}
