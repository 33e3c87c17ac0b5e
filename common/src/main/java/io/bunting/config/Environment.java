package io.bunting.config;

import java.util.Arrays;
import java.util.Optional;

/** The three deployment environments every flag carries a configuration for. */
public enum Environment {
  DEVELOPMENT("development"),
  STAGING("staging"),
  PRODUCTION("production");

  private final String wireName;

  Environment(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static Optional<Environment> find(String wireName) {
    return Arrays.stream(values()).filter(e -> e.wireName.equals(wireName)).findFirst();
  }

  /**
   * Strict lookup by the lower-case wire name.
   *
   * @throws IllegalArgumentException if the name is not one of the canonical environments
   */
  public static Environment fromWireName(String wireName) {
    return find(wireName)
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    String.format(
                        "Unknown environment '%s', expected one of development, staging,"
                            + " production",
                        wireName)));
  }

  @Override
  public String toString() {
    return wireName;
  }
}
