package io.bunting.config;

import java.security.SecureRandom;
import org.apache.commons.lang3.RandomStringUtils;

/**
 * Salts for tests and rollouts. A salt is an opaque contract once it appears in a published
 * artifact: replacing it reassigns every user.
 */
public final class Salts {

  private static final char[] ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();
  private static final int SALT_LENGTH = 13;
  private static final SecureRandom RANDOM = new SecureRandom();

  private Salts() {}

  public static String generate() {
    return RandomStringUtils.random(
        SALT_LENGTH, 0, ALPHABET.length, false, false, ALPHABET, RANDOM);
  }
}
