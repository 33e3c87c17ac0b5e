package io.bunting.config;

import com.google.common.base.Splitter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Naming rules shared by flag, cohort, test and rollout keys.
 *
 * <p>A compiled key matches {@code ^[a-z_]+$}, does not start or end with an underscore and is
 * 2 to 64 characters long. While authoring, keys may be namespaced with {@code /}; {@link
 * #normalize(String)} turns any free-form input into the compiled form.
 */
public final class IdentifierKeys {

  public static final int MIN_LENGTH = 2;
  public static final int MAX_LENGTH = 64;

  private static final Pattern KEY_PATTERN = Pattern.compile("^[a-z_]+$");
  private static final Pattern NON_LETTERS = Pattern.compile("[^a-z]");
  private static final Pattern UNDERSCORE_RUNS = Pattern.compile("_+");
  private static final Pattern CONDITION_ID_PATTERN = Pattern.compile("^[a-z0-9_-]+$");
  private static final Pattern APP_IDENTIFIER_PATTERN = Pattern.compile("^[a-z0-9._-]+$");
  private static final int MAX_APP_IDENTIFIER_LENGTH = 128;
  private static final Splitter NAMESPACE_SPLITTER = Splitter.on('/');

  private IdentifierKeys() {}

  public static Optional<KeyError> validate(String key) {
    if (key == null || key.isEmpty()) {
      return Optional.of(KeyError.EMPTY);
    }
    if (!KEY_PATTERN.matcher(key).matches()) {
      return Optional.of(KeyError.INVALID_CHARACTERS);
    }
    if (key.startsWith("_")) {
      return Optional.of(KeyError.LEADING_UNDERSCORE);
    }
    if (key.endsWith("_")) {
      return Optional.of(KeyError.TRAILING_UNDERSCORE);
    }
    if (key.length() > MAX_LENGTH) {
      return Optional.of(KeyError.TOO_LONG);
    }
    if (key.length() < MIN_LENGTH) {
      return Optional.of(KeyError.TOO_SHORT);
    }
    return Optional.empty();
  }

  public static boolean isValid(String key) {
    return validate(key).isEmpty();
  }

  /** Validates the authoring form, where every {@code /}-separated segment must be a valid key. */
  public static Optional<KeyError> validateNamespaced(String key) {
    if (key == null || key.isEmpty()) {
      return Optional.of(KeyError.EMPTY);
    }
    if (key.length() > MAX_LENGTH) {
      return Optional.of(KeyError.TOO_LONG);
    }
    final List<String> segments = NAMESPACE_SPLITTER.splitToList(key);
    return segments.stream()
        .map(IdentifierKeys::validate)
        .flatMap(Optional::stream)
        .findFirst();
  }

  /**
   * @throws Exceptions.InvalidKeyException if the key is not a valid compiled key
   */
  public static String requireValid(String key) {
    final Optional<KeyError> error = validate(key);
    if (error.isPresent()) {
      throw new Exceptions.InvalidKeyException(key, error.get());
    }
    return key;
  }

  /** Converts "Store: Use New Paywall Design" into "store_use_new_paywall_design". */
  public static String normalize(String input) {
    if (input == null) {
      return "";
    }
    String key = input.toLowerCase(Locale.ROOT);
    key = NON_LETTERS.matcher(key).replaceAll("_");
    key = UNDERSCORE_RUNS.matcher(key).replaceAll("_");
    key = trimUnderscores(key);
    if (key.length() > MAX_LENGTH) {
      // truncating can expose an underscore at the new end
      key = trimUnderscores(key.substring(0, MAX_LENGTH));
    }
    return key;
  }

  public static String displayName(String key) {
    return Splitter.on('_').omitEmptyStrings().splitToList(key).stream()
        .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
        .collect(Collectors.joining(" "));
  }

  public static Optional<String> validateConditionId(String id) {
    if (id == null || id.isEmpty()) {
      return Optional.of("Condition ID cannot be empty");
    }
    if (!CONDITION_ID_PATTERN.matcher(id).matches()) {
      return Optional.of(
          "Condition ID must contain only lowercase letters, numbers, underscores, and hyphens");
    }
    if (id.length() > MAX_LENGTH) {
      return Optional.of("Condition ID cannot exceed 64 characters");
    }
    return Optional.empty();
  }

  public static Optional<String> validateAppIdentifier(String identifier) {
    if (identifier == null || identifier.isEmpty()) {
      return Optional.of("App identifier cannot be empty");
    }
    if (!APP_IDENTIFIER_PATTERN.matcher(identifier).matches()) {
      return Optional.of(
          "App identifier must contain only lowercase letters, numbers, dots, underscores,"
              + " and hyphens");
    }
    if (identifier.length() > MAX_APP_IDENTIFIER_LENGTH) {
      return Optional.of("App identifier cannot exceed 128 characters");
    }
    return Optional.empty();
  }

  private static String trimUnderscores(String key) {
    int start = 0;
    int end = key.length();
    while (start < end && key.charAt(start) == '_') {
      start++;
    }
    while (end > start && key.charAt(end - 1) == '_') {
      end--;
    }
    return key.substring(start, end);
  }
}
