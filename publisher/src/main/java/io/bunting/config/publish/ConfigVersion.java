package io.bunting.config.publish;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A published config version, {@code YYYY-MM-DD.N}: the UTC publish date and a 1-based sequence
 * number within that day. Versions order by date, then by sequence.
 */
public record ConfigVersion(LocalDate date, int sequence) implements Comparable<ConfigVersion> {

  private static final Pattern FORMAT =
      Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})\\.([1-9]\\d{0,8})$");
  private static final Comparator<ConfigVersion> ORDER =
      Comparator.comparing(ConfigVersion::date).thenComparingInt(ConfigVersion::sequence);

  public ConfigVersion {
    requireNonNull(date, "date");
    checkArgument(sequence >= 1, "sequence must be at least 1: %s", sequence);
  }

  public static ConfigVersion first(LocalDate date) {
    return new ConfigVersion(date, 1);
  }

  /**
   * @throws IllegalArgumentException if the text is not a valid version
   */
  public static ConfigVersion parse(String text) {
    return tryParse(text)
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    String.format("Invalid config version '%s', expected YYYY-MM-DD.N", text)));
  }

  public static Optional<ConfigVersion> tryParse(String text) {
    if (text == null) {
      return Optional.empty();
    }
    final Matcher matcher = FORMAT.matcher(text);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    try {
      return Optional.of(
          new ConfigVersion(LocalDate.parse(matcher.group(1)), Integer.parseInt(matcher.group(2))));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  public static boolean isValid(String text) {
    return tryParse(text).isPresent();
  }

  /** The version that follows this one when publishing on {@code today}. */
  public ConfigVersion next(LocalDate today) {
    if (today.isAfter(date)) {
      return first(today);
    }
    return new ConfigVersion(date, sequence + 1);
  }

  @Override
  public int compareTo(ConfigVersion other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return date + "." + sequence;
  }
}
