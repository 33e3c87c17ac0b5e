package io.bunting.config;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Optional;

/**
 * The six canonical flag types. Wire names are lower-case and matched exactly, so a drifted name
 * such as {@code "boolean"} never maps to {@link #BOOL}.
 */
public enum FlagType {
  BOOL("bool"),
  STRING("string"),
  INT("int"),
  DOUBLE("double"),
  DATE("date"),
  JSON("json");

  private final String wireName;

  FlagType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static Optional<FlagType> fromWireName(String wireName) {
    return Arrays.stream(values()).filter(t -> t.wireName.equals(wireName)).findFirst();
  }

  /** Whether a JSON value is a legal value of this type. */
  public boolean accepts(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return false;
    }
    return switch (this) {
      case BOOL -> value.isBoolean();
      case STRING -> value.isTextual();
      case INT -> value.isIntegralNumber() || (value.isFloatingPointNumber() && isWhole(value));
      case DOUBLE -> value.isNumber() && Double.isFinite(value.doubleValue());
      case DATE -> value.isTextual() && parseDate(value.textValue()) != null;
      case JSON ->
          value.isObject()
              || value.isArray()
              || (value.isTextual() && ArtifactCodec.isValidJson(value.textValue()));
    };
  }

  /**
   * Parses the date forms accepted for {@code date} flags: an ISO instant or offset date-time, a
   * local date-time (read as UTC) or a plain date (start of day, UTC).
   *
   * @return the instant, or null when the text is not a date
   */
  public static Instant parseDate(String value) {
    if (value == null || value.isEmpty()) {
      return null;
    }
    try {
      if (value.contains("T")) {
        final String timePart = value.substring(value.indexOf('T'));
        if (value.endsWith("Z") || timePart.contains("+") || timePart.contains("-")) {
          return ZonedDateTime.parse(value).toInstant();
        } else {
          return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        }
      } else {
        return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
      }
    } catch (DateTimeParseException exception) {
      return null;
    }
  }

  private static boolean isWhole(JsonNode value) {
    final double d = value.doubleValue();
    return Double.isFinite(d) && d == Math.rint(d);
  }

  @Override
  public String toString() {
    return wireName;
  }
}
