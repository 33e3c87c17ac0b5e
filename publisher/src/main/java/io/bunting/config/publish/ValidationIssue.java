package io.bunting.config.publish;

import static java.util.Objects.requireNonNull;

/** One problem found in an artifact. Errors block publishing, warnings only inform. */
public record ValidationIssue(Code code, Subject subject, String key, String message) {

  public enum Severity {
    ERROR,
    WARNING
  }

  public enum Subject {
    FLAG,
    COHORT,
    TEST,
    ROLLOUT,
    ARTIFACT
  }

  public enum Code {
    MISSING_DEFAULT("missing_default", Severity.ERROR),
    INVALID_TYPE("invalid_type", Severity.ERROR),
    INVALID_JSON("invalid_json", Severity.ERROR),
    INVALID_DEFAULT_VALUE("invalid_default_value", Severity.ERROR),
    MISSING_COHORT_REFERENCE("missing_cohort_reference", Severity.ERROR),
    CIRCULAR_COHORT_REFERENCE("circular_cohort_reference", Severity.ERROR),
    INVALID_CONDITION("invalid_condition", Severity.ERROR),
    MISSING_TEST_REFERENCE("missing_test_reference", Severity.ERROR),
    MISSING_ROLLOUT_REFERENCE("missing_rollout_reference", Severity.ERROR),
    INVALID_PERCENTAGE("invalid_percentage", Severity.ERROR),
    INVALID_KEY("invalid_key", Severity.ERROR),
    MALFORMED_ARTIFACT("malformed_artifact", Severity.ERROR),
    EMPTY_VARIANT("empty_variant", Severity.WARNING),
    EMPTY_COHORT("empty_cohort", Severity.WARNING),
    SALT_CHANGED("salt_changed", Severity.WARNING);

    private final String wireName;
    private final Severity severity;

    Code(String wireName, Severity severity) {
      this.wireName = wireName;
      this.severity = severity;
    }

    public String wireName() {
      return wireName;
    }

    public Severity severity() {
      return severity;
    }

    @Override
    public String toString() {
      return wireName;
    }
  }

  public ValidationIssue {
    requireNonNull(code, "code");
    requireNonNull(subject, "subject");
    requireNonNull(key, "key");
    requireNonNull(message, "message");
  }

  public Severity severity() {
    return code.severity();
  }

  @Override
  public String toString() {
    return code + ": " + message;
  }
}
