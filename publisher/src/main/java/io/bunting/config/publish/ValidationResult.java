package io.bunting.config.publish;

import com.google.common.collect.ImmutableList;
import java.util.List;

public record ValidationResult(List<ValidationIssue> errors, List<ValidationIssue> warnings) {

  public ValidationResult {
    errors = ImmutableList.copyOf(errors);
    warnings = ImmutableList.copyOf(warnings);
  }

  static ValidationResult of(List<ValidationIssue> issues) {
    return new ValidationResult(
        issues.stream().filter(i -> i.severity() == ValidationIssue.Severity.ERROR).toList(),
        issues.stream().filter(i -> i.severity() == ValidationIssue.Severity.WARNING).toList());
  }

  public boolean isValid() {
    return errors.isEmpty();
  }

  public List<ValidationIssue> issues(ValidationIssue.Code code) {
    final List<ValidationIssue> source =
        code.severity() == ValidationIssue.Severity.ERROR ? errors : warnings;
    return source.stream().filter(i -> i.code() == code).toList();
  }

  public ValidationResult withWarnings(List<ValidationIssue> additional) {
    return new ValidationResult(
        errors,
        ImmutableList.<ValidationIssue>builder().addAll(warnings).addAll(additional).build());
  }
}
