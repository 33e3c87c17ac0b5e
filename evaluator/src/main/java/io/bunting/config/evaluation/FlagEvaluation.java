package io.bunting.config.evaluation;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import io.bunting.config.Variant;
import java.util.Optional;

/**
 * The outcome of one flag lookup. {@code variant} is the variant that produced the value and
 * {@code testGroup} the assigned group when that variant is a test; both are empty for {@link
 * EvaluationReason#DEFAULT}.
 */
public record FlagEvaluation(
    JsonNode value,
    EvaluationReason reason,
    Optional<Variant> variant,
    Optional<String> testGroup) {

  public FlagEvaluation {
    requireNonNull(value, "value");
    requireNonNull(reason, "reason");
    requireNonNull(variant, "variant");
    requireNonNull(testGroup, "testGroup");
  }

  static FlagEvaluation defaultValue(JsonNode value) {
    return new FlagEvaluation(value, EvaluationReason.DEFAULT, Optional.empty(), Optional.empty());
  }

  static FlagEvaluation matched(JsonNode value, EvaluationReason reason, Variant variant) {
    return new FlagEvaluation(value, reason, Optional.of(variant), Optional.empty());
  }

  static FlagEvaluation testGroup(JsonNode value, Variant variant, String group) {
    return new FlagEvaluation(
        value, EvaluationReason.TEST, Optional.of(variant), Optional.of(group));
  }
}
