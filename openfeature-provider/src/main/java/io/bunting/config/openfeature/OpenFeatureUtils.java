package io.bunting.config.openfeature;

import com.fasterxml.jackson.databind.JsonNode;
import dev.openfeature.sdk.exceptions.TypeMismatchError;
import io.bunting.config.evaluation.EvaluationContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class OpenFeatureUtils {

  private static final Logger log = LoggerFactory.getLogger(OpenFeatureUtils.class);

  // ImmutableContext also exposes the targeting key as a regular attribute
  static final String TARGETING_KEY_ATTRIBUTE = "targetingKey";

  private OpenFeatureUtils() {}

  /*
  OpenFeature evaluation context -> evaluator context
   */
  static EvaluationContext toEvaluationContext(dev.openfeature.sdk.EvaluationContext context) {
    if (context == null) {
      return EvaluationContext.of("");
    }
    final String targetingKey = context.getTargetingKey();
    if (targetingKey == null || targetingKey.isEmpty()) {
      log.debug("Evaluation context has no targeting key, bucketing on an empty local id");
    }
    final Map<String, List<String>> attributes = new LinkedHashMap<>();
    context
        .asMap()
        .forEach(
            (name, value) -> {
              if (!TARGETING_KEY_ATTRIBUTE.equals(name)) {
                attributes.put(name, OpenFeatureTypeMapper.toAttributeValues(value));
              }
            });
    return new EvaluationContext(targetingKey == null ? "" : targetingKey, attributes);
  }

  /*
  "value for path" on a flag's JSON value
   */
  static JsonNode getValueForPath(List<String> path, JsonNode fullValue) {
    JsonNode value = fullValue;
    for (String fieldName : path) {
      if (!value.isObject()) {
        log.warn(
            "Illegal attempt to derive field '{}' on non-structure value '{}'", fieldName, value);
        throw new TypeMismatchError(
            String.format(
                "Illegal attempt to derive field '%s' on non-structure value '%s'",
                fieldName, value));
      }
      final JsonNode field = value.get(fieldName);
      if (field == null) {
        log.warn(
            "Illegal attempt to derive non-existing field '{}' on structure value '{}'",
            fieldName,
            value);
        throw new TypeMismatchError(
            String.format(
                "Illegal attempt to derive non-existing field '%s' on structure value '%s'",
                fieldName, value));
      }
      value = field;
    }
    return value;
  }
}
