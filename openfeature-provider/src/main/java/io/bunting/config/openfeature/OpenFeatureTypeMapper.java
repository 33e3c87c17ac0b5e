package io.bunting.config.openfeature;

import com.fasterxml.jackson.databind.JsonNode;
import dev.openfeature.sdk.ImmutableStructure;
import dev.openfeature.sdk.Value;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

// Package visibility only, the JSON side is an implementation detail of the provider
class OpenFeatureTypeMapper {

  private OpenFeatureTypeMapper() {}

  /** Converts a flag value into an OpenFeature value; integral numbers that fit become ints. */
  static Value from(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return new Value();
    }
    if (node.isBoolean()) {
      return new Value(node.booleanValue());
    }
    if (node.isIntegralNumber() && node.canConvertToInt()) {
      return new Value(node.intValue());
    }
    if (node.isNumber()) {
      return new Value(node.doubleValue());
    }
    if (node.isTextual()) {
      return new Value(node.textValue());
    }
    if (node.isArray()) {
      final List<Value> values = new ArrayList<>(node.size());
      node.forEach(element -> values.add(from(element)));
      return new Value(values);
    }
    final Map<String, Value> fields = new LinkedHashMap<>();
    node.fields().forEachRemaining(entry -> fields.put(entry.getKey(), from(entry.getValue())));
    return new Value(new ImmutableStructure(fields));
  }

  /**
   * Flattens a context value into the string form conditions compare against. Lists contribute
   * each scalar element; structures and nulls contribute nothing.
   */
  static List<String> toAttributeValues(Value value) {
    if (value == null || value.isNull() || value.isStructure()) {
      return List.of();
    }
    if (value.isList()) {
      final List<String> values = new ArrayList<>();
      for (Value element : value.asList()) {
        scalar(element).ifPresent(values::add);
      }
      return values;
    }
    return scalar(value).map(List::of).orElse(List.of());
  }

  private static Optional<String> scalar(Value value) {
    if (value == null || value.isNull()) {
      return Optional.empty();
    }
    if (value.isString()) {
      return Optional.of(value.asString());
    }
    if (value.isBoolean()) {
      return Optional.of(String.valueOf(value.asBoolean()));
    }
    if (value.isNumber()) {
      return Optional.of(formatNumber(value.asObject()));
    }
    if (value.isInstant()) {
      return Optional.of(value.asInstant().toString());
    }
    return Optional.empty();
  }

  // 42.0 and 42 must compare the same against a "42" condition value
  private static String formatNumber(Object number) {
    if (number instanceof Double d && !d.isInfinite() && d == Math.rint(d)) {
      return String.valueOf(d.longValue());
    }
    return String.valueOf(number);
  }
}
