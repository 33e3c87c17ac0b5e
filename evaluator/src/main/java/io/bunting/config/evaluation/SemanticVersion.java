package io.bunting.config.evaluation;

import com.google.common.base.Splitter;
import com.google.common.primitives.Ints;
import java.util.Arrays;
import java.util.List;

/**
 * A dotted version compared component by component. Parsing never fails: each component
 * contributes its leading digits ({@code "3-beta"} is 3, {@code "rc"} is 0) and
 * missing trailing components count as 0, so {@code 1.2} equals {@code 1.2.0}.
 */
final class SemanticVersion implements Comparable<SemanticVersion> {

  private static final Splitter DOT_SPLITTER = Splitter.on('.');

  private final int[] components;

  private SemanticVersion(int[] components) {
    this.components = components;
  }

  static SemanticVersion fromVersionString(final String version) {
    if (version == null) {
      throw new IllegalArgumentException("Invalid version, version must not be null");
    }
    final List<String> parts = DOT_SPLITTER.splitToList(version.trim());
    final int[] components = new int[parts.size()];
    for (int i = 0; i < parts.size(); i++) {
      components[i] = parseComponent(parts.get(i));
    }
    return new SemanticVersion(components);
  }

  static int parseComponent(final String component) {
    int end = 0;
    while (end < component.length() && Character.isDigit(component.charAt(end))) {
      end++;
    }
    if (end == 0) {
      return 0;
    }
    final Integer value = Ints.tryParse(component.substring(0, end));
    return value == null ? Integer.MAX_VALUE : value;
  }

  @Override
  public int compareTo(final SemanticVersion other) {
    final int length = Math.max(components.length, other.components.length);
    for (int i = 0; i < length; i++) {
      final int result = Integer.compare(component(i), other.component(i));
      if (result != 0) {
        return result;
      }
    }
    return 0;
  }

  private int component(int index) {
    return index < components.length ? components[index] : 0;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SemanticVersion)) {
      return false;
    }
    return compareTo((SemanticVersion) o) == 0;
  }

  @Override
  public int hashCode() {
    int last = components.length;
    while (last > 0 && components[last - 1] == 0) {
      last--;
    }
    return Arrays.hashCode(Arrays.copyOf(components, last));
  }

  @Override
  public String toString() {
    return Arrays.stream(components)
        .mapToObj(Integer::toString)
        .reduce((a, b) -> a + "." + b)
        .orElse("0");
  }
}
