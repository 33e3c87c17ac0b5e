package io.bunting.config.openfeature;

import com.google.common.base.Splitter;
import dev.openfeature.sdk.exceptions.GeneralError;
import java.util.List;

/**
 * A flag key optionally followed by a dotted path into the flag's JSON value, for example {@code
 * checkout_copy.banner.title}. Flag keys never contain dots, so the first segment is always the
 * key.
 */
record FlagPath(String flag, List<String> path) {

  private static final Splitter DOT = Splitter.on('.');

  FlagPath {
    path = List.copyOf(path);
  }

  static FlagPath parse(String key) {
    if (key == null || key.isEmpty()) {
      throw new GeneralError("Flag key is empty");
    }
    final List<String> parts = DOT.splitToList(key);
    if (parts.stream().anyMatch(String::isEmpty)) {
      throw new GeneralError(String.format("Illegal flag path '%s'", key));
    }
    return new FlagPath(parts.get(0), parts.subList(1, parts.size()));
  }

  boolean isNested() {
    return !path.isEmpty();
  }
}
