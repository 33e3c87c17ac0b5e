package io.bunting.config.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A flag as the record store holds it. Maps are keyed by environment wire name; the stored type
 * name may differ in case from the canonical one ({@code BOOL}).
 */
public record StoredFlag(
    String key,
    String type,
    String description,
    boolean archived,
    Map<String, JsonNode> defaults,
    Map<String, List<StoredVariant>> variants) {

  public StoredFlag {
    // null entries are kept so the compiler can report them
    defaults = defaults == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(defaults));
    variants =
        variants == null
            ? Map.of()
            : variants.entrySet().stream()
                .collect(
                    ImmutableMap.toImmutableMap(
                        Map.Entry::getKey, e -> ImmutableList.copyOf(e.getValue())));
  }

  public StoredFlag withVariants(String environment, List<StoredVariant> environmentVariants) {
    final Map<String, List<StoredVariant>> updated = new HashMap<>(variants);
    updated.put(environment, environmentVariants);
    return new StoredFlag(key, type, description, archived, defaults, updated);
  }

  public StoredFlag withArchived(boolean archived) {
    return new StoredFlag(key, type, description, archived, defaults, variants);
  }
}
