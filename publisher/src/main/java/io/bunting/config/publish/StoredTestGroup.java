package io.bunting.config.publish;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/** A test arm as stored. {@code values} is keyed by environment wire name. */
public record StoredTestGroup(String name, int percentage, Map<String, JsonNode> values) {

  public StoredTestGroup {
    values = values == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(values));
  }
}
