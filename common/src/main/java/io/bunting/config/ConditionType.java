package io.bunting.config;

import java.util.Arrays;
import java.util.Optional;

public enum ConditionType {
  APP_VERSION("app_version", Kind.VERSION),
  OS_VERSION("os_version", Kind.VERSION),
  BUILD_NUMBER("build_number", Kind.VERSION),
  PLATFORM("platform", Kind.LIST),
  DEVICE_MODEL("device_model", Kind.LIST),
  REGION("region", Kind.LIST),
  LOCALE("locale", Kind.LIST),
  COHORT("cohort", Kind.COHORT),
  CUSTOM_ATTRIBUTE("custom_attribute", Kind.CUSTOM);

  /** How a condition of this type is evaluated. */
  public enum Kind {
    VERSION,
    LIST,
    COHORT,
    CUSTOM
  }

  private final String wireName;
  private final Kind kind;

  ConditionType(String wireName, Kind kind) {
    this.wireName = wireName;
    this.kind = kind;
  }

  public String wireName() {
    return wireName;
  }

  public Kind kind() {
    return kind;
  }

  /** The user attribute this condition reads. Equal to the wire name. */
  public String attributeName() {
    return wireName;
  }

  public static Optional<ConditionType> fromWireName(String wireName) {
    return Arrays.stream(values()).filter(t -> t.wireName.equals(wireName)).findFirst();
  }

  @Override
  public String toString() {
    return wireName;
  }
}
