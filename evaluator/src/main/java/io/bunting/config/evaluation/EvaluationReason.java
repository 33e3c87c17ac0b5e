package io.bunting.config.evaluation;

public enum EvaluationReason {
  DEFAULT("default"),
  CONDITIONAL("conditional"),
  TEST("test"),
  ROLLOUT("rollout");

  private final String wireName;

  EvaluationReason(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  @Override
  public String toString() {
    return wireName;
  }
}
