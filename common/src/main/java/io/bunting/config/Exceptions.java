package io.bunting.config;

import com.google.common.collect.ImmutableList;
import java.util.List;

public class Exceptions {

  private Exceptions() {}

  /** A user-chosen identifier does not follow the key naming rules. */
  public static class InvalidKeyException extends IllegalArgumentException {
    private final String key;
    private final KeyError error;

    public InvalidKeyException(String key, KeyError error) {
      super(String.format("Invalid key '%s': %s", key, error.message()));
      this.key = key;
      this.error = error;
    }

    public String getKey() {
      return key;
    }

    public KeyError getError() {
      return error;
    }
  }

  /**
   * The stored entities cannot be emitted as a structurally complete artifact. Carries every
   * problem found in the compile pass, not only the first one.
   */
  public static class CompileException extends RuntimeException {
    private final ImmutableList<String> problems;

    public CompileException(List<String> problems) {
      super(
          problems.size() == 1
              ? problems.get(0)
              : String.format(
                  "%d compile errors: %s", problems.size(), String.join("; ", problems)));
      this.problems = ImmutableList.copyOf(problems);
    }

    public List<String> getProblems() {
      return problems;
    }
  }

  public static class ArtifactParseException extends RuntimeException {
    public ArtifactParseException(String message) {
      super(message);
    }

    public ArtifactParseException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class FlagNotFoundException extends RuntimeException {
    public FlagNotFoundException(String flagKey) {
      super(String.format("No flag '%s' in the artifact", flagKey));
    }
  }

  /** No usable signing key, or the key material is malformed. Aborts the publish. */
  public static class SigningException extends RuntimeException {
    public SigningException(String message) {
      super(message);
    }

    public SigningException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
