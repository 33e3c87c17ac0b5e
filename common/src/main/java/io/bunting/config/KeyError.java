package io.bunting.config;

/** Reasons an identifier key is rejected. Messages are short enough to render inline in a form. */
public enum KeyError {
  EMPTY("Key cannot be empty"),
  INVALID_CHARACTERS("Key must contain only lowercase letters (a-z) and underscores"),
  LEADING_UNDERSCORE("Key cannot start with underscore"),
  TRAILING_UNDERSCORE("Key cannot end with underscore"),
  TOO_LONG("Key cannot exceed 64 characters"),
  TOO_SHORT("Key must be at least 2 characters long");

  private final String message;

  KeyError(String message) {
    this.message = message;
  }

  public String message() {
    return message;
  }
}
