package ru.dimension.wiredup;

public class ScopedKeyConflictException extends ContainerException {
  private final String key;

  public ScopedKeyConflictException(String key) {
    super("Attempt to overwrite scoped value " + key);
    this.key = key;
  }

  public String key() {
    return key;
  }
}
