package ru.dimension.wiredup;

public class ScopedKeyMissingException extends ContainerException {
  private final String key;

  public ScopedKeyMissingException(String key) {
    super("Scoped value " + key + " does not exist");
    this.key = key;
  }

  public String key() {
    return key;
  }
}
