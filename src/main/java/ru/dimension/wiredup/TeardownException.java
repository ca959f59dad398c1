package ru.dimension.wiredup;

/**
 * Wraps a checked exception thrown by a teardown hook.
 */
public class TeardownException extends ContainerException {
  private final String name;

  public TeardownException(String name, Throwable cause) {
    super("Teardown of service " + name + " failed", cause);
    this.name = name;
  }

  public String name() {
    return name;
  }
}
