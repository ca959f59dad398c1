package ru.dimension.wiredup;

/**
 * A singleton was requested before its creation completed: either it has not been created yet
 * (see {@link Container#getSingleton(String)}) or its own factory asked for it.
 */
public class SingletonNotInitializedException extends ContainerException {
  private final String name;

  public SingletonNotInitializedException(String name, String message) {
    super(message);
    this.name = name;
  }

  public String name() {
    return name;
  }
}
