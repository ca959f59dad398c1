package ru.dimension.wiredup;

import java.util.List;

/**
 * A submitted registration collides with a name the registry already holds.
 */
public class AlreadyRegisteredException extends ContainerException {
  private final List<String> names;

  public AlreadyRegisteredException(List<String> names) {
    super("Service already registered: " + String.join(", ", names));
    this.names = List.copyOf(names);
  }

  public List<String> names() {
    return names;
  }
}
