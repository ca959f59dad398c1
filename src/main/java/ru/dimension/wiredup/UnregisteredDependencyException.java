package ru.dimension.wiredup;

import java.util.List;

/**
 * A target declares dependency names that have no registration.
 */
public class UnregisteredDependencyException extends ContainerException {
  private final List<String> names;

  public UnregisteredDependencyException(List<String> names) {
    super("Not all dependencies are registered services: " + String.join(", ", names));
    this.names = List.copyOf(names);
  }

  public List<String> names() {
    return names;
  }
}
