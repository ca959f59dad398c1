package ru.dimension.wiredup;

import java.util.List;

/**
 * Two registrations submitted together share a name.
 */
public class DuplicateServiceNameException extends ContainerException {
  private final List<String> names;

  public DuplicateServiceNameException(List<String> names) {
    super("Duplicate service names: " + String.join(", ", names));
    this.names = List.copyOf(names);
  }

  public List<String> names() {
    return names;
  }
}
