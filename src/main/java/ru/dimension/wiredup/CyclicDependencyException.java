package ru.dimension.wiredup;

import java.util.List;

/**
 * The dependency relation contains a cycle. {@link #cycle()} lists the names along the cycle,
 * starting and ending with the same name.
 */
public class CyclicDependencyException extends ContainerException {
  private final List<String> cycle;

  public CyclicDependencyException(List<String> cycle) {
    super("Circular dependency detected: " + String.join(" -> ", cycle));
    this.cycle = List.copyOf(cycle);
  }

  public List<String> cycle() {
    return cycle;
  }
}
