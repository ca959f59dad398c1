package ru.dimension.wiredup;

public class ServiceNotRegisteredException extends ContainerException {
  private final String name;

  public ServiceNotRegisteredException(String name) {
    super("Service " + name + " not registered");
    this.name = name;
  }

  public String name() {
    return name;
  }
}
