package ru.dimension.wiredup;

public class ScopeMissingException extends ContainerException {

  public ScopeMissingException(String message) {
    super(message);
  }
}
