package ru.dimension.wiredup;

public class NotInitializedException extends ContainerException {

  public NotInitializedException(String message) {
    super(message);
  }
}
