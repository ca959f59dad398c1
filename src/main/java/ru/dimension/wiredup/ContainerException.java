package ru.dimension.wiredup;

/**
 * Base type of every error raised by the container.
 */
public class ContainerException extends IllegalStateException {

  public ContainerException(String message) {
    super(message);
  }

  public ContainerException(String message, Throwable cause) {
    super(message, cause);
  }
}
