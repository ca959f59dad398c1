package ru.dimension.wiredup;

/**
 * Wraps a checked exception thrown by a factory or constructor.
 */
public class ResolutionException extends ContainerException {

  public ResolutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
