package ru.dimension.wiredup;

import java.util.List;
import java.util.Objects;

/**
 * Declarative description of a named service: its lifecycle, the target producing it, an optional
 * teardown hook and the ordered names of the services it depends on.
 *
 * @param teardown may be {@code null}
 */
public record Registration<T>(
    String name,
    Lifecycle lifecycle,
    Target<T> target,
    Teardown<? super T> teardown,
    List<String> dependencies
) {

  public Registration {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Service name must be non-blank");
    }
    name = name.trim();
    Objects.requireNonNull(lifecycle, "lifecycle");
    Objects.requireNonNull(target, "target");
    dependencies = List.copyOf(Target.normalizeNames(dependencies == null ? target.dependencies() : dependencies));
  }

  public Registration(String name, Lifecycle lifecycle, Target<T> target, Teardown<? super T> teardown) {
    this(name, lifecycle, target, teardown, target.dependencies());
  }

  public static <T> Registration<T> singleton(String name, Target<T> target) {
    return new Registration<>(name, Lifecycle.SINGLETON, target, null);
  }

  public static <T> Registration<T> singleton(String name, Target<T> target, Teardown<? super T> teardown) {
    return new Registration<>(name, Lifecycle.SINGLETON, target, teardown);
  }

  public static <T> Registration<T> scoped(String name, Target<T> target) {
    return new Registration<>(name, Lifecycle.SCOPED, target, null);
  }

  public static <T> Registration<T> scoped(String name, Target<T> target, Teardown<? super T> teardown) {
    return new Registration<>(name, Lifecycle.SCOPED, target, teardown);
  }

  public static <T> Registration<T> transientService(String name, Target<T> target) {
    return new Registration<>(name, Lifecycle.TRANSIENT, target, null);
  }

  public static <T> Registration<T> transientService(String name, Target<T> target, Teardown<? super T> teardown) {
    return new Registration<>(name, Lifecycle.TRANSIENT, target, teardown);
  }

  public boolean hasTeardown() {
    return teardown != null;
  }

  /**
   * Runs the teardown hook, if any, on {@code instance}.
   */
  @SuppressWarnings("unchecked")
  void tearDown(Object instance) {
    if (teardown == null) return;
    try {
      ((Teardown<Object>) teardown).tearDown(instance);
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Exception e) {
      throw new TeardownException(name, e);
    }
  }

  @Override
  public String toString() {
    return "Registration{" + name + ", " + lifecycle + ", dependencies=" + dependencies + "}";
  }
}
