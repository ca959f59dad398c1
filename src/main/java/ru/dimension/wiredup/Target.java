package ru.dimension.wiredup;

import jakarta.inject.Inject;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Something the container can invoke with resolved dependencies: a constructor that allocates a new
 * instance, or a callable that returns a value. The kind is fixed when the target is created.
 *
 * <pre>
 *   Target.construct(Worker.class, "logger", "db");
 *   Target.call(args -&gt; new Worker(args.get(0, RequestLogger.class), args.get(1, Database.class)),
 *               "logger", "db");
 * </pre>
 */
public final class Target<T> {

  public enum Kind {
    /** Allocates a new instance through a constructor. */
    CONSTRUCTOR,
    /** Produces a value by invoking a function. */
    CALLABLE
  }

  @FunctionalInterface
  public interface Invocation<T> {
    T invoke(Arguments args) throws Exception;
  }

  private final Kind kind;
  private final String description;
  private final List<String> dependencies;
  private final Invocation<T> invocation;

  private Target(Kind kind, String description, List<String> dependencies, Invocation<T> invocation) {
    this.kind = kind;
    this.description = description;
    this.dependencies = List.copyOf(dependencies);
    this.invocation = invocation;
  }

  // =========================================================================
  // Callables
  // =========================================================================

  public static <T> Target<T> call(Invocation<T> invocation, String... dependencies) {
    return call(invocation, List.of(dependencies));
  }

  public static <T> Target<T> call(Invocation<T> invocation, List<String> dependencies) {
    Objects.requireNonNull(invocation, "invocation");
    return new Target<>(Kind.CALLABLE, "callable " + invocation.getClass().getName(),
                        normalizeNames(dependencies), invocation);
  }

  /**
   * Callable without dependencies that always returns {@code value}.
   */
  public static <T> Target<T> instance(T value) {
    return new Target<>(Kind.CALLABLE, "instance of " + (value == null ? "null" : value.getClass().getName()),
                        List.of(), args -> value);
  }

  // =========================================================================
  // Constructors
  // =========================================================================

  /**
   * Constructor target whose dependency names are read by {@link NamedSignatureResolver}.
   */
  public static <T> Target<T> construct(Class<T> type) {
    return construct(type, NamedSignatureResolver.INSTANCE);
  }

  public static <T> Target<T> construct(Class<T> type, SignatureResolver resolver) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(resolver, "resolver");
    SignatureResolver.Signature signature = resolver.describe(type);
    return constructor(type, signature.constructor(), signature.dependencies());
  }

  /**
   * Constructor target with explicitly declared dependency names. The constructor is picked by
   * arity; among several with the same arity the {@link Inject} one wins.
   */
  public static <T> Target<T> construct(Class<T> type, String... dependencies) {
    Objects.requireNonNull(type, "type");
    List<String> names = normalizeNames(List.of(dependencies));
    return constructor(type, findConstructor(type, names.size()), names);
  }

  private static <T> Target<T> constructor(Class<T> type, Constructor<?> ctor, List<String> names) {
    MethodHandle mh = unreflectConstructor(type, ctor);
    Invocation<T> invocation = args -> {
      try {
        return type.cast(mh.invokeWithArguments(args.toArray()));
      } catch (Exception | Error e) {
        throw e;
      } catch (Throwable t) {
        throw new ResolutionException("Failed to instantiate " + type.getName(), t);
      }
    };
    return new Target<>(Kind.CONSTRUCTOR, "constructor of " + type.getName(), names, invocation);
  }

  private static Constructor<?> findConstructor(Class<?> clazz, int arity) {
    List<Constructor<?>> candidates = new ArrayList<>();
    for (Constructor<?> c : clazz.getDeclaredConstructors()) {
      if (c.getParameterCount() == arity) candidates.add(c);
    }
    if (candidates.isEmpty()) {
      throw new IllegalArgumentException("No constructor of " + clazz.getName() + " takes " + arity + " parameters");
    }
    if (candidates.size() == 1) return candidates.get(0);

    Constructor<?> inject = null;
    for (Constructor<?> c : candidates) {
      if (c.isAnnotationPresent(Inject.class)) {
        if (inject != null) {
          throw new IllegalArgumentException("Multiple @Inject constructors in " + clazz.getName());
        }
        inject = c;
      }
    }
    if (inject == null) {
      throw new IllegalArgumentException(
          "Ambiguous constructors with " + arity + " parameters in " + clazz.getName() + "; mark one with @Inject");
    }
    return inject;
  }

  private static MethodHandle unreflectConstructor(Class<?> clazz, Constructor<?> ctor) {
    if (!ctor.canAccess(null) && !ctor.trySetAccessible()) {
      throw new IllegalArgumentException("Cannot access constructor of " + clazz.getName() + ": " + ctor);
    }
    try {
      MethodHandles.Lookup privateLookup = MethodHandles.privateLookupIn(clazz, MethodHandles.lookup());
      return privateLookup.unreflectConstructor(ctor);
    } catch (IllegalAccessException e) {
      throw new IllegalArgumentException("Cannot access constructor of " + clazz.getName(), e);
    }
  }

  /**
   * Rejects blank dependency names and trims the others, the same way service names are trimmed.
   */
  static List<String> normalizeNames(List<String> names) {
    Objects.requireNonNull(names, "dependencies");
    List<String> out = new ArrayList<>(names.size());
    for (String n : names) {
      if (n == null || n.isBlank()) {
        throw new IllegalArgumentException("Dependency names must be non-blank: " + Arrays.toString(names.toArray()));
      }
      out.add(n.trim());
    }
    return out;
  }


  // =========================================================================
  // Accessors
  // =========================================================================

  public Kind kind() {
    return kind;
  }

  /**
   * Dependency names this target declares, in parameter order.
   */
  public List<String> dependencies() {
    return dependencies;
  }

  /**
   * Invokes the target. Checked exceptions are wrapped in {@link ResolutionException}; unchecked ones
   * propagate unchanged.
   */
  T invoke(Arguments args) {
    try {
      return invocation.invoke(args);
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Exception e) {
      throw new ResolutionException("Failed to invoke " + description, e);
    }
  }

  @Override
  public String toString() {
    return "Target{" + description + ", dependencies=" + dependencies + "}";
  }
}
