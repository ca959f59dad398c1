package ru.dimension.wiredup;

import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.lang.reflect.Constructor;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads dependency names from {@link Named} on the parameters of the single {@link Inject}
 * constructor, falling back to the no-arg constructor.
 *
 * <pre>
 *   public Worker(@Named("logger") RequestLogger logger, @Named("db") Database db) { ... }
 * </pre>
 */
public final class NamedSignatureResolver implements SignatureResolver {
  public static final NamedSignatureResolver INSTANCE = new NamedSignatureResolver();

  private NamedSignatureResolver() {}

  @Override
  public Signature describe(Class<?> type) {
    Constructor<?> ctor = findInjectConstructor(type);

    Parameter[] params = ctor.getParameters();
    List<String> names = new ArrayList<>(params.length);
    for (int i = 0; i < params.length; i++) {
      String name = readNamed(params[i].getAnnotation(Named.class));
      if (name == null) {
        throw new IllegalArgumentException(
            "Parameter " + i + " (" + params[i].getType().getName() + ") of " + type.getName()
                + " has no @Named dependency name");
      }
      names.add(name);
    }
    return new Signature(ctor, names);
  }

  private static String readNamed(Named named) {
    if (named == null) return null;
    String v = named.value();
    return (v == null || v.isBlank()) ? null : v.trim();
  }

  private static Constructor<?> findInjectConstructor(Class<?> clazz) {
    Constructor<?> inject = null;

    for (Constructor<?> c : clazz.getDeclaredConstructors()) {
      if (c.isAnnotationPresent(Inject.class)) {
        if (inject != null) {
          throw new IllegalArgumentException("Multiple @Inject constructors in " + clazz.getName());
        }
        inject = c;
      }
    }

    if (inject == null) {
      try {
        inject = clazz.getDeclaredConstructor();
      } catch (NoSuchMethodException e) {
        throw new IllegalArgumentException("No @Inject or default constructor in " + clazz.getName(), e);
      }
    }
    return inject;
  }
}
