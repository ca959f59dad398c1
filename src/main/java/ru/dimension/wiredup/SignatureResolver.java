package ru.dimension.wiredup;

import java.lang.reflect.Constructor;
import java.util.List;
import java.util.Objects;

/**
 * Supplies the constructor to call for a class and the ordered dependency names its parameters
 * are resolved from. Dependency names are declared by the class, never inferred from code.
 */
@FunctionalInterface
public interface SignatureResolver {

  Signature describe(Class<?> type);

  record Signature(Constructor<?> constructor, List<String> dependencies) {
    public Signature {
      Objects.requireNonNull(constructor, "constructor");
      dependencies = List.copyOf(dependencies);
      if (dependencies.size() != constructor.getParameterCount()) {
        throw new IllegalArgumentException(
            "Constructor " + constructor + " takes " + constructor.getParameterCount()
                + " parameters but " + dependencies.size() + " dependency names were declared");
      }
    }
  }
}
