package ru.dimension.wiredup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Resolved dependency values handed to a {@link Target}, in declared order.
 * Values can be read by position or by the dependency name they were resolved for.
 */
public final class Arguments {
  private static final Arguments EMPTY = new Arguments(List.of(), List.of());

  private final List<String> names;
  private final List<Object> values;

  private Arguments(List<String> names, List<Object> values) {
    this.names = names;
    this.values = values;
  }

  public static Arguments empty() {
    return EMPTY;
  }

  /**
   * @param names  dependency names, one per value
   * @param values resolved instances; may contain {@code null} when a factory produced it
   */
  public static Arguments of(List<String> names, List<?> values) {
    Objects.requireNonNull(names, "names");
    Objects.requireNonNull(values, "values");
    if (names.size() != values.size()) {
      throw new IllegalArgumentException(
          "Got " + values.size() + " values for " + names.size() + " dependency names");
    }
    if (names.isEmpty()) return EMPTY;
    return new Arguments(List.copyOf(names), Collections.unmodifiableList(new ArrayList<>(values)));
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public List<String> names() {
    return names;
  }

  public Object get(int index) {
    return values.get(index);
  }

  public <T> T get(int index, Class<T> type) {
    return cast(names.get(index), values.get(index), type);
  }

  /**
   * Returns the value resolved for {@code name}. When a name is declared twice the first
   * occurrence wins.
   */
  public <T> T get(String name, Class<T> type) {
    int idx = names.indexOf(name);
    if (idx < 0) {
      throw new IllegalArgumentException("No argument resolved for dependency '" + name + "', have " + names);
    }
    return cast(name, values.get(idx), type);
  }

  public Object[] toArray() {
    return values.toArray();
  }

  private static <T> T cast(String name, Object value, Class<T> type) {
    if (value != null && !type.isInstance(value)) {
      throw new ClassCastException(
          "Dependency '" + name + "' is " + value.getClass().getName() + ", not " + type.getName());
    }
    return type.cast(value);
  }

  @Override
  public String toString() {
    return "Arguments" + names;
  }
}
