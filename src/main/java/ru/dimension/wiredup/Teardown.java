package ru.dimension.wiredup;

/**
 * Cleanup hook invoked with the instance whose lifecycle ended.
 *
 * <pre>
 *   Registration.singleton("db", Target.call(args -&gt; Database.connect()), Database::close);
 * </pre>
 */
@FunctionalInterface
public interface Teardown<T> {

  void tearDown(T instance) throws Exception;

  /**
   * Teardown that closes {@link AutoCloseable} instances and ignores {@code null}.
   */
  static <T extends AutoCloseable> Teardown<T> closing() {
    return instance -> {
      if (instance != null) instance.close();
    };
  }
}
