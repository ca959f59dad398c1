package ru.dimension.wiredup;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Optional process-wide access to one {@link Container}, for code that cannot have the container
 * passed in. Containers work without it.
 */
public final class WiredUp {

  private static final AtomicReference<Container> INSTANCE = new AtomicReference<>();

  private WiredUp() {}

  /**
   * Builds a container from {@code registrations} and installs it, or registers them into the
   * installed container when there is one.
   */
  public static Container init(Collection<? extends Registration<?>> registrations) {
    return init(registrations, ContainerConfig.defaults());
  }

  public static Container init(Collection<? extends Registration<?>> registrations, ContainerConfig config) {
    synchronized (INSTANCE) {
      Container current = INSTANCE.get();
      if (current != null) {
        return current.register(registrations);
      }
      Container created = Container.builder().config(config).register(registrations).build();
      INSTANCE.set(created);
      return created;
    }
  }

  public static Container init(Registration<?>... registrations) {
    return init(List.of(registrations));
  }

  public static void install(Container container) {
    INSTANCE.set(container);
  }

  /**
   * @throws NotInitializedException if no container was installed
   */
  public static Container instance() {
    Container c = INSTANCE.get();
    if (c == null) {
      throw new NotInitializedException("Container has not been initialized. Call WiredUp.init() first.");
    }
    return c;
  }

  /**
   * Forgets the installed container without destroying it.
   */
  public static Container reset() {
    return INSTANCE.getAndSet(null);
  }
}
