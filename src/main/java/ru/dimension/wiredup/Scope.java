package ru.dimension.wiredup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Key/value store of one logical request. Holds the scoped service instances created while the
 * scope is open.
 *
 * <p>A scope is visible only on the thread that opened it. Work handed to other threads sees it when
 * wrapped with {@link #wrap(Runnable)} or {@link #wrap(Callable)}.
 */
public final class Scope {
  private static final AtomicLong IDS = new AtomicLong();

  private final long id = IDS.incrementAndGet();
  private final RequestScope owner;
  private final Map<String, Object> store = new LinkedHashMap<>();
  private final List<Registration<?>> created = new ArrayList<>();
  private final Map<String, Object> creationLocks = new ConcurrentHashMap<>();

  Scope(RequestScope owner) {
    this.owner = owner;
  }

  public long id() {
    return id;
  }

  /**
   * Stores {@code value} under {@code key}. Storing the same instance again is a no-op.
   *
   * @throws ScopedKeyConflictException if {@code key} already holds a different value
   */
  public synchronized void set(String key, Object value) {
    Objects.requireNonNull(key, "key");
    if (store.containsKey(key) && store.get(key) != value) {
      throw new ScopedKeyConflictException(key);
    }
    store.put(key, value);
  }

  /**
   * @throws ScopedKeyMissingException if nothing is stored under {@code key}
   */
  public synchronized Object get(String key) {
    if (!store.containsKey(key)) {
      throw new ScopedKeyMissingException(key);
    }
    return store.get(key);
  }

  public <T> T get(String key, Class<T> type) {
    return type.cast(get(key));
  }

  public synchronized boolean contains(String key) {
    return store.containsKey(key);
  }

  /**
   * @throws ScopedKeyMissingException if nothing is stored under {@code key}
   */
  public synchronized void delete(String key) {
    if (!store.containsKey(key)) {
      throw new ScopedKeyMissingException(key);
    }
    store.remove(key);
  }

  public synchronized List<String> keys() {
    return List.copyOf(store.keySet());
  }

  public synchronized boolean isEmpty() {
    return store.isEmpty();
  }

  // =========================================================================
  // Propagation to other threads
  // =========================================================================

  public Runnable wrap(Runnable task) {
    Objects.requireNonNull(task, "task");
    return () -> {
      try (RequestScope.Handle ignored = owner.enter(this)) {
        task.run();
      }
    };
  }

  public <V> Callable<V> wrap(Callable<V> task) {
    Objects.requireNonNull(task, "task");
    return () -> {
      try (RequestScope.Handle ignored = owner.enter(this)) {
        return task.call();
      }
    };
  }

  // =========================================================================
  // Scoped registrations created in this scope, in creation order
  // =========================================================================

  /**
   * Monitor serializing creation of the scoped service {@code name} across threads sharing this scope.
   */
  Object creationLock(String name) {
    return creationLocks.computeIfAbsent(name, k -> new Object());
  }

  synchronized void track(Registration<?> registration) {
    created.add(registration);
  }

  synchronized List<Registration<?>> tracked() {
    return List.copyOf(created);
  }

  synchronized void untrack(Registration<?> registration) {
    created.remove(registration);
  }

  @Override
  public String toString() {
    return "Scope#" + id + keys();
  }
}
