package ru.dimension.wiredup;

import jakarta.inject.Provider;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dependency-injection container: the composition root that owns the registry, the singleton cache
 * and the per-thread scopes.
 *
 * <pre>
 *   Container container = Container.builder()
 *       .singleton("db", Target.call(args -&gt; Database.connect()), Database::close)
 *       .scoped("logger", Target.construct(RequestLogger.class))
 *       .transientService("worker", Target.construct(Worker.class, "logger", "db"))
 *       .build();
 *
 *   container.startScope(scope -&gt; container.resolve(Target.call(args -&gt; ..., "worker")));
 *   container.destroy();
 * </pre>
 *
 * Lifecycles:
 * - singleton: created at most once per container, torn down by {@link #destroy()}
 * - scoped: created at most once per open scope, torn down when the scope ends
 * - transient: created for every lookup; torn down right after {@link #resolve(Target)} returns
 *   when it was one of the resolved target's dependencies
 */
public final class Container {
  private static final Logger LOGGER = LoggerFactory.getLogger(Container.class);

  private static final Object NULL = new Object();

  private final ContainerConfig config;
  private final Registry registry = new Registry();
  private final RequestScope scopes = new RequestScope();

  private final Map<String, Object> singletons = new ConcurrentHashMap<>();
  private final Map<String, Object> creationLocks = new ConcurrentHashMap<>();
  private final Deque<Registration<?>> singletonOrder = new ConcurrentLinkedDeque<>();
  private final ThreadLocal<Deque<String>> creationStack = ThreadLocal.withInitial(ArrayDeque::new);

  private final Object lock = new Object();
  private volatile boolean initialized;
  private volatile boolean destroying;

  private Container(ContainerConfig config) {
    this.config = config;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ContainerConfig config() {
    return config;
  }

  public RequestScope scopes() {
    return scopes;
  }

  public boolean isInitialized() {
    return initialized;
  }

  // =========================================================================
  // Registration
  // =========================================================================

  /**
   * Adds registrations to the container; re-initializes a destroyed container. Singletons are
   * created right away unless the container loads lazily. If one of them fails, the singletons this
   * call created are torn down and its registrations are removed again before the failure is thrown.
   *
   * @throws CyclicDependencyException     if the registrations introduce a cycle
   * @throws DuplicateServiceNameException if two of {@code registrations} share a name
   * @throws AlreadyRegisteredException    if a name is already registered
   */
  public Container register(Collection<? extends Registration<?>> registrations) {
    List<Registration<?>> committed;
    Set<String> unresolved;
    int total;
    synchronized (lock) {
      committed = registry.register(registrations);
      initialized = true;
      unresolved = registry.unresolvedDependencies();
      total = registry.size();
    }

    LOGGER.info("Registered {} services ({} total)", committed.size(), total);
    if (!unresolved.isEmpty()) {
      LOGGER.warn("Dependencies without a registration: {}", unresolved);
    }

    if (!config.lazyLoad()) {
      try {
        for (Registration<?> r : committed) {
          if (r.lifecycle() == Lifecycle.SINGLETON) singleton(r);
        }
      } catch (RuntimeException | Error e) {
        rollback(committed, e);
        throw e;
      }
    }
    return this;
  }

  private void rollback(List<Registration<?>> committed, Throwable failure) {
    Set<Registration<?>> batch = Collections.newSetFromMap(new IdentityHashMap<>());
    batch.addAll(committed);

    List<Registration<?>> created = new ArrayList<>();
    for (Registration<?> r : singletonOrder) {
      if (batch.contains(r)) created.add(r);
    }
    for (int i = created.size() - 1; i >= 0; i--) {
      Registration<?> r = created.get(i);
      singletonOrder.removeIf(o -> o == r);
      Object instance = singletons.remove(r.name());
      if (instance == null || !r.hasTeardown()) continue;
      try {
        r.tearDown(unmask(instance));
      } catch (RuntimeException t) {
        failure.addSuppressed(t);
      }
    }

    synchronized (lock) {
      registry.unregister(committed);
      for (Registration<?> r : committed) {
        creationLocks.remove(r.name());
      }
    }
    LOGGER.warn("Eager creation failed, rolled back {} registrations", committed.size());
  }

  /**
   * All registrations in dependency order.
   */
  public List<Registration<?>> registrations() {
    synchronized (lock) {
      requireInitialized();
      return registry.all();
    }
  }

  // =========================================================================
  // Lookup
  // =========================================================================

  /**
   * Returns the instance of {@code name} according to its lifecycle, creating it if needed.
   *
   * @throws NotInitializedException        if the container was destroyed
   * @throws ServiceNotRegisteredException  if {@code name} has no registration
   * @throws ScopeMissingException          if {@code name} is scoped and no scope is open
   */
  public Object getService(String name) {
    return obtain(lookup(name));
  }

  public <T> T getService(String name, Class<T> type) {
    return type.cast(getService(name));
  }

  /**
   * Returns a singleton that has already been created, without creating it.
   *
   * @throws SingletonNotInitializedException if the singleton was not created yet
   */
  public Object getSingleton(String name) {
    Registration<?> r = lookup(name);
    if (r.lifecycle() != Lifecycle.SINGLETON) {
      throw new IllegalArgumentException("Service " + name + " is " + r.lifecycle() + ", not a singleton");
    }
    Object instance = singletons.get(name);
    if (instance == null) {
      throw new SingletonNotInitializedException(name, "Singleton " + name + " has not been created yet");
    }
    return unmask(instance);
  }

  public <T> T getSingleton(String name, Class<T> type) {
    return type.cast(getSingleton(name));
  }

  /**
   * Lazy handle that looks {@code name} up on every {@link Provider#get()}.
   */
  public <T> Provider<T> provider(String name, Class<T> type) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    return () -> getService(name, type);
  }

  private Registration<?> lookup(String name) {
    Objects.requireNonNull(name, "name");
    synchronized (lock) {
      requireInitialized();
      Registration<?> r = registry.get(name);
      if (r == null) throw new ServiceNotRegisteredException(name);
      return r;
    }
  }

  private Object obtain(Registration<?> r) {
    return switch (r.lifecycle()) {
      case SINGLETON -> singleton(r);
      case SCOPED -> scoped(r);
      case TRANSIENT -> create(r);
    };
  }

  // =========================================================================
  // Instance store
  // =========================================================================

  private Object singleton(Registration<?> r) {
    Object existing = singletons.get(r.name());
    if (existing != null) return unmask(existing);

    if (inCreation(r.name())) {
      throw new SingletonNotInitializedException(
          r.name(), "Singleton " + r.name() + " requested while it is being created: " + creationStack.get());
    }

    Object creationLock = creationLocks.computeIfAbsent(r.name(), k -> new Object());
    synchronized (creationLock) {
      existing = singletons.get(r.name());
      if (existing != null) return unmask(existing);
      if (destroying) {
        throw new NotInitializedException("Container is being destroyed");
      }

      Object instance = create(r);
      singletons.put(r.name(), mask(instance));
      singletonOrder.add(r);
      return instance;
    }
  }

  private Object scoped(Registration<?> r) {
    Scope scope = scopes.current();
    if (scope.contains(r.name())) return scope.get(r.name());

    synchronized (scope.creationLock(r.name())) {
      if (scope.contains(r.name())) return scope.get(r.name());

      Object instance = create(r);
      scope.set(r.name(), instance);
      scope.track(r);
      return instance;
    }
  }

  private Object create(Registration<?> r) {
    Deque<String> stack = creationStack.get();
    if (stack.contains(r.name())) {
      List<String> path = new ArrayList<>();
      stack.descendingIterator().forEachRemaining(path::add);
      path.add(r.name());
      throw new CyclicDependencyException(path.subList(path.indexOf(r.name()), path.size()));
    }

    stack.push(r.name());
    try {
      LOGGER.debug("Creating {} service {}", r.lifecycle(), r.name());
      return resolve(r.target(), r.dependencies());
    } finally {
      stack.pop();
      if (stack.isEmpty()) creationStack.remove();
    }
  }

  private boolean inCreation(String name) {
    Deque<String> stack = creationStack.get();
    boolean found = stack.contains(name);
    if (stack.isEmpty()) creationStack.remove();
    return found;
  }

  private static Object mask(Object instance) {
    return instance == null ? NULL : instance;
  }

  private static Object unmask(Object stored) {
    return stored == NULL ? null : stored;
  }

  // =========================================================================
  // Resolver
  // =========================================================================

  public <T> T resolve(Target<T> target) {
    Objects.requireNonNull(target, "target");
    return resolve(target, target.dependencies());
  }

  /**
   * Resolves every name in {@code dependencies} and invokes {@code target} with the instances in
   * that order. Transient dependencies created for this call are torn down once the invocation
   * finishes, whether it succeeded or not.
   *
   * @throws UnregisteredDependencyException if any name has no registration; no factory runs then
   */
  public <T> T resolve(Target<T> target, List<String> dependencies) {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(dependencies, "dependencies");

    if (dependencies.isEmpty()) {
      return target.invoke(Arguments.empty());
    }

    List<Registration<?>> regs = new ArrayList<>(dependencies.size());
    synchronized (lock) {
      requireInitialized();
      List<String> missing = registry.missing(dependencies);
      if (!missing.isEmpty()) {
        throw new UnregisteredDependencyException(missing);
      }
      for (String name : dependencies) {
        regs.add(registry.get(name));
      }
    }

    List<Object> values = new ArrayList<>(regs.size());
    List<Object> transients = new ArrayList<>();
    List<Registration<?>> transientRegs = new ArrayList<>();
    Throwable failure = null;
    try {
      for (Registration<?> r : regs) {
        Object instance = obtain(r);
        values.add(instance);
        if (r.lifecycle() == Lifecycle.TRANSIENT) {
          transientRegs.add(r);
          transients.add(instance);
        }
      }
      return target.invoke(Arguments.of(dependencies, values));
    } catch (RuntimeException | Error e) {
      failure = e;
      throw e;
    } finally {
      tearDownTransients(transientRegs, transients, failure);
    }
  }

  private static void tearDownTransients(List<Registration<?>> regs, List<Object> instances, Throwable failure) {
    List<RuntimeException> errors = new ArrayList<>();
    for (int i = 0; i < regs.size(); i++) {
      Registration<?> r = regs.get(i);
      if (!r.hasTeardown()) continue;
      try {
        LOGGER.debug("Tearing down transient service {}", r.name());
        r.tearDown(instances.get(i));
      } catch (RuntimeException e) {
        errors.add(e);
      }
    }
    if (errors.isEmpty()) return;

    if (failure != null) {
      errors.forEach(failure::addSuppressed);
    } else {
      throw combine(errors);
    }
  }

  // =========================================================================
  // Scopes
  // =========================================================================

  /**
   * Opens a scope on the current thread, creates the scoped services (unless disabled in the
   * config), runs {@code callback} and closes the scope. Scoped instances still present when the
   * callback returns or fails are torn down as by {@link #endScope()}.
   *
   * @return the callback's result
   */
  public <T> T startScope(ScopeCallback<T> callback) {
    Objects.requireNonNull(callback, "callback");
    requireInitialized();

    Scope scope = scopes.open();
    LOGGER.debug("Opened scope {}", scope.id());
    T result;
    try {
      if (config.eagerScopes()) {
        List<Registration<?>> scoped;
        synchronized (lock) {
          scoped = registry.withLifecycle(Lifecycle.SCOPED);
        }
        for (Registration<?> r : scoped) {
          scoped(r);
        }
      }
      result = runCallback(callback, scope);
    } catch (RuntimeException | Error e) {
      try {
        tearDownScope(scope);
      } catch (RuntimeException t) {
        e.addSuppressed(t);
      } finally {
        closeScope(scope);
      }
      throw e;
    }

    try {
      tearDownScope(scope);
    } finally {
      closeScope(scope);
    }
    return result;
  }

  private static <T> T runCallback(ScopeCallback<T> callback, Scope scope) {
    try {
      return callback.run(scope);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new ResolutionException("Scope callback failed", e);
    }
  }

  private void closeScope(Scope scope) {
    scopes.close(scope);
    LOGGER.debug("Closed scope {}", scope.id());
  }

  /**
   * Tears down the scoped instances of the current scope and removes them from it. The scope stays
   * open; services requested afterwards are created again.
   *
   * @throws NotInitializedException if the container was destroyed
   * @throws ScopeMissingException   if no scope is open on this thread
   */
  public void endScope() {
    requireInitialized();
    tearDownScope(scopes.current());
  }

  private void tearDownScope(Scope scope) {
    List<Registration<?>> created = scope.tracked();
    List<RuntimeException> errors = new ArrayList<>();

    for (int i = created.size() - 1; i >= 0; i--) {
      Registration<?> r = created.get(i);
      try {
        if (scope.contains(r.name())) {
          LOGGER.debug("Tearing down scoped service {} in scope {}", r.name(), scope.id());
          r.tearDown(scope.get(r.name()));
        }
      } catch (RuntimeException e) {
        errors.add(e);
      } finally {
        if (scope.contains(r.name())) scope.delete(r.name());
        scope.untrack(r);
      }
    }

    if (!errors.isEmpty()) throw combine(errors);
  }

  // =========================================================================
  // Teardown
  // =========================================================================

  /**
   * Tears down the created singletons in reverse creation order, then clears every cache and the
   * registry. Hooks run while the container is still live, so they may read other singletons through
   * {@link #getSingleton(String)}. Every hook runs even when an earlier one fails; the first failure
   * is thrown afterwards with the others suppressed.
   *
   * @throws NotInitializedException if the container is not initialized
   */
  public void destroy() {
    List<Registration<?>> created;
    synchronized (lock) {
      requireInitialized();
      if (destroying) {
        throw new NotInitializedException("Container is being destroyed");
      }
      destroying = true;
      created = new ArrayList<>(singletonOrder);
    }

    List<RuntimeException> errors = new ArrayList<>();
    try {
      for (int i = created.size() - 1; i >= 0; i--) {
        Registration<?> r = created.get(i);
        Object instance = singletons.get(r.name());
        if (instance == null || !r.hasTeardown()) continue;
        try {
          LOGGER.debug("Tearing down singleton service {}", r.name());
          r.tearDown(unmask(instance));
        } catch (RuntimeException e) {
          errors.add(e);
        }
      }
    } finally {
      synchronized (lock) {
        initialized = false;
        destroying = false;
        singletons.clear();
        singletonOrder.clear();
        creationLocks.clear();
        registry.clear();
      }
    }
    LOGGER.info("Container destroyed, released {} singletons", created.size());

    if (!errors.isEmpty()) throw combine(errors);
  }

  private void requireInitialized() {
    if (!initialized) {
      throw new NotInitializedException("Container has not been initialized");
    }
  }

  private static RuntimeException combine(List<RuntimeException> errors) {
    RuntimeException first = errors.get(0);
    for (int i = 1; i < errors.size(); i++) {
      first.addSuppressed(errors.get(i));
    }
    return first;
  }

  // =========================================================================
  // Builder
  // =========================================================================

  public static final class Builder {
    private final List<Registration<?>> registrations = new ArrayList<>();
    private ContainerConfig config = ContainerConfig.defaults();

    private Builder() {}

    public Builder config(ContainerConfig config) {
      this.config = Objects.requireNonNull(config, "config");
      return this;
    }

    public Builder lazyLoad(boolean enabled) {
      this.config = config.withLazyLoad(enabled);
      return this;
    }

    public Builder eagerScopes(boolean enabled) {
      this.config = config.withEagerScopes(enabled);
      return this;
    }

    public Builder register(Registration<?>... registrations) {
      return register(List.of(registrations));
    }

    public Builder register(Collection<? extends Registration<?>> registrations) {
      for (Registration<?> r : registrations) {
        this.registrations.add(Objects.requireNonNull(r, "registration"));
      }
      return this;
    }

    public <T> Builder singleton(String name, Target<T> target) {
      return register(Registration.singleton(name, target));
    }

    public <T> Builder singleton(String name, Target<T> target, Teardown<? super T> teardown) {
      return register(Registration.singleton(name, target, teardown));
    }

    public <T> Builder scoped(String name, Target<T> target) {
      return register(Registration.scoped(name, target));
    }

    public <T> Builder scoped(String name, Target<T> target, Teardown<? super T> teardown) {
      return register(Registration.scoped(name, target, teardown));
    }

    public <T> Builder transientService(String name, Target<T> target) {
      return register(Registration.transientService(name, target));
    }

    public <T> Builder transientService(String name, Target<T> target, Teardown<? super T> teardown) {
      return register(Registration.transientService(name, target, teardown));
    }

    /**
     * Builds the container and registers everything added so far.
     *
     * @throws CyclicDependencyException     if the registrations contain a cycle
     * @throws DuplicateServiceNameException if two registrations share a name
     */
    public Container build() {
      Container container = new Container(config);
      container.register(registrations);
      return container;
    }
  }
}
