package ru.dimension.wiredup;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Tracks the scopes open on each thread. Scopes nest: {@link #open()} pushes a fresh scope that
 * hides the enclosing one until it is closed.
 *
 * <p>Threads started inside a scope do not inherit it; hand them work through
 * {@link Scope#wrap(Runnable)}.
 */
public final class RequestScope {

  private final ThreadLocal<Deque<Scope>> active = ThreadLocal.withInitial(ArrayDeque::new);

  /**
   * Restores the previous scope of the thread when closed.
   */
  public interface Handle extends AutoCloseable {
    @Override
    void close();
  }

  Scope open() {
    Scope scope = new Scope(this);
    active.get().push(scope);
    return scope;
  }

  void close(Scope scope) {
    Deque<Scope> stack = active.get();
    if (stack.peek() != scope) {
      throw new IllegalStateException("Scope " + scope.id() + " is not the innermost scope of this thread");
    }
    stack.pop();
    if (stack.isEmpty()) active.remove();
  }

  Handle enter(Scope scope) {
    active.get().push(scope);
    return () -> close(scope);
  }

  /**
   * @throws ScopeMissingException if no scope is open on this thread
   */
  public Scope current() {
    Scope scope = active.get().peek();
    if (scope == null) {
      active.remove();
      throw new ScopeMissingException("No scope is open on thread " + Thread.currentThread().getName());
    }
    return scope;
  }

  public Optional<Scope> find() {
    Deque<Scope> stack = active.get();
    if (stack.isEmpty()) {
      active.remove();
      return Optional.empty();
    }
    return Optional.of(stack.peek());
  }

  public boolean isActive() {
    return find().isPresent();
  }

  // =========================================================================
  // Shortcuts on the current scope
  // =========================================================================

  public void setScoped(String key, Object value) {
    current().set(key, value);
  }

  public Object getScoped(String key) {
    return current().get(key);
  }

  public void deleteKey(String key) {
    current().delete(key);
  }
}
