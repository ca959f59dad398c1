package ru.dimension.wiredup;

/**
 * Work run inside a scope opened by {@link Container#startScope(ScopeCallback)}.
 */
@FunctionalInterface
public interface ScopeCallback<T> {
  T run(Scope scope) throws Exception;
}
