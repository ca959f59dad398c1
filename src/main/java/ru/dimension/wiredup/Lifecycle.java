package ru.dimension.wiredup;

/**
 * How long a service instance lives and when its teardown hook runs.
 */
public enum Lifecycle {
  /** One instance per container, torn down by {@link Container#destroy()}. */
  SINGLETON,
  /** One instance per open scope, torn down when the scope ends. */
  SCOPED,
  /** A fresh instance per resolution, torn down right after the resolving call. */
  TRANSIENT
}
