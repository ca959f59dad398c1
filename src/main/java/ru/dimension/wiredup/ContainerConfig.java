package ru.dimension.wiredup;

/**
 * Container settings.
 *
 * @param lazyLoad    when {@code false}, every singleton is created while the container is built
 * @param eagerScopes when {@code true}, every scoped service is created as soon as a scope opens
 */
public record ContainerConfig(boolean lazyLoad, boolean eagerScopes) {

  public static ContainerConfig defaults() {
    return new ContainerConfig(false, true);
  }

  public ContainerConfig withLazyLoad(boolean enabled) {
    return new ContainerConfig(enabled, eagerScopes);
  }

  public ContainerConfig withEagerScopes(boolean enabled) {
    return new ContainerConfig(lazyLoad, enabled);
  }
}
