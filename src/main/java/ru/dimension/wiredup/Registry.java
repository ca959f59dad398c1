package ru.dimension.wiredup;

import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Name-keyed registrations in dependency order. Each {@link #register(Collection)} call commits all
 * of its registrations or none of them.
 *
 * <p>Not thread-safe; {@link Container} guards access.
 */
final class Registry {

  private final Map<String, Registration<?>> registrations = new LinkedHashMap<>();

  /**
   * Orders, validates and commits {@code submitted}.
   *
   * @return the committed registrations in dependency order
   * @throws CyclicDependencyException     if the submitted and existing registrations form a cycle
   * @throws DuplicateServiceNameException if two submitted registrations share a name
   * @throws AlreadyRegisteredException    if a submitted name is already registered
   */
  List<Registration<?>> register(Collection<? extends Registration<?>> submitted) {
    Objects.requireNonNull(submitted, "registrations");
    for (Registration<?> r : submitted) {
      Objects.requireNonNull(r, "registration");
    }

    List<Registration<?>> union = new ArrayList<>(registrations.size() + submitted.size());
    union.addAll(registrations.values());
    union.addAll(submitted);
    List<Registration<?>> sortedUnion = DependencyGraph.sort(union);

    // keep only the submitted entries, in sorted order
    Map<Registration<?>, Integer> pending = new IdentityHashMap<>();
    for (Registration<?> r : submitted) {
      pending.merge(r, 1, Integer::sum);
    }
    List<Registration<?>> sorted = new ArrayList<>(submitted.size());
    for (Registration<?> r : sortedUnion) {
      Integer left = pending.get(r);
      if (left != null && left > 0) {
        pending.put(r, left - 1);
        sorted.add(r);
      }
    }

    Set<String> seen = new LinkedHashSet<>();
    Set<String> duplicates = new LinkedHashSet<>();
    for (Registration<?> r : sorted) {
      if (!seen.add(r.name())) duplicates.add(r.name());
    }
    if (!duplicates.isEmpty()) {
      throw new DuplicateServiceNameException(List.copyOf(duplicates));
    }

    List<String> clashes = new ArrayList<>();
    for (Registration<?> r : sorted) {
      if (registrations.containsKey(r.name())) clashes.add(r.name());
    }
    if (!clashes.isEmpty()) {
      throw new AlreadyRegisteredException(clashes);
    }

    for (Registration<?> r : sorted) {
      registrations.put(r.name(), r);
    }
    return List.copyOf(sorted);
  }

  /**
   * Removes {@code committed} again, provided each name still maps to that same registration.
   */
  void unregister(Collection<? extends Registration<?>> committed) {
    for (Registration<?> r : committed) {
      registrations.remove(r.name(), r);
    }
  }

  Registration<?> get(String name) {
    return registrations.get(name);
  }

  boolean contains(String name) {
    return registrations.containsKey(name);
  }

  /**
   * Names from {@code names} that have no registration, without repeats.
   */
  List<String> missing(List<String> names) {
    Set<String> out = new LinkedHashSet<>();
    for (String n : names) {
      if (!registrations.containsKey(n)) out.add(n);
    }
    return List.copyOf(out);
  }

  /**
   * Dependency names declared by any registration that no registration provides.
   */
  Set<String> unresolvedDependencies() {
    Set<String> out = new LinkedHashSet<>();
    for (Registration<?> r : registrations.values()) {
      for (String dep : r.dependencies()) {
        if (!registrations.containsKey(dep)) out.add(dep);
      }
    }
    return out;
  }

  List<Registration<?>> all() {
    return List.copyOf(registrations.values());
  }

  List<Registration<?>> withLifecycle(Lifecycle lifecycle) {
    List<Registration<?>> out = new ArrayList<>();
    for (Registration<?> r : registrations.values()) {
      if (r.lifecycle() == lifecycle) out.add(r);
    }
    return out;
  }

  int size() {
    return registrations.size();
  }

  void clear() {
    registrations.clear();
  }
}
