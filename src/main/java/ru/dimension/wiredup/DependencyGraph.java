package ru.dimension.wiredup;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph over registrations, with an edge from each registration to every dependency that
 * names another node of the graph. Dependency names without a node are leaves.
 *
 * <p>{@link #order()} is a depth-first topological sort using an explicit work stack, so graph depth
 * is not bounded by the call stack. Independent nodes keep their input order.
 */
public final class DependencyGraph {

  private enum Mark { UNVISITED, IN_PROGRESS, DONE }

  private final List<Registration<?>> nodes;
  private final Map<String, Integer> indexByName;

  private DependencyGraph(List<Registration<?>> nodes) {
    this.nodes = nodes;
    this.indexByName = new HashMap<>();
    for (int i = 0; i < nodes.size(); i++) {
      // first registration of a name owns its edges; duplicates are rejected by the registry
      indexByName.putIfAbsent(nodes.get(i).name(), i);
    }
  }

  public static DependencyGraph of(Collection<? extends Registration<?>> registrations) {
    return new DependencyGraph(List.copyOf(registrations));
  }

  /**
   * Orders {@code registrations} so that every dependency precedes its dependents.
   *
   * @throws CyclicDependencyException if the registered dependencies form a cycle
   */
  public static List<Registration<?>> sort(Collection<? extends Registration<?>> registrations) {
    return of(registrations).order();
  }

  public boolean contains(String name) {
    return indexByName.containsKey(name);
  }

  /**
   * Names of the graph nodes {@code name} depends on, in declared order.
   */
  public Set<String> dependenciesOf(String name) {
    Integer idx = indexByName.get(name);
    if (idx == null) return Set.of();

    Set<String> out = new LinkedHashSet<>();
    for (String dep : nodes.get(idx).dependencies()) {
      if (indexByName.containsKey(dep)) out.add(dep);
    }
    return out;
  }

  public List<Registration<?>> order() {
    Mark[] marks = new Mark[nodes.size()];
    Arrays.fill(marks, Mark.UNVISITED);

    List<Registration<?>> sorted = new ArrayList<>(nodes.size());
    Deque<Frame> stack = new ArrayDeque<>();

    for (int start = 0; start < nodes.size(); start++) {
      if (marks[start] != Mark.UNVISITED) continue;

      marks[start] = Mark.IN_PROGRESS;
      stack.push(new Frame(start, nodes.get(start).dependencies().iterator()));

      while (!stack.isEmpty()) {
        Frame frame = stack.peek();

        if (!frame.deps.hasNext()) {
          stack.pop();
          marks[frame.node] = Mark.DONE;
          sorted.add(nodes.get(frame.node));
          continue;
        }

        Integer next = indexByName.get(frame.deps.next());
        if (next == null) continue;

        switch (marks[next]) {
          case UNVISITED -> {
            marks[next] = Mark.IN_PROGRESS;
            stack.push(new Frame(next, nodes.get(next).dependencies().iterator()));
          }
          case IN_PROGRESS -> throw new CyclicDependencyException(cyclePath(stack, next));
          case DONE -> { }
        }
      }
    }
    return sorted;
  }

  private List<String> cyclePath(Deque<Frame> stack, int closing) {
    // bottom-up walk; the cycle starts at the closing node
    List<String> path = new ArrayList<>();
    Iterator<Frame> it = stack.descendingIterator();
    boolean inCycle = false;
    while (it.hasNext()) {
      Frame f = it.next();
      if (f.node == closing) inCycle = true;
      if (inCycle) path.add(nodes.get(f.node).name());
    }
    path.add(nodes.get(closing).name());
    return path;
  }

  private static final class Frame {
    final int node;
    final Iterator<String> deps;

    Frame(int node, Iterator<String> deps) {
      this.node = node;
      this.deps = deps;
    }
  }
}
