package ru.dimension.wiredup;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DependencyGraphTest {

  private static Registration<Object> node(String name, String... deps) {
    return Registration.singleton(name, Target.call(args -> name, deps));
  }

  private static List<String> names(List<Registration<?>> sorted) {
    List<String> out = new ArrayList<>();
    for (Registration<?> r : sorted) out.add(r.name());
    return out;
  }

  @Nested
  @DisplayName("Ordering")
  class OrderingTests {

    @Test
    @DisplayName("Empty input gives empty order")
    void emptyInput() {
      assertEquals(List.of(), DependencyGraph.sort(List.of()));
    }

    @Test
    @DisplayName("Dependencies are placed before their dependents")
    void dependenciesFirst() {
      var n1 = node("Node1", "Node2", "Node3");
      var n2 = node("Node2", "Node3");
      var n3 = node("Node3");

      assertEquals(List.of("Node3", "Node2", "Node1"), names(DependencyGraph.sort(List.of(n1, n2, n3))));
    }

    @Test
    @DisplayName("Independent nodes keep their input order")
    void stableForIndependentNodes() {
      var a = node("a");
      var b = node("b");
      var c = node("c", "a");
      var d = node("d");

      assertEquals(List.of("a", "b", "c", "d"), names(DependencyGraph.sort(List.of(a, b, c, d))));
      assertEquals(List.of("d", "b", "a", "c"), names(DependencyGraph.sort(List.of(d, b, a, c))));
    }

    @Test
    @DisplayName("Names without a node are leaves")
    void unknownDependenciesAreLeaves() {
      var a = node("a", "missing", "b");
      var b = node("b", "also-missing");

      assertEquals(List.of("b", "a"), names(DependencyGraph.sort(List.of(a, b))));
      assertEquals(Set.of("b"), DependencyGraph.of(List.of(a, b)).dependenciesOf("a"));
    }

    @Test
    @DisplayName("Lifecycle and teardown do not influence ordering")
    void lifecycleIrrelevant() {
      Registration<Object> n1 = Registration.singleton("Node1", Target.call(args -> 1, "Node2"), x -> {});
      Registration<Object> n2 = Registration.transientService("Node2", Target.call(args -> 2));

      assertEquals(List.of("Node2", "Node1"), names(DependencyGraph.sort(List.of(n1, n2))));
    }

    @Test
    @DisplayName("Deep chains do not overflow the call stack")
    void deepChain() {
      int depth = 20_000;
      List<Registration<?>> nodes = new ArrayList<>(depth);
      for (int i = 0; i < depth; i++) {
        nodes.add(i + 1 < depth ? node("n" + i, "n" + (i + 1)) : node("n" + i));
      }

      List<Registration<?>> sorted = DependencyGraph.sort(nodes);

      assertEquals(depth, sorted.size());
      assertEquals("n" + (depth - 1), sorted.get(0).name());
      assertEquals("n0", sorted.get(depth - 1).name());
    }

    @Test
    @DisplayName("Random acyclic graphs always order dependencies first")
    void randomDagsRespectPartialOrder() {
      Random random = new Random(42);
      for (int round = 0; round < 50; round++) {
        int size = 1 + random.nextInt(30);
        List<Registration<?>> nodes = new ArrayList<>();
        for (int i = 0; i < size; i++) {
          List<String> deps = new ArrayList<>();
          // edges only point to lower indices, so the graph is acyclic
          for (int j = 0; j < i; j++) {
            if (random.nextInt(4) == 0) deps.add("s" + j);
          }
          nodes.add(node("s" + i, deps.toArray(new String[0])));
        }
        Collections.shuffle(nodes, random);

        List<Registration<?>> sorted = DependencyGraph.sort(nodes);

        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < sorted.size(); i++) position.put(sorted.get(i).name(), i);
        assertEquals(size, position.size());
        for (Registration<?> r : sorted) {
          for (String dep : r.dependencies()) {
            assertTrue(position.get(dep) < position.get(r.name()),
                       dep + " must precede " + r.name() + " in " + names(sorted));
          }
        }
      }
    }
  }

  @Nested
  @DisplayName("Cycle detection")
  class CycleTests {

    @Test
    @DisplayName("Two nodes depending on each other form a cycle")
    void directCycle() {
      var n1 = node("Node1", "Node2");
      var n2 = node("Node2", "Node1");

      CyclicDependencyException ex =
          assertThrows(CyclicDependencyException.class, () -> DependencyGraph.sort(List.of(n1, n2)));

      assertEquals(List.of("Node1", "Node2", "Node1"), ex.cycle());
      assertTrue(ex.getMessage().contains("Circular dependency detected"));
    }

    @Test
    @DisplayName("Self dependency is a cycle of length one")
    void selfCycle() {
      CyclicDependencyException ex =
          assertThrows(CyclicDependencyException.class, () -> DependencyGraph.sort(List.of(node("a", "a"))));

      assertEquals(List.of("a", "a"), ex.cycle());
    }

    @Test
    @DisplayName("Indirect cycle reports only the nodes on the cycle")
    void indirectCycle() {
      var root = node("root", "a");
      var a = node("a", "b");
      var b = node("b", "c");
      var c = node("c", "a");

      CyclicDependencyException ex =
          assertThrows(CyclicDependencyException.class, () -> DependencyGraph.sort(List.of(root, a, b, c)));

      assertEquals(List.of("a", "b", "c", "a"), ex.cycle());
    }

    @Test
    @DisplayName("Diamond shapes are not cycles")
    void diamondIsFine() {
      var top = node("top", "left", "right");
      var left = node("left", "bottom");
      var right = node("right", "bottom");
      var bottom = node("bottom");

      assertEquals(List.of("bottom", "left", "right", "top"),
                   names(DependencyGraph.sort(List.of(top, left, right, bottom))));
    }
  }
}
