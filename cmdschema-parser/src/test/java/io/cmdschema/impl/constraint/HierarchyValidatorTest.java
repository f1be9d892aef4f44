package io.cmdschema.impl.constraint;

import static org.junit.jupiter.api.Assertions.*;

import io.cmdschema.api.SubcommandSchema;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class HierarchyValidatorTest {

  private static SubcommandSchema node(String name, SubcommandSchema... children) {
    return SubcommandSchema.named(name).withChildren(List.of(), List.of(), List.of(children));
  }

  @Test
  void selfEdgeThrows() {
    HierarchyValidator graph = new HierarchyValidator();
    SubcommandCycleException e =
        assertThrows(SubcommandCycleException.class, () -> graph.addEdge("git", " git "));
    assertEquals("git", e.command());
    assertEquals("self-cycle detected for command 'git'", e.getMessage());
  }

  @Test
  void acyclicGraphHasNoErrors() {
    HierarchyValidator graph = new HierarchyValidator();
    graph.addEdge("git", "remote");
    graph.addEdge("remote", "add");
    graph.addEdge("git", "add");
    assertTrue(graph.validate().isEmpty());
  }

  @Test
  void threeNodeCycleIsReported() {
    HierarchyValidator graph = new HierarchyValidator();
    graph.addEdge("a", "b");
    graph.addEdge("b", "c");
    graph.addEdge("c", "a");

    List<String> errors = graph.validate();

    assertEquals(1, errors.size());
    String node = errors.get(0).replaceAll(".*'(.*)'.*", "$1");
    assertTrue(Set.of("a", "b", "c").contains(node), errors.get(0));
  }

  @Test
  void checkDropsChildNamedLikeItsParent() {
    SubcommandSchema remote = node("remote", node("remote"), node("add"));

    HierarchyValidator.Check check = HierarchyValidator.check("git", List.of(remote));

    assertEquals(List.of("self-cycle detected for command 'remote'"), check.errors());
    SubcommandSchema kept = check.subcommands().get(0);
    assertEquals(List.of("add"), kept.subcommands().stream().map(SubcommandSchema::name).toList());
  }

  @Test
  void checkReportsCycleAlongPath() {
    SubcommandSchema tree = node("a", node("b", node("a")));

    HierarchyValidator.Check check = HierarchyValidator.check("tool", List.of(tree));

    assertEquals(List.of("cycle detected at command 'a'"), check.errors());
    assertEquals(1, check.subcommands().size());
  }
}
