package io.cmdschema.impl.constraint;

import io.cmdschema.api.SubcommandSchema;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph of command names built from parent/child edges. Detects cycles with an
 * iterative depth-first search. Not thread-safe.
 */
public final class HierarchyValidator {
  private final Map<String, Set<String>> edges = new LinkedHashMap<>();

  /**
   * Records {@code parent -> child}.
   *
   * @throws SubcommandCycleException when {@code parent} and {@code child} are the same name
   */
  public void addEdge(String parent, String child) {
    String p = parent.trim();
    String c = child.trim();
    if (p.equals(c)) {
      throw new SubcommandCycleException(p);
    }
    edges.computeIfAbsent(p, k -> new LinkedHashSet<>()).add(c);
    edges.computeIfAbsent(c, k -> new LinkedHashSet<>());
  }

  /** Cycle errors, one per node at which a back edge was found. */
  public List<String> validate() {
    List<String> errors = new ArrayList<>();
    Set<String> visiting = new HashSet<>();
    Set<String> visited = new HashSet<>();
    for (String root : edges.keySet()) {
      if (visited.contains(root)) {
        continue;
      }
      Deque<Frame> stack = new ArrayDeque<>();
      visiting.add(root);
      stack.push(new Frame(root, edges.get(root).iterator()));
      while (!stack.isEmpty()) {
        Frame top = stack.peek();
        if (!top.children.hasNext()) {
          stack.pop();
          visiting.remove(top.node);
          visited.add(top.node);
          continue;
        }
        String child = top.children.next();
        if (visited.contains(child)) {
          continue;
        }
        if (visiting.contains(child)) {
          errors.add("cycle detected at command '" + child + "'");
          continue;
        }
        visiting.add(child);
        stack.push(new Frame(child, edges.get(child).iterator()));
      }
    }
    return errors;
  }

  private static final class Frame {
    final String node;
    final Iterator<String> children;

    Frame(String node, Iterator<String> children) {
      this.node = node;
      this.children = children;
    }
  }

  /** Outcome of checking a subcommand tree. */
  public record Check(List<SubcommandSchema> subcommands, List<String> errors) {
    public Check {
      subcommands = List.copyOf(subcommands);
      errors = List.copyOf(errors);
    }
  }

  /**
   * Checks the tree under {@code command}. Children named like their parent are removed and
   * reported; other cycles are reported only.
   */
  public static Check check(String command, List<SubcommandSchema> subcommands) {
    HierarchyValidator graph = new HierarchyValidator();
    List<String> errors = new ArrayList<>();
    List<SubcommandSchema> kept = graph.addAll(command, subcommands, errors);
    errors.addAll(graph.validate());
    return new Check(kept, errors);
  }

  private List<SubcommandSchema> addAll(
      String parent, List<SubcommandSchema> children, List<String> errors) {
    List<SubcommandSchema> kept = new ArrayList<>(children.size());
    for (SubcommandSchema child : children) {
      try {
        addEdge(parent, child.name());
      } catch (SubcommandCycleException e) {
        errors.add(e.getMessage());
        continue;
      }
      if (child.subcommands().isEmpty()) {
        kept.add(child);
      } else {
        List<SubcommandSchema> nested = addAll(child.name(), child.subcommands(), errors);
        kept.add(child.withChildren(child.flags(), child.positional(), nested));
      }
    }
    return kept;
  }
}
