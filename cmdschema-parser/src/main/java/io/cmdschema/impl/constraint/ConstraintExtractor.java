package io.cmdschema.impl.constraint;

import static io.cmdschema.util.TextUtil.lower;

import io.cmdschema.api.FlagSchema;
import io.cmdschema.internal.HelpPatterns;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Reads "requires --x" and "conflicts with --y" phrases out of flag descriptions. Only flags
 * known at the same level are linked, and a flag never references itself.
 */
public final class ConstraintExtractor {
  private static final List<String> REQUIREMENT_PHRASES =
      List.of("requires", "must be used with", "only with");
  private static final List<String> CONFLICT_PHRASES =
      List.of("conflicts", "conflicts with", "mutually exclusive", "cannot be used with");

  private ConstraintExtractor() {}

  /** Relationships found in one description. */
  public record Relationships(List<String> requires, List<String> conflictsWith) {
    public Relationships {
      requires = List.copyOf(requires);
      conflictsWith = List.copyOf(conflictsWith);
    }

    public boolean isEmpty() {
      return requires.isEmpty() && conflictsWith.isEmpty();
    }
  }

  /**
   * Extracts references from a description.
   *
   * @param description original-case description text
   * @param knownIds every identifier of the flags at this level
   */
  public static Relationships extract(String description, Set<String> knownIds) {
    String l = lower(description);
    List<String> requires = List.of();
    List<String> conflicts = List.of();
    if (containsAny(l, REQUIREMENT_PHRASES)) {
      requires = references(description, knownIds);
    }
    if (containsAny(l, CONFLICT_PHRASES)) {
      conflicts = references(description, knownIds);
    }
    return new Relationships(requires, conflicts);
  }

  /** Returns {@code flags} with relationships appended to every flag whose description has any. */
  public static List<FlagSchema> apply(List<FlagSchema> flags) {
    Set<String> known = new LinkedHashSet<>();
    for (FlagSchema flag : flags) {
      known.addAll(flag.identifiers());
    }
    List<FlagSchema> out = new ArrayList<>(flags.size());
    for (FlagSchema flag : flags) {
      if (flag.description() == null || flag.description().isBlank()) {
        out.add(flag);
        continue;
      }
      Relationships found = extract(flag.description(), known);
      if (found.isEmpty()) {
        out.add(flag);
        continue;
      }
      List<String> requires = appendForeign(flag.requires(), found.requires(), flag);
      List<String> conflicts = appendForeign(flag.conflictsWith(), found.conflictsWith(), flag);
      out.add(flag.withRelationships(requires, conflicts));
    }
    return out;
  }

  private static List<String> references(String description, Set<String> knownIds) {
    List<String> out = new ArrayList<>();
    Matcher m = HelpPatterns.FLAG_REFERENCE.matcher(description);
    while (m.find()) {
      String id = m.group(1);
      if (knownIds.contains(id) && !out.contains(id)) {
        out.add(id);
      }
    }
    return out;
  }

  private static List<String> appendForeign(
      List<String> existing, List<String> found, FlagSchema self) {
    List<String> out = new ArrayList<>();
    for (String id : existing) {
      if (!self.hasIdentifier(id) && !out.contains(id)) {
        out.add(id);
      }
    }
    for (String id : found) {
      if (!self.hasIdentifier(id) && !out.contains(id)) {
        out.add(id);
      }
    }
    return out;
  }

  private static boolean containsAny(String text, List<String> phrases) {
    for (String phrase : phrases) {
      if (text.contains(phrase)) {
        return true;
      }
    }
    return false;
  }
}
