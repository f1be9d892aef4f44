package io.cmdschema.impl.man.roff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal roff document: title, manual section and the elements of each named section in source
 * order. Elements before the first section header land in {@value #UNKNOWN_SECTION}.
 *
 * @param <E> element type of the macro package
 */
public final class RoffDocument<E> {
  public static final String UNKNOWN_SECTION = "UNKNOWN";

  private final Map<String, List<E>> sections = new LinkedHashMap<>();
  private String title;
  private String manSection;

  public String title() {
    return title;
  }

  public String manSection() {
    return manSection;
  }

  void setTitle(String title, String manSection) {
    this.title = title;
    this.manSection = manSection;
  }

  void ensureSection(String name) {
    sections.computeIfAbsent(name, k -> new ArrayList<>());
  }

  void add(String section, E element) {
    sections.computeIfAbsent(section, k -> new ArrayList<>()).add(element);
  }

  public List<String> sectionNames() {
    return List.copyOf(sections.keySet());
  }

  public List<E> section(String name) {
    List<E> content = sections.get(name);
    return content == null ? List.of() : Collections.unmodifiableList(content);
  }
}
