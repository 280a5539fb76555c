package com.gentoro.configreader.resolve;

import com.gentoro.configreader.exception.AmbiguousNameException;
import com.gentoro.configreader.exception.NotFoundException;
import com.gentoro.configreader.tree.ConfigNode;
import com.gentoro.configreader.value.Value;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Index from every key name to the places it occurs, built once from a finished tree. Unique-name
 * lookups are a single map access.
 */
public final class NameIndex {
  private final Map<String, List<Occurrence>> occurrences;

  private NameIndex(Map<String, List<Occurrence>> occurrences) {
    this.occurrences = occurrences;
  }

  public static NameIndex build(ConfigNode root) {
    Map<String, List<Occurrence>> m = new LinkedHashMap<>();
    collect(root, m);
    Map<String, List<Occurrence>> frozen = new LinkedHashMap<>();
    m.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
    return new NameIndex(Collections.unmodifiableMap(frozen));
  }

  private static void collect(ConfigNode node, Map<String, List<Occurrence>> m) {
    String section = node.path();
    node.values()
        .forEach(
            (key, value) -> {
              String path = section.isEmpty() ? key : section + node.separator() + key;
              m.computeIfAbsent(key, k -> new ArrayList<>())
                  .add(new Occurrence(path, section, value));
            });
    node.children().values().forEach(child -> collect(child, m));
  }

  /**
   * The value of the only key named {@code name} anywhere in the tree.
   *
   * @throws NotFoundException when no key has that name
   * @throws AmbiguousNameException when several keys have that name
   */
  public Value lookupUnique(String name) {
    List<Occurrence> found = occurrences.get(name);
    if (found == null || found.isEmpty()) {
      throw new NotFoundException(
          "No value with key '%s' found".formatted(name), Map.of("name", name));
    }
    if (found.size() > 1) {
      List<String> paths = found.stream().map(Occurrence::path).collect(Collectors.toList());
      throw new AmbiguousNameException(
          "Key '%s' is not unique; found at %s".formatted(name, paths),
          Map.of("name", name, "paths", paths));
    }
    return found.get(0).value();
  }

  /** Every occurrence of {@code name}, in tree order; empty when there is none. */
  public List<Occurrence> occurrences(String name) {
    return occurrences.getOrDefault(name, List.of());
  }

  public int count(String name) {
    return occurrences(name).size();
  }

  public boolean isUnique(String name) {
    return count(name) == 1;
  }

  /** All indexed key names, in first-seen order. */
  public List<String> names() {
    return List.copyOf(occurrences.keySet());
  }

  /** Total number of leaf values in the tree. */
  public int size() {
    return occurrences.values().stream().mapToInt(List::size).sum();
  }
}
