package com.gentoro.configreader.tree;

import com.gentoro.configreader.ConfigElement;
import com.gentoro.configreader.exception.PathNotFoundException;
import com.gentoro.configreader.value.Value;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * One evaluated section of the configuration, the implicit root included.
 *
 * <p>Nodes are immutable and own their children; there is no parent reference, so traversal is
 * strictly root-downward. Keys and child names keep the order in which they appeared in the file.
 */
public final class ConfigNode implements ConfigElement {
  private final String name;
  private final int depth;
  private final String path;
  private final String separator;
  private final Map<String, Value> values;
  private final Map<String, ConfigNode> children;

  ConfigNode(
      String name,
      int depth,
      String path,
      String separator,
      Map<String, Value> values,
      Map<String, ConfigNode> children) {
    this.name = name;
    this.depth = depth;
    this.path = path;
    this.separator = separator;
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    this.children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
  }

  @Override
  public boolean isNode() {
    return true;
  }

  public String name() {
    return name;
  }

  /** Nesting level; 0 for the root, 1 for top-level sections. */
  public int depth() {
    return depth;
  }

  /** Separator-joined names from the root down to this node, excluding the root; empty for it. */
  public String path() {
    return path;
  }

  public String separator() {
    return separator;
  }

  public Map<String, Value> values() {
    return values;
  }

  public Map<String, ConfigNode> children() {
    return children;
  }

  /** Names of the direct sub-sections. */
  public List<String> sections() {
    return List.copyOf(children.keySet());
  }

  public boolean has(String member) {
    return values.containsKey(member) || children.containsKey(member);
  }

  /**
   * Single-segment access: the local value named {@code member}, or else the child section of that
   * name. Values win when both exist.
   *
   * @throws PathNotFoundException when neither exists
   */
  public ConfigElement get(String member) {
    Value v = values.get(member);
    if (v != null) return v;
    ConfigNode child = children.get(member);
    if (child != null) return child;
    throw new PathNotFoundException(qualify(member), member);
  }

  public Value value(String key) {
    Value v = values.get(key);
    if (v == null) throw new PathNotFoundException(qualify(key), key);
    return v;
  }

  public ConfigNode child(String childName) {
    ConfigNode child = children.get(childName);
    if (child == null) throw new PathNotFoundException(qualify(childName), childName);
    return child;
  }

  /**
   * Resolve a separator-delimited path relative to this node. Intermediate segments must name
   * child sections; the final segment may name a key or a child section.
   *
   * @throws PathNotFoundException if any segment is absent or empty
   */
  public ConfigElement lookup(String relativePath) {
    if (relativePath == null || relativePath.isEmpty()) {
      throw new PathNotFoundException(String.valueOf(relativePath), "");
    }
    String[] segments = relativePath.split(Pattern.quote(separator), -1);
    ConfigNode current = this;
    for (int i = 0; i < segments.length - 1; i++) {
      ConfigNode next = current.children.get(segments[i]);
      if (next == null) {
        throw new PathNotFoundException(relativePath, segments[i]);
      }
      current = next;
    }
    String last = segments[segments.length - 1];
    Value v = current.values.get(last);
    if (v != null) return v;
    ConfigNode child = current.children.get(last);
    if (child != null) return child;
    throw new PathNotFoundException(relativePath, last);
  }

  /** Paths of every section below this node named {@code sectionName}, in tree order. */
  public List<String> findSections(String sectionName) {
    List<String> found = new ArrayList<>();
    collectSections(sectionName, found);
    return found;
  }

  private void collectSections(String sectionName, List<String> found) {
    for (ConfigNode child : children.values()) {
      if (child.name.equals(sectionName)) {
        found.add(child.path);
      }
      child.collectSections(sectionName, found);
    }
  }

  /** Nested maps of plain Java values; local values first, then sub-sections. */
  public Map<String, Object> toMap() {
    Map<String, Object> m = new LinkedHashMap<>();
    values.forEach((k, v) -> m.put(k, v.raw()));
    children.forEach((k, c) -> m.put(k, c.toMap()));
    return m;
  }

  private String qualify(String member) {
    return path.isEmpty() ? member : path + separator + member;
  }

  @Override
  public String toString() {
    return TreeRenderer.render(this);
  }
}
