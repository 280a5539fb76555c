package com.gentoro.configreader.tree;

import com.gentoro.configreader.source.RawEntry;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Construction-time section holding unevaluated text. The parent reference exists only for
 * depth and path bookkeeping while the tree is built; {@link TreeEvaluator} turns the finished raw
 * tree into {@link ConfigNode}s that have none.
 */
public final class RawSection {
  private final String name;
  private final RawSection parent;
  private final int depth;
  private final int line;
  private final Map<String, RawEntry> entries = new LinkedHashMap<>();
  private final Map<String, RawSection> children = new LinkedHashMap<>();

  RawSection(String name, RawSection parent, int line) {
    this.name = name;
    this.parent = parent;
    this.depth = parent == null ? 0 : parent.depth + 1;
    this.line = line;
  }

  static RawSection root(String name) {
    return new RawSection(name, null, 0);
  }

  public String name() {
    return name;
  }

  public int depth() {
    return depth;
  }

  public int line() {
    return line;
  }

  /** Path from the root, excluding the root's own name; empty for the root. */
  public String path(String separator) {
    if (parent == null) return "";
    String parentPath = parent.path(separator);
    return parentPath.isEmpty() ? name : parentPath + separator + name;
  }

  public Map<String, RawEntry> entries() {
    return Collections.unmodifiableMap(entries);
  }

  public Map<String, RawSection> children() {
    return Collections.unmodifiableMap(children);
  }

  RawSection parent() {
    return parent;
  }

  boolean hasChild(String childName) {
    return children.containsKey(childName);
  }

  void addChild(RawSection child) {
    children.put(child.name, child);
  }

  boolean hasEntry(String key) {
    return entries.containsKey(key);
  }

  void addEntry(RawEntry entry) {
    entries.put(entry.key(), entry);
  }
}
