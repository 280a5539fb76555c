package com.gentoro.configreader;

/**
 * Anything a path lookup can return: either a {@link com.gentoro.configreader.tree.ConfigNode}
 * or a {@link com.gentoro.configreader.value.Value}.
 */
public interface ConfigElement {

  /** {@code true} when this element is a section rather than a leaf value. */
  boolean isNode();
}
