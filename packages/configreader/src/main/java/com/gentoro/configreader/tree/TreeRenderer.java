package com.gentoro.configreader.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Box-drawing rendering of a section tree for diagnostics:
 *
 * <pre>
 * Config/
 *  ├─Constants/
 *  │  └─c = 300000000
 *  └─Sampler/
 *     └─sampler_name = custom
 * </pre>
 *
 * Sub-sections are listed before the section's own values.
 */
final class TreeRenderer {
  private static final String TEE = " ├─";
  private static final String CORNER = " └─";
  private static final String PIPE = " │ ";
  private static final String BLANK = "   ";

  private TreeRenderer() {}

  static String render(ConfigNode node) {
    StringBuilder sb = new StringBuilder();
    sb.append(node.name()).append(node.separator());
    renderMembers(node, "", sb);
    return sb.toString();
  }

  private static void renderMembers(ConfigNode node, String prefix, StringBuilder sb) {
    List<Object> members = new ArrayList<>(node.children().values());
    members.addAll(node.values().entrySet());
    for (int i = 0; i < members.size(); i++) {
      boolean last = i == members.size() - 1;
      sb.append('\n').append(prefix).append(last ? CORNER : TEE);
      Object member = members.get(i);
      if (member instanceof ConfigNode child) {
        sb.append(child.name()).append(child.separator());
        renderMembers(child, prefix + (last ? BLANK : PIPE), sb);
      } else {
        Map.Entry<?, ?> e = (Map.Entry<?, ?>) member;
        sb.append(e.getKey()).append(" = ").append(e.getValue());
      }
    }
  }
}
