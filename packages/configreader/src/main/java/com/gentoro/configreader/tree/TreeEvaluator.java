package com.gentoro.configreader.tree;

import com.gentoro.configreader.exception.ConfigReaderException;
import com.gentoro.configreader.exception.EvaluationException;
import com.gentoro.configreader.expression.ExpressionEvaluator;
import com.gentoro.configreader.expression.Namespace;
import com.gentoro.configreader.source.RawEntry;
import com.gentoro.configreader.value.Value;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Replaces every raw text value of the tree with its evaluated {@link Value}, producing the
 * immutable {@link ConfigNode} tree. All nodes share one read-only namespace. The top-level
 * constants section takes its values from the namespace as already evaluated; its sub-sections
 * are evaluated like any other node. The first failure aborts the whole pass.
 */
public class TreeEvaluator {
  private final ExpressionEvaluator evaluator;
  private final String separator;

  public TreeEvaluator(ExpressionEvaluator evaluator, String separator) {
    this.evaluator = evaluator;
    this.separator = separator;
  }

  public ConfigNode evaluate(RawSection root, Namespace namespace, Optional<String> constants) {
    return toNode(root, namespace, constants.orElse(null));
  }

  private ConfigNode toNode(RawSection raw, Namespace namespace, String constants) {
    String path = raw.path(separator);
    boolean isConstants = raw.depth() == 1 && raw.name().equals(constants);

    Map<String, Value> values = new LinkedHashMap<>();
    for (RawEntry entry : raw.entries().values()) {
      Value v = isConstants ? namespace.localConstants().get(entry.key()) : null;
      values.put(entry.key(), v != null ? v : evaluateEntry(path, entry, namespace));
    }

    Map<String, ConfigNode> children = new LinkedHashMap<>();
    for (RawSection child : raw.children().values()) {
      children.put(child.name(), toNode(child, namespace, constants));
    }
    return new ConfigNode(raw.name(), raw.depth(), path, separator, values, children);
  }

  private Value evaluateEntry(String path, RawEntry entry, Namespace namespace) {
    try {
      return evaluator.evaluate(entry.rawText(), namespace);
    } catch (ConfigReaderException e) {
      Map<String, Object> ctx = new LinkedHashMap<>();
      ctx.put("section", path);
      ctx.put("key", entry.key());
      ctx.put("line", entry.line());
      ctx.put("raw", entry.rawText());
      throw new EvaluationException(
          "Failed to evaluate '%s' in section '%s' (line %d): %s"
              .formatted(entry.key(), path, entry.line(), e.getMessage()),
          ctx,
          e);
    }
  }
}
