package com.gentoro.configreader.expression;

import com.gentoro.configreader.exception.ConfigReaderException;
import com.gentoro.configreader.exception.EvaluationException;
import com.gentoro.configreader.exception.UnresolvedIdentifierException;
import com.gentoro.configreader.logging.LoggingService;
import com.gentoro.configreader.source.RawEntry;
import com.gentoro.configreader.tree.RawSection;
import com.gentoro.configreader.value.Value;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the expression namespace from the built-ins and the constants section.
 *
 * <p>Only the direct key/value pairs of the top-level constants section count. They are evaluated
 * strictly in file order, each against the built-ins plus the constants before it, so a forward
 * reference is an {@link UnresolvedIdentifierException} just like an unknown name.
 */
public class NamespaceBuilder {
  private static final org.slf4j.Logger log = LoggingService.getLogger(NamespaceBuilder.class);

  private final ExpressionEvaluator evaluator;

  public NamespaceBuilder(ExpressionEvaluator evaluator) {
    this.evaluator = evaluator;
  }

  /**
   * @param root the raw tree
   * @param constantsSection name of the top-level constants section; empty means none
   * @return the built-ins, with a layer of user constants when the section exists
   */
  public Namespace build(RawSection root, Optional<String> constantsSection) {
    Namespace builtIns = Namespace.builtIns();
    if (constantsSection.isEmpty()) {
      return builtIns;
    }
    RawSection section = root.children().get(constantsSection.get());
    if (section == null) {
      log.debug("No '{}' section; using built-in namespace only", constantsSection.get());
      return builtIns;
    }

    Map<String, Value> defined = new LinkedHashMap<>();
    for (RawEntry entry : section.entries().values()) {
      Namespace current = builtIns.withConstants(defined);
      Value value;
      try {
        value = evaluator.evaluateStrict(entry.rawText(), current);
      } catch (UnresolvedIdentifierException e) {
        throw new UnresolvedIdentifierException(
            e.getIdentifier(),
            "Constant '%s' (line %d) references '%s', which is not defined before it"
                .formatted(entry.key(), entry.line(), e.getIdentifier()),
            context(section, entry, e.getIdentifier()));
      } catch (ConfigReaderException e) {
        throw new EvaluationException(
            "Failed to evaluate constant '%s' (line %d): %s"
                .formatted(entry.key(), entry.line(), e.getMessage()),
            context(section, entry, null),
            e);
      }
      defined.put(entry.key(), value);
      log.debug("Registered constant {} = {} ({})", entry.key(), value, value.type());
    }
    return builtIns.withConstants(defined);
  }

  private static Map<String, Object> context(RawSection section, RawEntry entry, String name) {
    Map<String, Object> ctx = new LinkedHashMap<>();
    ctx.put("section", section.name());
    ctx.put("key", entry.key());
    ctx.put("line", entry.line());
    ctx.put("raw", entry.rawText());
    if (name != null) ctx.put("name", name);
    return ctx;
  }
}
