package com.gentoro.configreader;

import com.gentoro.configreader.exception.AmbiguousNameException;
import com.gentoro.configreader.exception.NotFoundException;
import com.gentoro.configreader.exception.ValueTypeException;
import com.gentoro.configreader.expression.ExpressionEvaluator;
import com.gentoro.configreader.expression.Namespace;
import com.gentoro.configreader.expression.NamespaceBuilder;
import com.gentoro.configreader.logging.LoggingService;
import com.gentoro.configreader.resolve.NameIndex;
import com.gentoro.configreader.resolve.Occurrence;
import com.gentoro.configreader.source.CompositeRecordSource;
import com.gentoro.configreader.source.IniRecordReader;
import com.gentoro.configreader.source.RecordSource;
import com.gentoro.configreader.tree.ConfigNode;
import com.gentoro.configreader.tree.RawSection;
import com.gentoro.configreader.tree.SectionTreeBuilder;
import com.gentoro.configreader.tree.TreeEvaluator;
import com.gentoro.configreader.utility.JacksonUtility;
import com.gentoro.configreader.value.Value;
import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A configuration file loaded into an immutable tree of typed values.
 *
 * <p>Loading runs the whole pipeline once: the records are read, the section tree is built, the
 * constants section is evaluated into the expression namespace, every other value is evaluated
 * against it, and finally the key names are indexed. Any failure aborts the load; a constructed
 * reader is always complete and may be shared between threads.
 *
 * <p>Given
 *
 * <pre>
 * [Constants]
 * c = 3 * 10 ** 8
 *
 * [Sampler]
 * sampler_name = custom
 * [/parameter1]
 * min = 0
 * max = sin(pi / 2)
 * [/parameter2]
 * min = -1
 * max = c / 2
 * </pre>
 *
 * values can be read by path ({@code lookup("Sampler/parameter2/max")} is {@code 150000000.0}),
 * by chained access ({@code getNode("Sampler").child("parameter1").value("min")}), or by a key
 * name that is unique in the whole tree ({@code lookupUnique("sampler_name")}).
 */
public final class ConfigReader {
  private static final org.slf4j.Logger log = LoggingService.getLogger(ConfigReader.class);

  private final ReaderSettings settings;
  private final String source;
  private final ConfigNode root;
  private final Namespace namespace;
  private final NameIndex index;

  /** Load {@code file} with the settings from {@code classpath:configreader.yaml}. */
  public ConfigReader(Path file) {
    this(file, null);
  }

  /**
   * @param file configuration file
   * @param displayName name of the root section; {@code null} keeps the configured root name
   */
  public ConfigReader(Path file, String displayName) {
    this(file, displayName, ReaderSettings.load());
  }

  public ConfigReader(Path file, String displayName, ReaderSettings settings) {
    this(
        IniRecordReader.forFile(file, named(settings, displayName)),
        named(settings, displayName));
  }

  public ConfigReader(RecordSource records, ReaderSettings settings) {
    this.settings = settings;
    this.source = records.description();

    RawSection raw =
        new SectionTreeBuilder(settings.rootName(), settings.separator()).build(records);
    ExpressionEvaluator evaluator = new ExpressionEvaluator();
    this.namespace = new NamespaceBuilder(evaluator).build(raw, settings.constants());
    this.root =
        new TreeEvaluator(evaluator, settings.separator())
            .evaluate(raw, namespace, settings.constants());
    this.index = NameIndex.build(root);

    log.info(
        "Loaded configuration '{}' from {}: {} section(s), {} value(s)",
        root.name(),
        source,
        countSections(root),
        index.size());
  }

  public static ConfigReader fromString(String text) {
    return fromString(text, null);
  }

  public static ConfigReader fromString(String text, String displayName) {
    return fromString(text, displayName, ReaderSettings.load());
  }

  public static ConfigReader fromString(String text, String displayName, ReaderSettings settings) {
    ReaderSettings effective = named(settings, displayName);
    return new ConfigReader(IniRecordReader.forString(text, effective), effective);
  }

  public static ConfigReader fromReader(
      Reader reader, String displayName, ReaderSettings settings) {
    ReaderSettings effective = named(settings, displayName);
    return new ConfigReader(new IniRecordReader(reader, "<reader>", effective), effective);
  }

  /**
   * Load several files as one configuration, in the given order. Sections of a later file may
   * nest under sections opened by an earlier one.
   */
  public static ConfigReader fromFiles(List<Path> files, String displayName) {
    return fromFiles(files, displayName, ReaderSettings.load());
  }

  public static ConfigReader fromFiles(
      List<Path> files, String displayName, ReaderSettings settings) {
    ReaderSettings effective = named(settings, displayName);
    List<RecordSource> sources = new ArrayList<>(files.size());
    for (Path file : files) {
      sources.add(IniRecordReader.forFile(file, effective));
    }
    return new ConfigReader(new CompositeRecordSource(sources), effective);
  }

  private static ReaderSettings named(ReaderSettings settings, String displayName) {
    return displayName == null ? settings : settings.withRootName(displayName);
  }

  public String name() {
    return root.name();
  }

  public ConfigNode root() {
    return root;
  }

  public Namespace namespace() {
    return namespace;
  }

  public ReaderSettings settings() {
    return settings;
  }

  /** Where the configuration was read from. */
  public String source() {
    return source;
  }

  /** Names of the top-level sections. */
  public List<String> sections() {
    return root.sections();
  }

  /**
   * Resolve a path from the root, e.g. {@code Sampler/parameter1/min}. The last segment may name a
   * value or a section.
   */
  public ConfigElement lookup(String path) {
    return root.lookup(path);
  }

  /** The value of the only key named {@code name} anywhere in the tree. */
  public Value lookupUnique(String name) {
    return index.lookupUnique(name);
  }

  /**
   * Convenience access: a key containing the separator is a path; a key naming a direct member of
   * the root returns that member; any other key must name exactly one value or section across the
   * whole tree.
   *
   * @throws NotFoundException when nothing has that name
   * @throws AmbiguousNameException when several values or sections have that name
   */
  public ConfigElement get(String key) {
    if (key.contains(settings.separator())) {
      return lookup(key);
    }
    if (root.has(key)) {
      return root.get(key);
    }
    List<Occurrence> values = index.occurrences(key);
    List<String> sections = root.findSections(key);
    int total = values.size() + sections.size();
    if (total == 0) {
      throw new NotFoundException(
          "No value or section named '%s' found".formatted(key), Map.of("name", key));
    }
    if (total > 1) {
      List<String> paths = new ArrayList<>();
      values.forEach(o -> paths.add(o.path()));
      sections.forEach(p -> paths.add(p + settings.separator()));
      throw new AmbiguousNameException(
          "'%s' is not unique; found at %s".formatted(key, paths),
          Map.of("name", key, "paths", paths));
    }
    return values.isEmpty() ? root.lookup(sections.get(0)) : values.get(0).value();
  }

  public ConfigNode getNode(String key) {
    ConfigElement e = get(key);
    if (e instanceof ConfigNode node) return node;
    throw new ValueTypeException(
        "'%s' is a value, not a section".formatted(key), Map.of("key", key));
  }

  public Value getValue(String key) {
    ConfigElement e = get(key);
    if (e instanceof Value v) return v;
    throw new ValueTypeException(
        "'%s' is a section, not a value".formatted(key), Map.of("key", key));
  }

  public long getLong(String key) {
    return getValue(key).asLong();
  }

  public double getDouble(String key) {
    return getValue(key).asDouble();
  }

  public boolean getBoolean(String key) {
    return getValue(key).asBoolean();
  }

  public String getString(String key) {
    return getValue(key).asString();
  }

  /** Every key named {@code name} with its path, in tree order. */
  public List<Occurrence> findValues(String name) {
    return index.occurrences(name);
  }

  /** Paths of every section named {@code name}. */
  public List<String> findSections(String name) {
    return root.findSections(name);
  }

  public Map<String, Object> toMap() {
    return root.toMap();
  }

  public String toJson() {
    return JacksonUtility.toJson(toMap());
  }

  public String toYaml() {
    return JacksonUtility.toYaml(toMap());
  }

  private static int countSections(ConfigNode node) {
    int n = node.children().size();
    for (ConfigNode child : node.children().values()) {
      n += countSections(child);
    }
    return n;
  }

  /** Box-drawing rendering of the whole tree. */
  @Override
  public String toString() {
    return root.toString();
  }
}
