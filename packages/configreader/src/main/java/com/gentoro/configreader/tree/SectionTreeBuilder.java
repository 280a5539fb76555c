package com.gentoro.configreader.tree;

import com.gentoro.configreader.exception.DuplicateKeyException;
import com.gentoro.configreader.exception.DuplicateSectionException;
import com.gentoro.configreader.exception.MalformedHeaderException;
import com.gentoro.configreader.logging.LoggingService;
import com.gentoro.configreader.source.RawEntry;
import com.gentoro.configreader.source.RawRecord;
import com.gentoro.configreader.source.RecordSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns the ordered header records into a section hierarchy.
 *
 * <p>The builder keeps a stack of open sections with the root at index 0. A header with {@code L}
 * nesting markers closes everything at index {@code L + 1} and above and opens a new child of the
 * section at index {@code L}. A header that nests deeper than the open chain allows is rejected.
 * Nothing is evaluated here; values stay raw text.
 */
public class SectionTreeBuilder {
  private static final org.slf4j.Logger log = LoggingService.getLogger(SectionTreeBuilder.class);

  private final String rootName;
  private final String separator;

  public SectionTreeBuilder(String rootName, String separator) {
    this.rootName = rootName;
    this.separator = separator;
  }

  public RawSection build(RecordSource source) {
    return build(source.records());
  }

  public RawSection build(List<RawRecord> records) {
    RawSection root = RawSection.root(rootName);
    List<RawSection> open = new ArrayList<>();
    open.add(root);

    for (RawRecord record : records) {
      int level = record.level();
      if (level < 0 || level >= open.size()) {
        throw new MalformedHeaderException(
            "Section '%s' on line %d is nested %d level(s) deep but only %d section(s) are open"
                .formatted(record.name(), record.line(), level, open.size() - 1),
            Map.of("section", record.name(), "line", record.line(), "level", level));
      }
      while (open.size() > level + 1) {
        open.remove(open.size() - 1);
      }

      RawSection parent = open.get(level);
      if (parent.hasChild(record.name())) {
        String path = join(parent.path(separator), record.name());
        throw new DuplicateSectionException(
            "Duplicate section '%s' on line %d".formatted(path, record.line()),
            Map.of("section", path, "line", record.line()));
      }
      RawSection section = new RawSection(record.name(), parent, record.line());
      parent.addChild(section);
      open.add(section);
      log.trace("Opened section '{}' at depth {}", section.path(separator), section.depth());

      for (RawEntry entry : record.entries()) {
        if (section.hasEntry(entry.key())) {
          throw new DuplicateKeyException(
              "Duplicate key '%s' in section '%s' on line %d"
                  .formatted(entry.key(), section.path(separator), entry.line()),
              Map.of("section", section.path(separator), "key", entry.key(), "line", entry.line()));
        }
        section.addEntry(entry);
      }
    }
    return root;
  }

  private String join(String parentPath, String name) {
    return parentPath.isEmpty() ? name : parentPath + separator + name;
  }
}
