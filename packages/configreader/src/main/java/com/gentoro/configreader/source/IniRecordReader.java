package com.gentoro.configreader.source;

import com.gentoro.configreader.ReaderSettings;
import com.gentoro.configreader.exception.ExceptionUtil;
import com.gentoro.configreader.exception.IoException;
import com.gentoro.configreader.exception.MalformedHeaderException;
import com.gentoro.configreader.exception.MalformedLineException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Line-oriented reader for the sectioned INI dialect.
 *
 * <ul>
 *   <li>{@code [Name]} opens a top-level section, {@code [//Name]} a section two levels deep (with
 *       {@code /} as the configured separator). Text after the closing bracket is ignored.
 *   <li>{@code key = value} or {@code key: value} adds a pair to the most recent section. Keys are
 *       folded to lower case unless the settings turn that off.
 *   <li>Lines starting with a comment prefix and blank lines are skipped.
 *   <li>An indented line directly after a pair continues that pair's value.
 * </ul>
 *
 * <p>Only the syntax of each line is checked here; nesting and duplicates are the tree builder's
 * concern.
 */
public class IniRecordReader implements RecordSource {
  private final Reader reader;
  private final String description;
  private final ReaderSettings settings;

  public IniRecordReader(Reader reader, String description, ReaderSettings settings) {
    this.reader = reader;
    this.description = description;
    this.settings = settings;
  }

  public static IniRecordReader forFile(Path file, ReaderSettings settings) {
    try {
      return new IniRecordReader(
          Files.newBufferedReader(file, StandardCharsets.UTF_8), file.toString(), settings);
    } catch (IOException e) {
      throw new IoException("Failed to open configuration file: " + file, e);
    }
  }

  public static IniRecordReader forString(String text, ReaderSettings settings) {
    return new IniRecordReader(new StringReader(text), "<string>", settings);
  }

  @Override
  public String description() {
    return description;
  }

  @Override
  public List<RawRecord> records() {
    try (BufferedReader br =
        reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
      return parse(br);
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, (ex) -> new IoException("Failed to read configuration from " + description, ex));
    }
  }

  private List<RawRecord> parse(BufferedReader br) throws IOException {
    List<RawRecord> records = new ArrayList<>();
    Header header = null;
    List<RawEntry> entries = new ArrayList<>();
    // Continuations attach to the last pair only while no blank or comment line intervened.
    StringBuilder pending = null;
    String pendingKey = null;
    int pendingLine = 0;

    String line;
    int lineNo = 0;
    while ((line = br.readLine()) != null) {
      lineNo++;
      String trimmed = line.strip();

      if (trimmed.isEmpty() || isComment(trimmed)) {
        if (pending != null) {
          entries.add(new RawEntry(pendingKey, pending.toString(), pendingLine));
          pending = null;
        }
        continue;
      }

      if (pending != null && Character.isWhitespace(line.charAt(0))) {
        pending.append('\n').append(trimmed);
        continue;
      }
      if (pending != null) {
        entries.add(new RawEntry(pendingKey, pending.toString(), pendingLine));
        pending = null;
      }

      if (trimmed.startsWith("[")) {
        if (header != null) {
          records.add(new RawRecord(header.level, header.name, header.line, entries));
        }
        header = parseHeader(trimmed, lineNo);
        entries = new ArrayList<>();
        continue;
      }

      int idx = delimiterIndex(trimmed);
      if (idx < 0) {
        throw new MalformedLineException(
            "Line %d of %s is neither a section header nor a key/value pair: %s"
                .formatted(lineNo, description, trimmed),
            Map.of("line", lineNo, "text", trimmed));
      }
      String key = trimmed.substring(0, idx).strip();
      if (key.isEmpty()) {
        throw new MalformedLineException(
            "Empty key on line %d of %s".formatted(lineNo, description), Map.of("line", lineNo));
      }
      if (header == null) {
        throw new MalformedLineException(
            "Key '%s' on line %d of %s appears before the first section header"
                .formatted(key, lineNo, description),
            Map.of("line", lineNo, "key", key));
      }
      pendingKey = settings.lowercaseKeys() ? key.toLowerCase(Locale.ROOT) : key;
      pending = new StringBuilder(trimmed.substring(idx + 1).strip());
      pendingLine = lineNo;
    }

    if (pending != null) {
      entries.add(new RawEntry(pendingKey, pending.toString(), pendingLine));
    }
    if (header != null) {
      records.add(new RawRecord(header.level, header.name, header.line, entries));
    }
    return records;
  }

  private Header parseHeader(String trimmed, int lineNo) {
    // The name runs to the last ']' on the line; anything after it is ignored.
    int close = trimmed.lastIndexOf(']');
    if (close < 0) {
      throw new MalformedHeaderException(
          "Unterminated section header on line %d: %s".formatted(lineNo, trimmed),
          Map.of("line", lineNo, "header", trimmed));
    }
    String inner = trimmed.substring(1, close).strip();
    String sep = settings.separator();
    int level = 0;
    while (inner.startsWith(sep)) {
      inner = inner.substring(sep.length());
      level++;
    }
    String name = inner.strip();
    if (name.isEmpty() || name.contains(sep)) {
      throw new MalformedHeaderException(
          "Invalid section name on line %d: %s".formatted(lineNo, trimmed),
          Map.of("line", lineNo, "header", trimmed));
    }
    return new Header(level, name, lineNo);
  }

  private boolean isComment(String trimmed) {
    return settings.commentPrefixes().indexOf(trimmed.charAt(0)) >= 0;
  }

  private int delimiterIndex(String trimmed) {
    String delimiters = settings.delimiters();
    for (int i = 0; i < trimmed.length(); i++) {
      if (delimiters.indexOf(trimmed.charAt(i)) >= 0) {
        return i;
      }
    }
    return -1;
  }

  private record Header(int level, String name, int line) {}
}
