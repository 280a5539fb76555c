package com.gentoro.configreader.source;

import java.util.List;

/**
 * A section header together with the key/value pairs that follow it, in source order.
 *
 * @param level number of leading nesting markers; 0 for a top-level section
 * @param name section name without the markers
 * @param line 1-based line number of the header, 0 when not read from a file
 * @param entries ordered key/value pairs of this section
 */
public record RawRecord(int level, String name, int line, List<RawEntry> entries) {

  public RawRecord {
    entries = List.copyOf(entries);
  }
}
