package com.gentoro.configreader.source;

import java.util.List;

/** Supplies the ordered section records a configuration tree is built from. */
public interface RecordSource {

  /** All records, in source order. Called once per load. */
  List<RawRecord> records();

  /** Human-readable origin used in log and error messages. */
  String description();
}
