package com.gentoro.configreader.source;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Several sources read back to back as one configuration. Records keep their order, so a nested
 * header at the start of a later source continues the sections left open by the one before it.
 * Section names still have to be unique among siblings across all sources.
 */
public final class CompositeRecordSource implements RecordSource {
  private final List<RecordSource> sources;

  public CompositeRecordSource(List<? extends RecordSource> sources) {
    if (sources.isEmpty()) {
      throw new IllegalArgumentException("At least one record source is required");
    }
    this.sources = List.copyOf(sources);
  }

  public static CompositeRecordSource of(RecordSource... sources) {
    return new CompositeRecordSource(List.of(sources));
  }

  @Override
  public List<RawRecord> records() {
    List<RawRecord> all = new ArrayList<>();
    for (RecordSource source : sources) {
      all.addAll(source.records());
    }
    return all;
  }

  @Override
  public String description() {
    return sources.stream().map(RecordSource::description).collect(Collectors.joining(", "));
  }
}
