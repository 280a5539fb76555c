package com.gentoro.configreader.source;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CompositeRecordSourceTest {

  @Mock private RecordSource first;
  @Mock private RecordSource second;

  private static RawRecord header(int level, String name, int line) {
    return new RawRecord(level, name, line, List.of());
  }

  @Test
  void concatenatesRecordsInSourceOrder() {
    when(first.records()).thenReturn(List.of(header(0, "A", 1), header(1, "B", 3)));
    when(second.records()).thenReturn(List.of(header(1, "C", 1)));

    List<RawRecord> records = CompositeRecordSource.of(first, second).records();

    assertEquals(List.of(header(0, "A", 1), header(1, "B", 3), header(1, "C", 1)), records);
    verify(first).records();
    verify(second).records();
  }

  @Test
  void describesEverySource() {
    when(first.description()).thenReturn("base.ini");
    when(second.description()).thenReturn("<string>");

    assertEquals("base.ini, <string>", CompositeRecordSource.of(first, second).description());
  }

  @Test
  void failureInLaterSourcePropagates() {
    when(first.records()).thenReturn(List.of(header(0, "A", 1)));
    when(second.records()).thenThrow(new IllegalStateException("boom"));

    CompositeRecordSource composite = CompositeRecordSource.of(first, second);
    assertThrows(IllegalStateException.class, composite::records);
  }

  @Test
  void needsAtLeastOneSource() {
    assertThrows(IllegalArgumentException.class, () -> new CompositeRecordSource(List.of()));
  }
}
