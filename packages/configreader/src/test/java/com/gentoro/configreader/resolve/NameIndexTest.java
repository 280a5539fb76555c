package com.gentoro.configreader.resolve;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.configreader.ConfigReader;
import com.gentoro.configreader.ReaderSettings;
import com.gentoro.configreader.exception.AmbiguousNameException;
import com.gentoro.configreader.exception.NotFoundException;
import com.gentoro.configreader.value.IntegerValue;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NameIndexTest {

  private NameIndex index;

  @BeforeEach
  void setUp() {
    String text =
        """
        [A]
        shared = 1
        only_a = 10
        [/B]
        shared = 2
        [//C]
        deep = 3
        [D]
        shared = 4
        """;
    ConfigReader reader = ConfigReader.fromString(text, null, ReaderSettings.defaults());
    index = NameIndex.build(reader.root());
  }

  @Test
  void uniqueNameResolves() {
    assertEquals(new IntegerValue(10), index.lookupUnique("only_a"));
    assertEquals(new IntegerValue(3), index.lookupUnique("deep"));
    assertTrue(index.isUnique("deep"));
  }

  @Test
  void repeatedNameIsAmbiguous() {
    AmbiguousNameException ex =
        assertThrows(AmbiguousNameException.class, () -> index.lookupUnique("shared"));
    assertEquals(List.of("A/shared", "A/B/shared", "D/shared"), ex.getContext().get("paths"));
  }

  @Test
  void absentNameIsNotFound() {
    assertThrows(NotFoundException.class, () -> index.lookupUnique("missing"));
    assertEquals(0, index.count("missing"));
    assertTrue(index.occurrences("missing").isEmpty());
  }

  @Test
  void sectionNamesAreNotIndexed() {
    assertThrows(NotFoundException.class, () -> index.lookupUnique("B"));
  }

  @Test
  void occurrencesKeepTreeOrder() {
    List<Occurrence> found = index.occurrences("shared");

    assertEquals(
        List.of("A", "A/B", "D"),
        found.stream().map(Occurrence::section).collect(Collectors.toList()));
    assertEquals(new IntegerValue(2), found.get(1).value());
    assertEquals(List.of("shared", "only_a", "deep"), index.names());
    assertEquals(5, index.size());
  }
}
