package com.gentoro.configreader;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.configreader.exception.ConfigException;
import com.gentoro.configreader.exception.IoException;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ReaderSettingsTest {

  @Test
  void defaultsMatchBundledYaml() {
    assertEquals(ReaderSettings.defaults(), ReaderSettings.load());
    assertEquals(Optional.of("Constants"), ReaderSettings.defaults().constants());
    assertTrue(ReaderSettings.defaults().lowercaseKeys());
  }

  @Test
  void customYamlOverridesOnlyWhatItNames() {
    ReaderSettings s = ReaderSettings.load("classpath:reader-custom.yaml");

    assertEquals("Config", s.rootName());
    assertEquals(".", s.separator());
    assertEquals("Defs", s.constantsSection());
    assertTrue(s.lowercaseKeys());
    assertEquals(ReaderSettings.DEFAULT_DELIMITERS, s.delimiters());
    assertEquals(ReaderSettings.DEFAULT_COMMENT_PREFIXES, s.commentPrefixes());
  }

  @Test
  void blankConstantsSectionDisablesConstants() {
    assertEquals(Optional.empty(), ReaderSettings.defaults().withConstantsSection(" ").constants());
  }

  @Test
  void invalidValuesAreRejected() {
    ReaderSettings d = ReaderSettings.defaults();

    assertThrows(ConfigException.class, () -> d.withRootName(" "));
    assertThrows(ConfigException.class, () -> d.withSeparator(""));
    assertThrows(ConfigException.class, () -> d.withSeparator("x"));
    assertThrows(ConfigException.class, () -> d.withSeparator("["));
    assertThrows(
        ConfigException.class,
        () -> new ReaderSettings("root", "/", "Constants", "#", "[=", false));
    assertThrows(
        ConfigException.class, () -> new ReaderSettings("root", "/", "Constants", "#", "", false));
  }

  @Test
  void missingSettingsFileIsAnIoError() {
    assertThrows(IoException.class, () -> ReaderSettings.load("file:/no/such/settings.yaml"));
  }
}
