package com.gentoro.configreader;

import com.gentoro.configreader.exception.ConfigException;
import java.util.Optional;
import org.apache.commons.configuration2.Configuration;

/**
 * Immutable knobs of the reader, normally read from {@code configreader.*} keys of the settings
 * YAML (see {@link ConfigurationProvider}).
 *
 * @param rootName display name of the implicit root section
 * @param separator nesting marker in headers and separator in lookup paths
 * @param constantsSection name of the top-level section feeding the namespace; blank disables it
 * @param commentPrefixes characters that start a comment line
 * @param delimiters characters that separate a key from its value; the first one on the line wins
 * @param lowercaseKeys whether keys are folded to lower case while reading; on by default
 */
public record ReaderSettings(
    String rootName,
    String separator,
    String constantsSection,
    String commentPrefixes,
    String delimiters,
    boolean lowercaseKeys) {

  public static final String DEFAULT_ROOT_NAME = "toplevel";
  public static final String DEFAULT_SEPARATOR = "/";
  public static final String DEFAULT_CONSTANTS_SECTION = "Constants";
  public static final String DEFAULT_COMMENT_PREFIXES = "#;";
  public static final String DEFAULT_DELIMITERS = "=:";
  public static final boolean DEFAULT_LOWERCASE_KEYS = true;

  public ReaderSettings {
    if (rootName == null || rootName.isBlank()) {
      throw new ConfigException("configreader.root-name must not be blank");
    }
    if (separator == null || separator.isEmpty()) {
      throw new ConfigException("configreader.separator must not be empty");
    }
    for (char c : separator.toCharArray()) {
      if (Character.isLetterOrDigit(c) || Character.isWhitespace(c) || c == '[' || c == ']') {
        throw new ConfigException("configreader.separator contains illegal character: " + c);
      }
    }
    if (delimiters == null || delimiters.isEmpty()) {
      throw new ConfigException("configreader.delimiters must not be empty");
    }
    if (delimiters.contains("[")) {
      throw new ConfigException("configreader.delimiters must not contain '['");
    }
    rootName = rootName.trim();
    constantsSection = constantsSection == null ? "" : constantsSection.trim();
    commentPrefixes = commentPrefixes == null ? "" : commentPrefixes;
  }

  public static ReaderSettings defaults() {
    return new ReaderSettings(
        DEFAULT_ROOT_NAME,
        DEFAULT_SEPARATOR,
        DEFAULT_CONSTANTS_SECTION,
        DEFAULT_COMMENT_PREFIXES,
        DEFAULT_DELIMITERS,
        DEFAULT_LOWERCASE_KEYS);
  }

  /** Settings from the default {@code classpath:configreader.yaml}. */
  public static ReaderSettings load() {
    return from(new ConfigurationProvider().config());
  }

  public static ReaderSettings load(String location) {
    return from(new ConfigurationProvider(location).config());
  }

  public static ReaderSettings from(Configuration cfg) {
    return new ReaderSettings(
        cfg.getString("configreader.root-name", DEFAULT_ROOT_NAME),
        cfg.getString("configreader.separator", DEFAULT_SEPARATOR),
        cfg.getString("configreader.constants-section", DEFAULT_CONSTANTS_SECTION),
        cfg.getString("configreader.comment-prefixes", DEFAULT_COMMENT_PREFIXES),
        cfg.getString("configreader.delimiters", DEFAULT_DELIMITERS),
        cfg.getBoolean("configreader.lowercase-keys", DEFAULT_LOWERCASE_KEYS));
  }

  public Optional<String> constants() {
    return constantsSection.isEmpty() ? Optional.empty() : Optional.of(constantsSection);
  }

  public ReaderSettings withRootName(String name) {
    return new ReaderSettings(
        name, separator, constantsSection, commentPrefixes, delimiters, lowercaseKeys);
  }

  public ReaderSettings withConstantsSection(String name) {
    return new ReaderSettings(
        rootName, separator, name, commentPrefixes, delimiters, lowercaseKeys);
  }

  public ReaderSettings withSeparator(String sep) {
    return new ReaderSettings(
        rootName, sep, constantsSection, commentPrefixes, delimiters, lowercaseKeys);
  }

  public ReaderSettings withLowercaseKeys(boolean lowercase) {
    return new ReaderSettings(
        rootName, separator, constantsSection, commentPrefixes, delimiters, lowercase);
  }
}
