package com.gentoro.configreader;

import com.gentoro.configreader.exception.ConfigException;
import com.gentoro.configreader.exception.IoException;
import com.gentoro.configreader.logging.LoggingService;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;

/**
 * Loads the reader's own YAML settings and exposes an Apache Commons Configuration instance.
 *
 * <p>Location formats supported: - "classpath:some/path.yaml" (loaded from the application
 * classpath) - "file:" URIs - Absolute or relative filesystem path (e.g., "/etc/reader.yaml" or
 * "config/reader.yaml"). A blank location means {@value #DEFAULT_LOCATION}.
 *
 * <p>Any {@code logging.level.*} entries found in the file are applied through {@link
 * LoggingService}.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:configreader.yaml";

  private final Configuration configuration;

  public ConfigurationProvider() {
    this(DEFAULT_LOCATION);
  }

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
    LoggingService.applyConfiguration(configuration);
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    URL resourceUrl = Thread.currentThread().getContextClassLoader().getResource(resourceName);
    if (resourceUrl == null) {
      // Missing settings resource means built-in defaults.
      log.debug("Settings resource {} not on classpath; using defaults", resourceName);
      return new YAMLConfiguration();
    }
    log.debug("Loading reader settings from classpath resource: {}", resourceName);
    try (InputStream input =
        Thread.currentThread().getContextClassLoader().getResourceAsStream(resourceName)) {
      if (input == null) {
        throw new FileNotFoundException("Resource not found: %s".formatted(resourceName));
      }
      String yamlContent = new String(input.readAllBytes(), StandardCharsets.UTF_8);
      YAMLConfiguration config = new YAMLConfiguration();
      config.read(new StringReader(yamlContent));
      return config;
    } catch (ConfigurationException e) {
      throw new ConfigException("Invalid YAML in classpath resource: " + resourceName, e);
    } catch (Exception e) {
      throw new IoException("Failed to read YAML from classpath resource: " + resourceName, e);
    }
  }

  private static Configuration loadYamlFromFile(File file) {
    if (!file.isFile()) {
      throw new IoException("Settings file not found: " + file);
    }
    log.debug("Loading reader settings from file: {}", file);
    try {
      Parameters params = new Parameters();
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(params.fileBased().setFile(file));
      return builder.getConfiguration();
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Configuration loadYamlFromLocation(String location) {
    if (location == null || location.isBlank()) {
      return loadYamlFromLocation(DEFAULT_LOCATION);
    }
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      return loadYamlFromClasspath(loc.substring("classpath:".length()));
    }
    if (loc.regionMatches(true, 0, "file:", 0, 5)) {
      try {
        return loadYamlFromFile(new File(URI.create(loc)));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Invalid settings location: " + loc, e);
      }
    }
    return loadYamlFromFile(new File(loc));
  }
}
