package com.gentoro.configreader.exception;

import java.util.Map;

/** A path segment does not name a key or a child section. */
public class PathNotFoundException extends ConfigReaderException {
  public PathNotFoundException(String path, String segment) {
    super(
        ConfigReaderErrorCode.PATH_NOT_FOUND,
        "Path '%s' not found: no key or section named '%s'".formatted(path, segment),
        Map.of("path", path, "segment", segment));
  }
}
