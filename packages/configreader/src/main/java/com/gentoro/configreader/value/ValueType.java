package com.gentoro.configreader.value;

/** The closed set of value variants produced by type inference. */
public enum ValueType {
  INTEGER,
  REAL,
  BOOLEAN,
  STRING
}
