package com.gentoro.configreader.resolve;

import com.gentoro.configreader.value.Value;

/**
 * One place a key name occurs in the tree.
 *
 * @param path full path of the key from the root, e.g. {@code Sampler/parameter1/min}
 * @param section path of the section holding the key; empty for the root
 * @param value the evaluated value
 */
public record Occurrence(String path, String section, Value value) {}
