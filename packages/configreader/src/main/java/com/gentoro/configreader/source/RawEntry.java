package com.gentoro.configreader.source;

/**
 * One {@code key = rawtext} pair as it appeared in the source.
 *
 * @param key trimmed key
 * @param rawText trimmed, unevaluated value text; continuation lines are joined with {@code \n}
 * @param line 1-based line number of the key, 0 when not read from a file
 */
public record RawEntry(String key, String rawText, int line) {}
