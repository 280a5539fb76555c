/**
 * Section tree construction and the immutable evaluated tree.
 *
 * <p>A header's leading separators give its depth relative to the most recently opened sections:
 * {@code [a]} opens a top-level section, {@code [/b]} a child of the last top-level section, {@code
 * [//c]} a child of that, and so on without limit.
 */
package com.gentoro.configreader.tree;
