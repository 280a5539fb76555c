/**
 * Value inference and safe arithmetic expressions.
 *
 * <p>{@link com.gentoro.configreader.expression.ExpressionEvaluator} turns the raw text of a value
 * into a typed {@link com.gentoro.configreader.value.Value}. Expressions are parsed by a small
 * recursive-descent parser into an {@link com.gentoro.configreader.expression.Expression} tree and
 * interpreted directly; nothing outside the grammar of {@link
 * com.gentoro.configreader.expression.ExpressionParser} is ever executed.
 *
 * <h2>Namespace</h2>
 *
 * <p>Names resolve against a layered {@link com.gentoro.configreader.expression.Namespace}: the
 * built-in constants and functions, overlaid with the entries of the constants section in the order
 * they appear in the file. Constants and functions live in separate maps.
 */
package com.gentoro.configreader.expression;
