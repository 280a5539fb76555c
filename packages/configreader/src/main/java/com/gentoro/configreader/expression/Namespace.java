package com.gentoro.configreader.expression;

import com.gentoro.configreader.value.Value;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Names visible to expressions: constants and functions.
 *
 * <p>A namespace is an immutable layer over an optional parent. User constants live in a layer
 * above the built-ins, so a user constant shadows a built-in of the same name on lookup while the
 * built-in layer itself is never modified. Constants and functions are separate: a constant named
 * {@code sin} does not hide the {@code sin()} function.
 */
public final class Namespace {
  private final Namespace parent;
  private final Map<String, Value> constants;
  private final Map<String, NumericFunction> functions;

  Namespace(
      Namespace parent, Map<String, Value> constants, Map<String, NumericFunction> functions) {
    this.parent = parent;
    this.constants = Collections.unmodifiableMap(new LinkedHashMap<>(constants));
    this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
  }

  /** The fixed built-in constants and functions. */
  public static Namespace builtIns() {
    return BuiltIns.NAMESPACE;
  }

  /** A new layer holding {@code userConstants} on top of this namespace. */
  public Namespace withConstants(Map<String, Value> userConstants) {
    return new Namespace(this, userConstants, Map.of());
  }

  public Optional<Value> constant(String name) {
    Value v = constants.get(name);
    if (v != null) return Optional.of(v);
    return parent == null ? Optional.empty() : parent.constant(name);
  }

  public Optional<NumericFunction> function(String name) {
    NumericFunction f = functions.get(name);
    if (f != null) return Optional.of(f);
    return parent == null ? Optional.empty() : parent.function(name);
  }

  public boolean hasConstant(String name) {
    return constant(name).isPresent();
  }

  public boolean hasFunction(String name) {
    return function(name).isPresent();
  }

  /** Constants defined in this layer only, in definition order. */
  public Map<String, Value> localConstants() {
    return constants;
  }

  /** Every visible constant, with shadowing applied. */
  public Map<String, Value> allConstants() {
    Map<String, Value> all = parent == null ? new LinkedHashMap<>() : parent.allConstants();
    all.putAll(constants);
    return all;
  }
}
