package com.gentoro.configreader.expression;

import com.gentoro.configreader.value.Value;
import java.util.List;

/** A function callable from expressions. Only functions registered in a {@link Namespace} exist. */
public interface NumericFunction {

  String name();

  /** Exact number of arguments accepted. */
  int arity();

  /** Applies the function; {@code arguments} has already been checked against {@link #arity()}. */
  Value apply(List<Value> arguments);
}
