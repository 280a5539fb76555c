package com.gentoro.configreader.expression;

import com.gentoro.configreader.value.Value;
import java.util.List;
import java.util.Set;

/**
 * Syntax tree of an arithmetic expression. The node set is closed: literals, namespace
 * identifiers, signs, binary operators and calls to namespace functions. There is no node that
 * could reach anything outside the namespace.
 */
public interface Expression {

  /** Adds every identifier this expression references, as a constant or a function. */
  void collectNames(Set<String> constants, Set<String> functions);

  record Literal(Value value) implements Expression {
    @Override
    public void collectNames(Set<String> constants, Set<String> functions) {}
  }

  record Identifier(String name) implements Expression {
    @Override
    public void collectNames(Set<String> constants, Set<String> functions) {
      constants.add(name);
    }
  }

  /** Unary {@code -x} when {@code negative}, otherwise {@code +x}. */
  record Sign(boolean negative, Expression operand) implements Expression {
    @Override
    public void collectNames(Set<String> constants, Set<String> functions) {
      operand.collectNames(constants, functions);
    }
  }

  record Binary(BinaryOperator operator, Expression left, Expression right)
      implements Expression {
    @Override
    public void collectNames(Set<String> constants, Set<String> functions) {
      left.collectNames(constants, functions);
      right.collectNames(constants, functions);
    }
  }

  record Call(String function, List<Expression> arguments) implements Expression {
    public Call {
      arguments = List.copyOf(arguments);
    }

    @Override
    public void collectNames(Set<String> constants, Set<String> functions) {
      functions.add(function);
      arguments.forEach(a -> a.collectNames(constants, functions));
    }
  }
}
