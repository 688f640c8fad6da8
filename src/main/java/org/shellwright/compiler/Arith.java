/*
 * Copyright 2025 The Shellwright Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.shellwright.compiler;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A shell arithmetic expression. Passed as a {@link Param}, it becomes a quoted arithmetic
 * substitution ({@code "$((...))"}).
 *
 * <p>As in the shell, operators that would produce a boolean (comparisons, {@link #not}, {@link
 * #and}, {@link #or}) instead produce 1 for true and 0 for false.
 */
public interface Arith extends Param {

  @Override
  default String toText(Env env) {
    return "\"$((" + ArithmeticCompiler.compile(env, this) + "))\"";
  }

  /** Operators taking one argument. */
  enum UnaryOp {
    NEGATE("-"),
    NOT("!");

    final String symbol;

    UnaryOp(String symbol) {
      this.symbol = symbol;
    }
  }

  /** Operators taking two arguments. */
  enum BinaryOp {
    PLUS("+"),
    MINUS("-"),
    MULT("*"),
    DIV("/"),
    MOD("%"),
    OR("||"),
    AND("&&"),
    EQUAL("=="),
    NOT_EQUAL("!="),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),
    BIT_OR("|"),
    BIT_XOR("^"),
    BIT_AND("&"),
    SHIFT_LEFT("<<"),
    SHIFT_RIGHT(">>");

    final String symbol;

    BinaryOp(String symbol) {
      this.symbol = symbol;
    }
  }

  /** An integer literal. */
  record Num(long value) implements Arith {}

  /** The value of a variable. */
  record VarRef(Var<? extends Number> var) implements Arith {
    public VarRef {
      checkNotNull(var);
    }
  }

  record Unary(UnaryOp op, Arith arg) implements Arith {
    public Unary {
      checkNotNull(op);
      checkNotNull(arg);
    }
  }

  record Binary(BinaryOp op, Arith left, Arith right) implements Arith {
    public Binary {
      checkNotNull(op);
      checkNotNull(left);
      checkNotNull(right);
    }
  }

  /** If {@code test} is non-zero the result is {@code ifTrue}, else {@code ifFalse}. */
  record Cond(Arith test, Arith ifTrue, Arith ifFalse) implements Arith {
    public Cond {
      checkNotNull(test);
      checkNotNull(ifTrue);
      checkNotNull(ifFalse);
    }
  }

  static Arith num(long value) {
    return new Num(value);
  }

  static Arith var(Var<? extends Number> var) {
    return new VarRef(var);
  }

  static Arith negate(Arith a) {
    return new Unary(UnaryOp.NEGATE, a);
  }

  static Arith not(Arith a) {
    return new Unary(UnaryOp.NOT, a);
  }

  static Arith plus(Arith a, Arith b) {
    return new Binary(BinaryOp.PLUS, a, b);
  }

  static Arith minus(Arith a, Arith b) {
    return new Binary(BinaryOp.MINUS, a, b);
  }

  static Arith mult(Arith a, Arith b) {
    return new Binary(BinaryOp.MULT, a, b);
  }

  static Arith div(Arith a, Arith b) {
    return new Binary(BinaryOp.DIV, a, b);
  }

  static Arith mod(Arith a, Arith b) {
    return new Binary(BinaryOp.MOD, a, b);
  }

  static Arith or(Arith a, Arith b) {
    return new Binary(BinaryOp.OR, a, b);
  }

  static Arith and(Arith a, Arith b) {
    return new Binary(BinaryOp.AND, a, b);
  }

  static Arith equal(Arith a, Arith b) {
    return new Binary(BinaryOp.EQUAL, a, b);
  }

  static Arith notEqual(Arith a, Arith b) {
    return new Binary(BinaryOp.NOT_EQUAL, a, b);
  }

  static Arith lessThan(Arith a, Arith b) {
    return new Binary(BinaryOp.LT, a, b);
  }

  static Arith greaterThan(Arith a, Arith b) {
    return new Binary(BinaryOp.GT, a, b);
  }

  static Arith lessOrEqual(Arith a, Arith b) {
    return new Binary(BinaryOp.LE, a, b);
  }

  static Arith greaterOrEqual(Arith a, Arith b) {
    return new Binary(BinaryOp.GE, a, b);
  }

  static Arith bitOr(Arith a, Arith b) {
    return new Binary(BinaryOp.BIT_OR, a, b);
  }

  static Arith bitXor(Arith a, Arith b) {
    return new Binary(BinaryOp.BIT_XOR, a, b);
  }

  static Arith bitAnd(Arith a, Arith b) {
    return new Binary(BinaryOp.BIT_AND, a, b);
  }

  /** {@code a}'s bits shifted left by {@code b}. */
  static Arith shiftLeft(Arith a, Arith b) {
    return new Binary(BinaryOp.SHIFT_LEFT, a, b);
  }

  static Arith shiftRight(Arith a, Arith b) {
    return new Binary(BinaryOp.SHIFT_RIGHT, a, b);
  }

  static Arith cond(Arith test, Arith ifTrue, Arith ifFalse) {
    return new Cond(test, ifTrue, ifFalse);
  }
}
