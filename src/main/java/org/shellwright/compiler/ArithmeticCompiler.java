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

/**
 * Compiles an {@link Arith} to the text that goes inside {@code $((...))}.
 *
 * <p>Every operator application is parenthesized, whatever the shell's precedence rules would
 * say, so {@code plus(num(1), mult(num(2), num(3)))} compiles to {@code (1 + (2 * 3))}.
 */
public final class ArithmeticCompiler {

  private ArithmeticCompiler() {}

  public static String compile(Env env, Arith arith) {
    if (arith instanceof Arith.Num num) {
      return Long.toString(num.value());
    } else if (arith instanceof Arith.VarRef ref) {
      // Arithmetic expansion doesn't split words, so the variable is not quoted.
      return ref.var().expand(env).text();
    } else if (arith instanceof Arith.Unary unary) {
      return "(" + unary.op().symbol + " " + compile(env, unary.arg()) + ")";
    } else if (arith instanceof Arith.Binary binary) {
      return "("
          + compile(env, binary.left())
          + " "
          + binary.op().symbol
          + " "
          + compile(env, binary.right())
          + ")";
    } else if (arith instanceof Arith.Cond cond) {
      return "("
          + compile(env, cond.test())
          + " ? "
          + compile(env, cond.ifTrue())
          + " : "
          + compile(env, cond.ifFalse())
          + ")";
    }
    throw new AssertionError(arith);
  }
}
