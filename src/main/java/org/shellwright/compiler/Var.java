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

import java.util.function.UnaryOperator;
import org.shellwright.util.Quoted;

/**
 * A Var is a reference to a shell variable. It has a name and a way to expand it, which is
 * usually {@code $name} but may be overridden by modified variables such as those returned by
 * {@link ScriptBuilder#defaultVar} (whose expansion is e.g. {@code ${name:-default}}).
 *
 * <p>The type parameter {@code T} is only a tag for the kind of value the variable is meant to
 * hold; the shell itself stores everything as text. Several Vars may refer to the same shell
 * variable.
 *
 * <p>Passing a Var to a command (see {@link Param}) passes its double-quoted expansion.
 */
public final class Var<T> implements Param {

  /** Produces the (unquoted) expansion of a variable. */
  @FunctionalInterface
  public interface Expander {
    Quoted expand(Env env, String name);
  }

  private static final Expander SIMPLE = (env, name) -> Quoted.unsafe("$" + name);

  /** The name of the positional-parameters pseudo-variable. */
  static final String POSITIONAL = "@";

  /** The name of the parameter-count pseudo-variable. */
  static final String COUNT = "#";

  private final String name;
  private final Expander expander;

  private Var(String name, Expander expander) {
    this.name = checkNotNull(name);
    this.expander = checkNotNull(expander);
  }

  /** Returns a Var for {@code name} with the usual {@code $name} expansion. */
  static <T> Var<T> simple(String name) {
    return new Var<>(name, SIMPLE);
  }

  /**
   * Returns the Var that expands to whatever parameters were passed to the script ({@code "$@"}),
   * or to the function when used inside a function body.
   */
  public static <T> Var<T> positionalParameters() {
    return simple(POSITIONAL);
  }

  public String name() {
    return name;
  }

  /** Returns the unquoted expansion of this Var. */
  public Quoted expand(Env env) {
    return expander.expand(env, name);
  }

  @Override
  public String toText(Env env) {
    return "\"" + expand(env).text() + "\"";
  }

  /**
   * True if this is one of the shell's special parameters ({@code $@}, {@code $#}) rather than a
   * named variable.
   */
  public boolean isSpecial() {
    return name.equals(POSITIONAL) || name.equals(COUNT);
  }

  /** True if this Var's expansion is something other than {@code $name}. */
  public boolean isModified() {
    return expander != SIMPLE;
  }

  /** Returns a Var with the same name and a different expansion. */
  Var<T> withExpander(Expander expander) {
    return new Var<>(name, expander);
  }

  /**
   * Returns this Var with a different type tag. This is unsafe: nothing checks that the shell
   * variable actually holds the new kind of value. It is only for the few operations (e.g.
   * trimming) whose result legitimately has a different type.
   */
  @SuppressWarnings("unchecked")
  <U> Var<U> castUnsafe() {
    return (Var<U>) this;
  }

  /**
   * Returns a Param that passes this Var's quoted expansion through {@code fn} first, e.g. to
   * prefix it with a path:
   *
   * <pre>{@code sb.cmd("rmdir", name.with(q -> Quote.quote("/home/").concat(q)))}</pre>
   */
  public WithVar with(UnaryOperator<Quoted> fn) {
    return new WithVar(this, fn);
  }

  @Override
  public String toString() {
    return isModified() ? name + "(modified)" : name;
  }
}
