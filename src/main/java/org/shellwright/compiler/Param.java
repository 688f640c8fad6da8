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

import org.shellwright.util.Quote;
import org.shellwright.util.Quoted;

/**
 * A Param is anything that can be passed to a command: its text is spliced into the command line.
 * The categories are
 *
 * <ul>
 *   <li>literal text ({@link #text}), which is quoted;
 *   <li>a value rendered with {@code toString()} ({@link #val}), which is not quoted and so must be
 *       syntactically safe, e.g. a number;
 *   <li>a {@link Var}, which becomes its quoted expansion;
 *   <li>a {@link WithVar}, a Var expansion modified by the caller;
 *   <li>already-{@link Quoted} text, used as-is;
 *   <li>an {@link Output}, the quoted output of another script; and
 *   <li>an {@link Arith} expression, which becomes a quoted arithmetic substitution.
 * </ul>
 */
@FunctionalInterface
public interface Param {

  /**
   * Returns the shell source text for this Param. {@code env} is the build's Env, which will
   * record any names allocated while producing the text.
   */
  String toText(Env env);

  /** Returns a Param for literal text; it will be quoted. */
  static Param text(String text) {
    String quoted = Quote.quote(text).text();
    return env -> quoted;
  }

  /** Returns a Param whose text is {@code String.valueOf(value)}, unquoted. */
  static Param val(Object value) {
    String text = String.valueOf(value);
    return env -> text;
  }

  /** Returns a Param for text the caller has already quoted. */
  static Param quoted(Quoted quoted) {
    return env -> quoted.text();
  }

  /**
   * Converts an argument to {@link ScriptBuilder#cmd} into a Param: Params are returned
   * unchanged, Strings become {@link #text}, Quoted becomes {@link #quoted}, and Numbers become
   * {@link #val}. Anything else is rejected; wrap it with {@link #val} if its string form is known
   * to be safe.
   */
  static Param of(Object arg) {
    if (arg instanceof Param param) {
      return param;
    } else if (arg instanceof String s) {
      return text(s);
    } else if (arg instanceof Quoted q) {
      return quoted(q);
    } else if (arg instanceof Number n) {
      return val(n);
    }
    throw ScriptError.format(
        "Can't pass %s as a command parameter (use Param.val or Param.text)",
        (arg == null) ? "null" : arg.getClass().getSimpleName());
  }
}
