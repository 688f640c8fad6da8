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

import com.google.errorprone.annotations.FormatMethod;

/**
 * Thrown when a script is built incorrectly, e.g. by trimming a variable that can't be trimmed.
 * These errors are reported as soon as the offending operation is called; problems that only show
 * up when the generated script runs are the shell's business.
 */
public class ScriptError extends RuntimeException {

  public ScriptError(String msg) {
    super(msg);
  }

  /** Returns a new ScriptError with a formatted message. */
  @FormatMethod
  static ScriptError format(String fmt, Object... fmtArgs) {
    return new ScriptError(String.format(fmt, fmtArgs));
  }

  /** Returns a new "Cannot assign to '%s'" ScriptError. */
  static ScriptError cannotAssign(Var<?> var) {
    return format("Cannot assign to '%s'", var);
  }

  /** Returns a new "Cannot modify '%s'" ScriptError. */
  static ScriptError cannotModify(Var<?> var) {
    return format("Cannot modify '%s'", var);
  }
}
