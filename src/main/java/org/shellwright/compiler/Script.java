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

import org.shellwright.code.Renderer;

/**
 * A Script is a {@link Step} with no result, the usual shape for a script or part of one:
 *
 * <pre>{@code
 * String text =
 *     Script.script(
 *         sb -> {
 *           Var<String> name = sb.newVar("name");
 *           sb.readVar(name);
 *           sb.cmd("echo", "hello", name);
 *         });
 * }</pre>
 */
@FunctionalInterface
public interface Script extends Step<Void> {

  void emit(ScriptBuilder sb);

  @Override
  default Void build(ScriptBuilder sb) {
    emit(sb);
    return null;
  }

  /** Returns a Script that emits this Script's Exprs followed by {@code second}'s. */
  default Script andThen(Script second) {
    return sb -> {
      emit(sb);
      second.emit(sb);
    };
  }

  /** Returns a Script that emits nothing. */
  static Script empty() {
    return sb -> {};
  }

  /**
   * Builds {@code script} with a new Env and renders it as a multi-line script, starting with
   * {@code #!/bin/sh}, suitable to be written to a file.
   */
  static String script(Script script) {
    return Renderer.script(script.run(new Env()).exprs());
  }

  /** Builds {@code script} with a new Env and renders it as a single line of shell code. */
  static String linearScript(Script script) {
    return Renderer.linear(script.run(new Env()).exprs());
  }
}
