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

import org.shellwright.util.Quoted;

/**
 * A shell function defined by {@link ScriptBuilder#func}. Its name is unique among the functions
 * of the script being built.
 */
public final class Func {
  private final String name;

  Func(String name) {
    this.name = checkNotNull(name);
  }

  public String name() {
    return name;
  }

  /**
   * Returns a Script that calls this function with the given params (converted as by {@link
   * Param#of}). Inside the function they are the positional parameters.
   */
  public Script call(Object... params) {
    return sb -> sb.cmd(Quoted.unsafe(name), params);
  }

  @Override
  public String toString() {
    return name;
  }
}
