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
 * A Param that modifies the value of a variable before it is passed to a command. The function is
 * given the quoted expansion of the variable and may e.g. concatenate other quoted text to it.
 */
public final class WithVar implements Param {
  private final Var<?> var;
  private final UnaryOperator<Quoted> fn;

  public WithVar(Var<?> var, UnaryOperator<Quoted> fn) {
    this.var = checkNotNull(var);
    this.fn = checkNotNull(fn);
  }

  @Override
  public String toText(Env env) {
    return fn.apply(Quoted.unsafe(var.toText(env))).text();
  }
}
