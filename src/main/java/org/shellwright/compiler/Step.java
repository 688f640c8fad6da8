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

import com.google.common.collect.ImmutableList;
import java.util.function.Function;
import org.shellwright.code.Expr;

/**
 * A Step is one stage of building a script: given a {@link ScriptBuilder} it emits zero or more
 * {@link Expr}s and returns a result, typically a handle ({@link Var}, {@link Func}) that later
 * steps refer to.
 *
 * <p>Steps that return nothing are usually written as a {@link Script}.
 */
@FunctionalInterface
public interface Step<T> {

  /** Emits this step's Exprs to {@code sb} (which also supplies the Env) and returns its result. */
  T build(ScriptBuilder sb);

  /**
   * Runs this step against {@code env}, which will be updated with every name the step allocates.
   * This is the entry point for running a builder outside of another builder.
   */
  default Built<T> run(Env env) {
    ScriptBuilder sb = new ScriptBuilder(env);
    T result = build(sb);
    return new Built<>(sb.exprs(), env, result);
  }

  /**
   * Returns a Step that runs this one, passes its result to {@code next}, and then runs the Step
   * that returns. The combined Step emits this step's Exprs followed by the next step's, and
   * returns the next step's result.
   */
  default <U> Step<U> then(Function<? super T, ? extends Step<U>> next) {
    return sb -> next.apply(build(sb)).build(sb);
  }

  /** Returns a Step that emits the same Exprs as this one and transforms its result. */
  default <U> Step<U> map(Function<? super T, ? extends U> fn) {
    return sb -> fn.apply(build(sb));
  }

  /** Returns a Step that emits nothing and returns {@code value}. */
  static <T> Step<T> of(T value) {
    return sb -> value;
  }

  /** The outcome of {@link #run}. */
  record Built<T>(ImmutableList<Expr> exprs, Env env, T result) {}
}
