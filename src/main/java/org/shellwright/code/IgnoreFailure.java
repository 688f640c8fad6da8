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

package org.shellwright.code;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Rewrites Exprs so that a nonzero exit status from any command in them is ignored, by turning
 * {@code cmd} into {@code cmd || true}.
 */
public final class IgnoreFailure {

  private IgnoreFailure() {}

  private static final Expr.Cmd TRUE = Expr.cmd("true");

  public static ImmutableList<Expr> rewrite(List<? extends Expr> exprs) {
    return exprs.stream().map(IgnoreFailure::rewrite).collect(ImmutableList.toImmutableList());
  }

  public static Expr rewrite(Expr expr) {
    if (expr instanceof Expr.Cmd) {
      return new Expr.Or(expr, TRUE);
    } else if (expr instanceof Expr.Comment) {
      return expr;
    } else if (expr instanceof Expr.Subshell subshell) {
      return new Expr.Subshell(subshell.prefix(), rewrite(subshell.body()));
    } else if (expr instanceof Expr.Pipe pipe) {
      // Assumes pipefail is not set, so only the last command's status matters.
      return new Expr.Pipe(pipe.left(), rewrite(pipe.right()));
    } else if (expr instanceof Expr.And) {
      // "a && b || true" is always true; no parentheses needed.
      return new Expr.Or(expr, TRUE);
    } else if (expr instanceof Expr.Or or) {
      return new Expr.Or(or.left(), rewrite(or.right()));
    } else if (expr instanceof Expr.Redir redir) {
      return new Expr.Redir(rewrite(redir.expr()), redir.spec());
    }
    throw new AssertionError(expr);
  }
}
