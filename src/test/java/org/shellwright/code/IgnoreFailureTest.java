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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class IgnoreFailureTest {

  private static final Expr A = Expr.cmd("a");
  private static final Expr B = Expr.cmd("b");

  private static String rewritten(Expr expr) {
    return Renderer.format(Renderer.Mode.SINGLE_LINE, IgnoreFailure.rewrite(expr));
  }

  @Test
  public void commandsAndComments() {
    ImmutableList<Expr> exprs = ImmutableList.of(A, Expr.comment("note"), B);
    assertThat(Renderer.linear(IgnoreFailure.rewrite(exprs)))
        .isEqualTo("a || true; : note; b || true");
    // The input list is untouched.
    assertThat(Renderer.linear(exprs)).isEqualTo("a; : note; b");
  }

  @Test
  public void onlyTheLastStageOfAPipeIsRewritten() {
    assertThat(rewritten(new Expr.Pipe(A, B))).isEqualTo("a | b || true");
    assertThat(IgnoreFailure.rewrite(new Expr.Pipe(A, B)))
        .isEqualTo(new Expr.Pipe(A, new Expr.Or(B, Expr.cmd("true"))));
  }

  @Test
  public void andOr() {
    assertThat(rewritten(new Expr.And(A, B))).isEqualTo("a && b || true");
    assertThat(IgnoreFailure.rewrite(new Expr.Or(A, B)))
        .isEqualTo(new Expr.Or(A, new Expr.Or(B, Expr.cmd("true"))));
  }

  @Test
  public void subshellsAndRedirections() {
    Expr subshell = Expr.subshell(ImmutableList.of(A, B));
    assertThat(rewritten(subshell)).isEqualTo("(\ta || true;\tb || true)");
    Expr redir = new Expr.Redir(A, new RedirSpec.ToFile(1, "out"));
    assertThat(rewritten(redir)).isEqualTo("(a || true) > out");
  }
}
