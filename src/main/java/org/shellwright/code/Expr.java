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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * An Expr is one unit of emitted shell syntax. There are seven variants:
 *
 * <ul>
 *   <li>{@link Cmd}: a command line whose words have already been quoted
 *   <li>{@link Comment}: a comment
 *   <li>{@link Subshell}: a sequence of Exprs run in a sub-shell
 *   <li>{@link Pipe}, {@link And}, {@link Or}: two Exprs joined by {@code |}, {@code &&} or {@code
 *       ||}
 *   <li>{@link Redir}: an Expr with one of its file descriptors redirected
 * </ul>
 *
 * <p>Exprs are immutable; {@link #indent} and the other transformations return new trees.
 */
public interface Expr {

  /** The text prepended to each line for one level of indentation. */
  String INDENT = "\t";

  /**
   * Returns an equivalent Expr that will be rendered one level further indented. Only the start
   * of each line is indented, so the right side of a {@link Pipe}, {@link And} or {@link Or} is
   * left alone.
   */
  Expr indent();

  /** A command. {@code text} is emitted verbatim, so every word in it must already be quoted. */
  record Cmd(String text) implements Expr {
    public Cmd {
      checkNotNull(text);
    }

    @Override
    public Cmd indent() {
      return new Cmd(INDENT + text);
    }
  }

  /** A comment; any newlines in {@code text} are dropped when it is rendered. */
  record Comment(String prefix, String text) implements Expr {
    public Comment {
      checkNotNull(prefix);
      checkNotNull(text);
    }

    @Override
    public Comment indent() {
      return new Comment(INDENT + prefix, text);
    }
  }

  /** Exprs grouped in parentheses; {@code prefix} is the indentation of the parentheses. */
  record Subshell(String prefix, ImmutableList<Expr> body) implements Expr {
    public Subshell {
      checkNotNull(prefix);
      checkNotNull(body);
    }

    @Override
    public Subshell indent() {
      return new Subshell(INDENT + prefix, indentAll(body));
    }
  }

  /** {@code left | right} */
  record Pipe(Expr left, Expr right) implements Expr {
    @Override
    public Pipe indent() {
      return new Pipe(left.indent(), right);
    }
  }

  /** {@code left && right} */
  record And(Expr left, Expr right) implements Expr {
    @Override
    public And indent() {
      return new And(left.indent(), right);
    }
  }

  /** {@code left || right} */
  record Or(Expr left, Expr right) implements Expr {
    @Override
    public Or indent() {
      return new Or(left.indent(), right);
    }
  }

  /** {@code expr} with a redirection applied. */
  record Redir(Expr expr, RedirSpec spec) implements Expr {
    public Redir {
      checkNotNull(expr);
      checkNotNull(spec);
    }

    @Override
    public Redir indent() {
      return new Redir(expr.indent(), spec);
    }
  }

  static Cmd cmd(String text) {
    return new Cmd(text);
  }

  static Comment comment(String text) {
    return new Comment("", text);
  }

  /** Returns an unindented Subshell containing the given Exprs. */
  static Subshell subshell(List<? extends Expr> body) {
    return new Subshell("", ImmutableList.copyOf(body));
  }

  /** Returns the given Exprs, each indented one more level. */
  static ImmutableList<Expr> indentAll(List<? extends Expr> exprs) {
    return exprs.stream().map(Expr::indent).collect(ImmutableList.toImmutableList());
  }

  /**
   * Returns a single Expr equivalent to the given sequence: the only element if there is exactly
   * one, otherwise a Subshell containing all of them. Used where the shell syntax allows only one
   * expression, e.g. either side of a pipe.
   */
  static Expr single(List<? extends Expr> exprs) {
    return (exprs.size() == 1) ? exprs.get(0) : subshell(exprs);
  }
}
