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

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Streams;
import java.util.ArrayList;
import java.util.List;
import org.shellwright.util.Quote;

/**
 * Renders a list of {@link Expr}s as shell source text, either as a multi-line script meant to be
 * read by humans or as a single line of {@code ;}-separated commands.
 *
 * <p>Rendering never modifies the Exprs; the single-line rewrite of here-documents (see {@link
 * #format}) builds a temporary tree, so the same Exprs can be rendered in both modes.
 */
public final class Renderer {

  /** Static methods only. */
  private Renderer() {}

  /** Which of the two output forms to produce. */
  public enum Mode {
    /** One command per line, with nested blocks indented. */
    MULTI_LINE,
    /** Everything on one line, suitable for use in a command substitution. */
    SINGLE_LINE
  }

  /** The first line of every multi-line script. */
  public static final String SHEBANG = "#!/bin/sh";

  private static final Joiner NEWLINE_JOINER = Joiner.on('\n');
  private static final Joiner SEMICOLON_JOINER = Joiner.on("; ");
  private static final Splitter LINE_SPLITTER = Splitter.on('\n');
  private static final CharMatcher NEWLINE = CharMatcher.is('\n');
  private static final CharMatcher INDENTATION = CharMatcher.anyOf(Expr.INDENT);

  /** The marker tried first when ending a here-document. */
  private static final String EOF = "EOF";

  /**
   * Returns a complete multi-line script: the {@link #SHEBANG} line, then each Expr on its own
   * line(s), with a final newline.
   */
  public static String script(List<? extends Expr> exprs) {
    StringBuilder sb = new StringBuilder(SHEBANG).append('\n');
    for (Expr expr : exprs) {
      sb.append(format(Mode.MULTI_LINE, expr)).append('\n');
    }
    return sb.toString();
  }

  /** Returns the given Exprs rendered as a single line, separated by {@code "; "}. */
  public static String linear(List<? extends Expr> exprs) {
    return SEMICOLON_JOINER.join(exprs.stream().map(e -> format(Mode.SINGLE_LINE, e)).iterator());
  }

  /**
   * Renders a single Expr in the given mode. In multi-line mode the bodies of any here-documents
   * follow the line that contains their {@code <<} operators.
   */
  public static String format(Mode mode, Expr expr) {
    List<String> hereDocs = new ArrayList<>();
    String line = format(mode, expr, hereDocs);
    if (hereDocs.isEmpty()) {
      return line;
    }
    return line + "\n" + NEWLINE_JOINER.join(hereDocs);
  }

  /**
   * Renders {@code expr} without any here-document bodies, which are added to {@code hereDocs} in
   * the order their operators appear on the line.
   */
  private static String format(Mode mode, Expr expr, List<String> hereDocs) {
    if (expr instanceof Expr.Cmd cmd) {
      return cmd.text();
    } else if (expr instanceof Expr.Comment comment) {
      String text = NEWLINE.removeFrom(comment.text());
      if (mode == Mode.MULTI_LINE) {
        return comment.prefix() + "# " + text;
      }
      // A comment would swallow the rest of the line, so pass its text to the no-op command.
      return comment.prefix() + ": " + Quote.quote(text).text();
    } else if (expr instanceof Expr.Subshell subshell) {
      return formatSubshell(mode, subshell);
    } else if (expr instanceof Expr.Pipe pipe) {
      return format(mode, pipe.left(), hereDocs) + " | " + format(mode, pipe.right(), hereDocs);
    } else if (expr instanceof Expr.And and) {
      return format(mode, and.left(), hereDocs) + " && " + format(mode, and.right(), hereDocs);
    } else if (expr instanceof Expr.Or or) {
      return format(mode, or.left(), hereDocs) + " || " + format(mode, or.right(), hereDocs);
    } else if (expr instanceof Expr.Redir redir) {
      return formatRedir(mode, redir, hereDocs);
    }
    throw new AssertionError(expr);
  }

  /** Each element of the body is complete, including its own here-document bodies. */
  private static String formatSubshell(Mode mode, Expr.Subshell subshell) {
    String prefix = subshell.prefix();
    List<Expr> body = Expr.indentAll(subshell.body());
    if (body.isEmpty()) {
      // "()" is a syntax error.
      body = ImmutableList.<Expr>of(Expr.cmd(":").indent());
    }
    Iterable<String> lines = body.stream().map(e -> format(mode, e))::iterator;
    if (mode == Mode.MULTI_LINE) {
      return prefix + "(\n" + NEWLINE_JOINER.join(lines) + "\n" + prefix + ")";
    } else {
      return prefix + "(" + Joiner.on(';').join(lines) + prefix + ")";
    }
  }

  private static String formatRedir(Mode mode, Expr.Redir redir, List<String> hereDocs) {
    RedirSpec spec = redir.spec();
    if (spec instanceof RedirSpec.HereDoc hereDoc) {
      return formatHereDoc(mode, redir.expr(), hereDoc.text(), hereDocs);
    }
    String target;
    if (spec instanceof RedirSpec.ToFile toFile) {
      target = fd(toFile.fd(), RedirSpec.STDOUT) + "> " + Quote.quote(toFile.path()).text();
    } else if (spec instanceof RedirSpec.AppendToFile append) {
      target = fd(append.fd(), RedirSpec.STDOUT) + ">> " + Quote.quote(append.path()).text();
    } else if (spec instanceof RedirSpec.FromFile fromFile) {
      target = fd(fromFile.fd(), RedirSpec.STDIN) + "< " + Quote.quote(fromFile.path()).text();
    } else if (spec instanceof RedirSpec.DupOutput dup) {
      target = fd(dup.fd(), RedirSpec.STDOUT) + ">&" + dup.target();
    } else if (spec instanceof RedirSpec.DupInput dup) {
      target = fd(dup.fd(), RedirSpec.STDIN) + "<&" + dup.target();
    } else {
      throw new AssertionError(spec);
    }
    return formatRedirected(mode, redir.expr(), hereDocs) + " " + target;
  }

  /**
   * A redirection binds tighter than {@code |}, {@code &&} and {@code ||}, so a redirected
   * combination has to be grouped or the redirection would only apply to its last command.
   */
  private static String formatRedirected(Mode mode, Expr expr, List<String> hereDocs) {
    String text = format(mode, expr, hereDocs);
    if (isCombination(expr)) {
      // Keep any indentation in front of the parenthesis.
      int start = Math.max(0, INDENTATION.negate().indexIn(text));
      return text.substring(0, start) + "(" + text.substring(start) + ")";
    }
    return text;
  }

  private static boolean isCombination(Expr expr) {
    return expr instanceof Expr.Pipe || expr instanceof Expr.And || expr instanceof Expr.Or;
  }

  /**
   * In multi-line mode the operator {@code <<EOF} stays on the line and the text, followed by the
   * marker, is added to {@code hereDocs}. A here-document can't be written on a single line, so in
   * that mode
   *
   * <pre>{@code cmd <<EOF ... EOF}</pre>
   *
   * is rendered as
   *
   * <pre>{@code (echo line1; echo line2; ...) | cmd}</pre>
   */
  private static String formatHereDoc(Mode mode, Expr expr, String text, List<String> hereDocs) {
    if (mode == Mode.MULTI_LINE) {
      String marker = eofMarker(text);
      // Bodies to the left of this operator come first.
      String line = formatRedirected(mode, expr, hereDocs) + " <<" + marker;
      hereDocs.add(text + "\n" + marker);
      return line;
    }
    // The here-document supplies text + "\n", so a trailing newline in text is its own
    // (empty) line.
    ImmutableList<Expr> echoes =
        Streams.stream(LINE_SPLITTER.split(text))
            .<Expr>map(line -> Expr.cmd("echo " + Quote.quote(line).text()))
            .collect(ImmutableList.toImmutableList());
    // Every command of a combination reads the here-document's input, so it is grouped.
    Expr reader = isCombination(expr) ? Expr.subshell(ImmutableList.of(expr)) : expr;
    return format(mode, new Expr.Pipe(Expr.subshell(echoes), reader), hereDocs);
  }

  /**
   * Returns the text to put before a redirection operator for {@code fd}; empty if {@code fd} is
   * the operator's default.
   */
  private static String fd(int fd, int defaultFd) {
    return (fd == defaultFd) ? "" : String.valueOf(fd);
  }

  /**
   * Returns a marker for the end of a here-document that does not appear anywhere in {@code
   * text}: the first of {@code EOF}, {@code EOF2}, {@code EOF3}, ... that isn't a substring.
   */
  public static String eofMarker(String text) {
    String marker = EOF;
    for (int n = 2; text.contains(marker); n++) {
      marker = EOF + n;
    }
    return marker;
  }
}
