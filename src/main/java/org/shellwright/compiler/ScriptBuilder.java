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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;
import org.shellwright.code.Expr;
import org.shellwright.code.IgnoreFailure;
import org.shellwright.code.RedirSpec;
import org.shellwright.code.Renderer;
import org.shellwright.util.Quote;
import org.shellwright.util.Quoted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A ScriptBuilder accumulates the {@link Expr}s emitted by a sequence of {@link Step}s, and owns
 * the {@link Env} that those steps allocate names from.
 *
 * <p>Combinators such as {@link #forCmd} and {@link #ifCmd} run their sub-scripts with {@link
 * #capture}, which gives the sub-script a new ScriptBuilder sharing this one's Env; the captured
 * Exprs are then embedded (usually indented) in the Exprs this builder emits. Because the Env is
 * shared, a name allocated inside a loop body or function body can never be allocated again
 * anywhere else in the script.
 */
public final class ScriptBuilder {

  private static final Logger logger = LoggerFactory.getLogger(ScriptBuilder.class);

  private final Env env;
  private final List<Expr> exprs = new ArrayList<>();

  ScriptBuilder(Env env) {
    this.env = checkNotNull(env);
  }

  public Env env() {
    return env;
  }

  /** Returns the Exprs emitted so far. */
  public ImmutableList<Expr> exprs() {
    return ImmutableList.copyOf(exprs);
  }

  /** Adds an Expr to the script. */
  public void add(Expr expr) {
    exprs.add(checkNotNull(expr));
  }

  private void addAll(List<? extends Expr> list) {
    list.forEach(this::add);
  }

  /** Runs {@code step} as part of this script, and returns its result. */
  @CanIgnoreReturnValue
  public <T> T include(Step<T> step) {
    return step.build(this);
  }

  /**
   * Runs {@code script} using this builder's Env and returns the Exprs it emits, without adding
   * them to this script. Any names it allocates remain allocated.
   */
  public ImmutableList<Expr> capture(Script script) {
    ScriptBuilder nested = new ScriptBuilder(env);
    script.emit(nested);
    return nested.exprs();
  }

  /** Returns the Exprs emitted by {@code script}, rendered as a single line. */
  private String captureLinear(Script script) {
    return Renderer.linear(capture(script));
  }

  // Commands and comments

  /** Adds a command; the command and each of the args is quoted. */
  public void run(String command, String... args) {
    add(
        Expr.cmd(
            Stream.concat(Stream.of(command), Arrays.stream(args))
                .map(s -> Quote.quote(s).text())
                .collect(Collectors.joining(" "))));
  }

  /**
   * Adds a command. The command and each param may be anything accepted by {@link Param#of}: plain
   * strings are quoted, Vars are expanded, and so on. For example
   *
   * <pre>{@code
   * Var<String> echo = sb.newVarContaining("echo", null);
   * sb.cmd(echo, "hi");
   * }</pre>
   */
  public void cmd(Object command, Object... params) {
    StringBuilder text = new StringBuilder(Param.of(command).toText(env));
    for (Object param : params) {
      text.append(' ').append(Param.of(param).toText(env));
    }
    add(Expr.cmd(text.toString()));
  }

  /** Adds a comment to the generated script. */
  public void comment(String text) {
    add(Expr.comment(text));
  }

  // Variables

  /**
   * Allocates a new variable name but emits nothing; for use when the caller will emit code that is
   * guaranteed to set the variable before it is read.
   */
  <T> Var<T> newVarUnsafe(@Nullable String hint) {
    return Var.simple(env.allocate(Env.Kind.VARIABLE, hint));
  }

  /** Defines a new, empty shell variable with a unique name. */
  @CanIgnoreReturnValue
  public <T> Var<T> newVar() {
    return newVar(null);
  }

  /**
   * Defines a new, empty shell variable. The name will contain the letters of {@code hint}, but is
   * modified as needed to be unique.
   */
  @CanIgnoreReturnValue
  public <T> Var<T> newVar(@Nullable String hint) {
    Var<T> var = newVarUnsafe(hint);
    add(Expr.cmd(var.name() + "="));
    return var;
  }

  /** Defines a new shell variable, initialized to {@code String.valueOf(value)}. */
  @CanIgnoreReturnValue
  public <T> Var<T> newVarContaining(T value, @Nullable String hint) {
    Var<T> var = newVarUnsafe(hint);
    add(Expr.cmd(var.name() + "=" + Quote.quote(String.valueOf(value)).text()));
    return var;
  }

  /** Sets {@code var} to the value of {@code param} (converted as by {@link Param#of}). */
  public void setVar(Var<?> var, Object param) {
    checkAssignable(var);
    add(Expr.cmd(var.name() + "=" + Param.of(param).toText(env)));
  }

  /** Reads a line from standard input into {@code var}. */
  public void readVar(Var<String> var) {
    checkAssignable(var);
    add(Expr.cmd("read " + Quote.quote(var.name()).text()));
  }

  private static void checkAssignable(Var<?> var) {
    if (var.isSpecial() || var.isModified()) {
      throw ScriptError.cannotAssign(var);
    }
  }

  /**
   * Returns a Var for an existing variable that this script did not define, such as {@code PATH}.
   * The name is recorded so that no allocated variable will use it.
   */
  public <T> Var<T> globalVar(String name) {
    env.reserve(Env.Kind.VARIABLE, name);
    return Var.simple(name);
  }

  /**
   * Removes the first positional parameter and returns a new Var holding it. If there are no
   * positional parameters left, the generated script will fail at that point.
   */
  public <T> Var<T> takeParameter(@Nullable String hint) {
    Var<T> var = newVarUnsafe(hint);
    add(Expr.cmd(var.name() + "=\"$1\""));
    add(Expr.cmd("shift"));
    return var;
  }

  public <T> Var<T> takeParameter() {
    return takeParameter(null);
  }

  /**
   * Returns a new Var whose expansion is {@code ${<expansion>}}, where {@code expansion} is
   * computed from the name of {@code var}. The new Var's own name is freshly allocated (so it
   * can't collide with anything) but is never assigned.
   */
  private <U> Var<U> modVar(Var<?> var, Function<Env, String> expansion) {
    Var<U> derived = newVarUnsafe(var.name());
    return derived.withExpander((e, unused) -> Quoted.unsafe("${" + expansion.apply(e) + "}"));
  }

  private <U> Var<U> modVar(String operator, Var<?> var, Param param) {
    if (var.isModified()) {
      throw ScriptError.cannotModify(var);
    }
    return modVar(var, e -> var.name() + operator + param.toText(e));
  }

  /**
   * Converts the word of a {@code :-}, {@code :+} or {@code :?} expansion. The word is inside the
   * expansion's double quotes, where single quotes are literal, so plain strings that need quoting
   * are double-quoted instead.
   */
  private static Param nestedWord(Object param) {
    if (param instanceof String s) {
      Quoted quoted = Quote.quote(s);
      return Param.quoted(quoted.text().equals(s) ? quoted : Quote.doubleQuote(s));
    }
    return Param.of(param);
  }

  /**
   * Returns a Var that expands to the same thing as {@code var} unless that is empty, in which
   * case it expands to {@code param} ({@code ${var:-param}}).
   */
  public <T> Var<T> defaultVar(Var<T> var, Object param) {
    return modVar(":-", var, nestedWord(param));
  }

  /**
   * Returns a Var that expands to nothing if {@code var} is empty, and to {@code param} otherwise
   * ({@code ${var:+param}}).
   */
  public <T> Var<T> whenVar(Var<T> var, Object param) {
    return modVar(":+", var, nestedWord(param));
  }

  /**
   * Returns a Var that expands to the same thing as {@code var}; but if {@code var} is empty,
   * expanding it makes the shell exit with {@code param} as the error message ({@code
   * ${var:?param}}).
   */
  public <T> Var<T> errUnlessVar(Var<T> var, Object param) {
    return modVar(":?", var, nestedWord(param));
  }

  /**
   * Returns a Var that expands to the length of the expansion of {@code var}. For {@link
   * Var#positionalParameters} that is the number of parameters ({@code $#}).
   */
  public Var<Long> lengthVar(Var<?> var) {
    if (var.name().equals(Var.POSITIONAL)) {
      return Var.simple(Var.COUNT);
    }
    // ${#...} only accepts a plain name, so the expansion of var (which may itself be modified)
    // is copied into an always-empty temporary inside a command substitution:
    //   ${_tmp:-"$(_tmp="$var"; echo "${#_tmp}")"}
    Var<String> tmp = newVar("tmp");
    Var<String> tmpLength =
        tmp.withExpander((e, name) -> Quoted.unsafe("${#" + name + "}"));
    Output length =
        new Output(
            sb -> {
              sb.setVar(tmp, var);
              sb.cmd("echo", tmpLength);
            });
    return modVar(tmp, e -> tmp.name() + ":-" + length.toText(e));
  }

  /** Which part of a variable {@link #trimVar} removes. */
  public enum Greediness {
    SHORTEST_MATCH,
    LONGEST_MATCH
  }

  /** Which end of a variable {@link #trimVar} removes from. */
  public enum Direction {
    FROM_BEGINNING,
    FROM_END
  }

  /**
   * Returns a Var that expands to the value of {@code var} with text matching {@code pattern}
   * removed from the beginning or the end. If {@code pattern} came from {@link Quote#glob} it may
   * match in several ways, and {@code greediness} chooses the shortest or longest match.
   *
   * <p>The trimmed value may hold a different kind of value than {@code var}, e.g. a number.
   */
  public <T> Var<T> trimVar(
      Greediness greediness, Direction direction, Var<String> var, Quoted pattern) {
    if (var.isSpecial()) {
      throw ScriptError.format("Cannot trim '%s', which is not a single value", var);
    }
    String operator =
        switch (direction) {
          case FROM_BEGINNING -> (greediness == Greediness.SHORTEST_MATCH) ? "#" : "##";
          case FROM_END -> (greediness == Greediness.SHORTEST_MATCH) ? "%" : "%%";
        };
    Var<String> trimmed = modVar(operator, var, Param.quoted(pattern));
    return trimmed.castUnsafe();
  }

  // Functions and control flow

  /**
   * Emits {@code word :} followed by the indented Exprs of {@code body}. The no-op {@code :}
   * ensures that the block is never empty, and lets it be joined into a single line the same way
   * whether or not the body has any Exprs.
   */
  private void block(String word, Script body) {
    add(Expr.cmd(word + " :"));
    addAll(Expr.indentAll(capture(body)));
  }

  /**
   * Defines a shell function and returns a Func that can be used to call it. The function's name
   * is unique among the script's functions and contains the letters of {@code hint}.
   *
   * <p>For example:
   *
   * <pre>{@code
   * Func hohoho =
   *     sb.func(
   *         "hohoho",
   *         b -> {
   *           Var<String> num = b.takeParameter();
   *           b.forCmd(c -> c.cmd("seq", "1", num), n -> c -> c.cmd("echo", "Ho, ho, ho!"));
   *         });
   * sb.include(hohoho.call(1));
   * }</pre>
   */
  public Func func(@Nullable String hint, Script body) {
    String name = env.allocate(Env.Kind.FUNCTION, hint);
    logger.debug("Defining function {}", name);
    ImmutableList<Expr> definition = capture(body);
    add(Expr.cmd(name + " () { :"));
    addAll(Expr.indentAll(definition));
    add(Expr.cmd("}"));
    return new Func(name);
  }

  public Func func(Script body) {
    return func(null, body);
  }

  /**
   * Runs {@code source} and splits its output into words (using IFS), then runs {@code action}
   * once for each word, passing it a Var holding the word.
   */
  public <T> void forCmd(Script source, Function<? super Var<T>, ? extends Script> action) {
    Var<T> var = newVarUnsafe("x");
    String words = captureLinear(source);
    add(Expr.cmd("for " + var.name() + " in $(" + words + ")"));
    block("do", action.apply(var));
    add(Expr.cmd("done"));
  }

  /**
   * Runs {@code body} repeatedly as long as {@code cond} succeeds. The condition is run in a
   * command substitution, so it is written on the {@code while} line in either rendering mode.
   */
  public void whileCmd(Script cond, Script body) {
    add(Expr.cmd("while $(" + captureLinear(cond) + ")"));
    block("do", body);
    add(Expr.cmd("done"));
  }

  /** Runs {@code thenBody} if {@code cond} exits 0, else {@code elseBody}. */
  public void ifCmd(Script cond, Script thenBody, Script elseBody) {
    ifCmd(
        "if ",
        cond,
        () -> {
          block("then", thenBody);
          block("else", elseBody);
        });
  }

  /** Runs {@code body} if {@code cond} exits 0. */
  public void whenCmd(Script cond, Script body) {
    ifCmd("if ", cond, () -> block("then", body));
  }

  /** Runs {@code body} if {@code cond} exits nonzero. */
  public void unlessCmd(Script cond, Script body) {
    ifCmd("if ! ", cond, () -> block("then", body));
  }

  private void ifCmd(String leader, Script cond, Runnable blocks) {
    ImmutableList<Expr> condExprs = capture(cond);
    Expr test;
    if (condExprs.size() == 1
        && (condExprs.get(0) instanceof Expr.Cmd || condExprs.get(0) instanceof Expr.Subshell)) {
      test = condExprs.get(0);
    } else {
      test = Expr.subshell(condExprs);
    }
    add(Expr.cmd(leader + Renderer.format(Renderer.Mode.SINGLE_LINE, test)));
    blocks.run();
    add(Expr.cmd("fi"));
  }

  /** One alternative of a {@link #caseOf}. */
  public record Branch(Quoted pattern, Script body) {
    public Branch {
      checkNotNull(pattern);
      checkNotNull(body);
    }
  }

  /**
   * Matches the value of {@code var} against the pattern of each branch in turn (a pattern may
   * come from {@link Quote#glob}) and runs the body of the first that matches. Emits nothing if
   * there are no branches.
   *
   * <p>The case statement is laid out so that it works when rendered on a single line as well:
   *
   * <pre>
   * case "$foo" in ook) :
   *     echo got ook
   * : ;; *) :
   *     echo default
   * : ;; esac
   * </pre>
   */
  public void caseOf(Var<?> var, List<Branch> branches) {
    if (branches.isEmpty()) {
      return;
    }
    String leader = "case " + var.toText(env) + " in ";
    for (Branch branch : branches) {
      add(Expr.cmd(leader + branch.pattern().text() + ") :"));
      addAll(Expr.indentAll(capture(branch.body())));
      leader = ": ;; ";
    }
    add(Expr.cmd(": ;; esac"));
  }

  public void caseOf(Var<?> var, Branch... branches) {
    caseOf(var, Arrays.asList(branches));
  }

  // Error handling

  /**
   * By default a shell script keeps running after a command exits nonzero; {@code
   * stopOnFailure(true)} ({@code set -e}) makes it exit instead.
   */
  public void stopOnFailure(boolean stop) {
    add(Expr.cmd(stop ? "set -e" : "set +e"));
  }

  /** Adds the Exprs of {@code script}, rewritten so that a nonzero exit status is ignored. */
  public void ignoreFailure(Script script) {
    addAll(IgnoreFailure.rewrite(capture(script)));
  }

  // Combining scripts

  /** Pipes the output of {@code a} to {@code b}. */
  public void pipe(Script a, Script b) {
    add(new Expr.Pipe(Expr.single(capture(a)), Expr.single(capture(b))));
  }

  /** {@code a && b} */
  public void and(Script a, Script b) {
    add(new Expr.And(Expr.single(capture(a)), Expr.single(capture(b))));
  }

  /** {@code a || b} */
  public void or(Script a, Script b) {
    add(new Expr.Or(Expr.single(capture(a)), Expr.single(capture(b))));
  }

  // Redirection

  private void redirect(Script script, RedirSpec spec) {
    add(new Expr.Redir(Expr.single(capture(script)), spec));
  }

  /**
   * Redirects the standard output of {@code script} to a file, replacing it. For example, to shut
   * up a noisy command:
   *
   * <pre>{@code sb.toFile(b -> b.cmd("find", "/"), "/dev/null");}</pre>
   */
  public void toFile(Script script, String path) {
    toFile(script, RedirSpec.STDOUT, path);
  }

  public void toFile(Script script, int fd, String path) {
    redirect(script, new RedirSpec.ToFile(fd, path));
  }

  /** Appends the standard output of {@code script} to a file, which is created if necessary. */
  public void appendToFile(Script script, String path) {
    appendToFile(script, RedirSpec.STDOUT, path);
  }

  public void appendToFile(Script script, int fd, String path) {
    redirect(script, new RedirSpec.AppendToFile(fd, path));
  }

  /** Redirects the standard input of {@code script} from a file. */
  public void fromFile(Script script, String path) {
    fromFile(script, RedirSpec.STDIN, path);
  }

  public void fromFile(Script script, int fd, String path) {
    redirect(script, new RedirSpec.FromFile(fd, path));
  }

  /** Sends the standard output of {@code script} to standard error. */
  public void toStderr(Script script) {
    redirectOutput(script, RedirSpec.STDOUT, RedirSpec.STDERR);
  }

  /**
   * Makes output to {@code fd} go to {@code target} instead. For example, to send a command's
   * standard error to standard output:
   *
   * <pre>{@code sb.redirectOutput(b -> b.cmd("foo"), RedirSpec.STDERR, RedirSpec.STDOUT);}</pre>
   */
  public void redirectOutput(Script script, int fd, int target) {
    redirect(script, new RedirSpec.DupOutput(fd, target));
  }

  /** Makes input from {@code fd} come from {@code target} instead. */
  public void redirectInput(Script script, int fd, int target) {
    redirect(script, new RedirSpec.DupInput(fd, target));
  }

  /** Provides {@code text} as the standard input of {@code script}, using a here-document. */
  public void hereDocument(Script script, String text) {
    redirect(script, new RedirSpec.HereDoc(text));
  }
}
