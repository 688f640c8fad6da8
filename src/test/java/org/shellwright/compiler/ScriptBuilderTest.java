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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Joiner;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.shellwright.code.Renderer;
import org.shellwright.compiler.ScriptBuilder.Direction;
import org.shellwright.compiler.ScriptBuilder.Greediness;
import org.shellwright.util.Quote;
import org.shellwright.util.Quoted;

/** Tests for the commands and variable operations of {@link ScriptBuilder}. */
@RunWith(JUnit4.class)
public class ScriptBuilderTest {

  /** Returns the expected multi-line rendering of a script with the given lines. */
  static String lines(String... lines) {
    return "#!/bin/sh\n" + Joiner.on('\n').join(lines) + "\n";
  }

  @Test
  public void run() {
    assertThat(Script.linearScript(sb -> sb.run("echo", "hello, world")))
        .isEqualTo("echo 'hello, world'");
    assertThat(Script.linearScript(sb -> sb.run("ls"))).isEqualTo("ls");
  }

  @Test
  public void readAndEcho() {
    String script =
        Script.script(
            sb -> {
              Var<String> name = sb.newVar("name");
              sb.readVar(name);
              sb.cmd("echo", "hello", name);
            });
    assertThat(script).isEqualTo(lines("_name=", "read _name", "echo hello \"$_name\""));
  }

  @Test
  public void cmdParams() {
    assertThat(Script.linearScript(sb -> sb.cmd("exit", 3))).isEqualTo("exit 3");
    assertThat(Script.linearScript(sb -> sb.cmd("echo", Param.val("a*b"), Param.text("a*b"))))
        .isEqualTo("echo a*b 'a*b'");
    ScriptError e =
        assertThrows(
            ScriptError.class, () -> Script.linearScript(sb -> sb.cmd("echo", new Object())));
    assertThat(e).hasMessageThat().contains("Object");
  }

  @Test
  public void comment() {
    assertThat(Script.script(sb -> sb.comment("step one"))).isEqualTo(lines("# step one"));
    assertThat(Script.linearScript(sb -> sb.comment("step one"))).isEqualTo(": 'step one'");
  }

  @Test
  public void newVarContaining() {
    assertThat(Script.linearScript(sb -> sb.newVarContaining("foo bar", "s")))
        .isEqualTo("_s='foo bar'");
    assertThat(Script.linearScript(sb -> sb.newVarContaining(17, null))).isEqualTo("_v=17");
  }

  @Test
  public void globalVar() {
    Step.Built<Var<String>> built =
        ((Step<Var<String>>)
                sb -> {
                  Var<String> path = sb.globalVar("PATH");
                  sb.cmd("echo", path);
                  return path;
                })
            .run(new Env());
    assertThat(built.result().name()).isEqualTo("PATH");
    assertThat(built.env().contains(Env.Kind.VARIABLE, "PATH")).isTrue();
    assertThat(Renderer.linear(built.exprs())).isEqualTo("echo \"$PATH\"");
  }

  @Test
  public void parameters() {
    assertThat(
            Script.linearScript(
                sb -> {
                  Var<String> file = sb.takeParameter("file");
                  sb.cmd("echo", file, Var.positionalParameters());
                }))
        .isEqualTo("_file=\"$1\"; shift; echo \"$_file\" \"$@\"");
  }

  @Test
  public void defaultWhenErrUnless() {
    assertThat(
            Script.linearScript(
                sb -> {
                  Var<String> name = sb.newVar("name");
                  sb.cmd("echo", sb.defaultVar(name, "bar"));
                  sb.cmd("echo", sb.whenVar(name, "x y"));
                  Var<String> v = sb.newVar();
                  sb.cmd("echo", sb.errUnlessVar(v, "missing value"));
                }))
        .isEqualTo(
            "_name=; echo \"${_name:-bar}\"; echo \"${_name:+\"x y\"}\"; _v=; "
                + "echo \"${_v:?\"missing value\"}\"");
  }

  @Test
  public void defaultWordsAreDoubleQuoted() {
    assertThat(
            Script.linearScript(
                sb -> {
                  Var<String> e = sb.newVar("e");
                  sb.cmd("echo", sb.defaultVar(e, "it's $x"));
                  sb.cmd("echo", sb.whenVar(e, ""));
                }))
        .isEqualTo("_e=; echo \"${_e:-\"it's \\$x\"}\"; echo \"${_e:+\"\"}\"");
  }

  @Test
  public void defaultCanBeAnotherVar() {
    assertThat(
            Script.linearScript(
                sb -> {
                  Var<String> a = sb.newVar("a");
                  Var<String> b = sb.newVar("b");
                  sb.cmd("echo", sb.defaultVar(a, b));
                }))
        .isEqualTo("_a=; _b=; echo \"${_a:-\"$_b\"}\"");
  }

  @Test
  public void trimVar() {
    assertThat(
            Script.linearScript(
                sb -> {
                  Var<String> f = sb.newVar("f");
                  Quoted slash = Quote.glob("*/");
                  Quoted a = Quote.quote("a");
                  sb.cmd(
                      "echo",
                      sb.trimVar(
                          Greediness.SHORTEST_MATCH, Direction.FROM_END, f, Quote.glob("*.txt")));
                  sb.cmd(
                      "echo",
                      sb.trimVar(
                          Greediness.LONGEST_MATCH, Direction.FROM_BEGINNING, f, slash));
                  sb.cmd(
                      "echo",
                      sb.trimVar(
                          Greediness.SHORTEST_MATCH, Direction.FROM_BEGINNING, f, a));
                  sb.cmd(
                      "echo",
                      sb.trimVar(
                          Greediness.LONGEST_MATCH, Direction.FROM_END, f, a));
                }))
        .isEqualTo(
            "_f=; echo \"${_f%*\\.txt}\"; echo \"${_f##*\\/}\"; echo \"${_f#a}\"; "
                + "echo \"${_f%%a}\"");
  }

  @Test
  public void invalidModifications() {
    assertThrows(
        ScriptError.class,
        () ->
            Script.script(
                sb ->
                    sb.trimVar(
                        Greediness.SHORTEST_MATCH,
                        Direction.FROM_END,
                        Var.positionalParameters(),
                        Quote.quote("x"))));
    ScriptError twice =
        assertThrows(
            ScriptError.class,
            () ->
                Script.script(
                    sb -> {
                      Var<String> v = sb.newVar("v");
                      sb.defaultVar(sb.defaultVar(v, "a"), "b");
                    }));
    assertThat(twice).hasMessageThat().isEqualTo("Cannot modify '_v2(modified)'");
    assertThrows(
        ScriptError.class,
        () ->
            Script.script(
                sb -> {
                  Var<String> v = sb.newVar();
                  sb.setVar(sb.defaultVar(v, "a"), "b");
                }));
    ScriptError positional =
        assertThrows(
            ScriptError.class,
            () -> Script.script(sb -> sb.setVar(Var.positionalParameters(), "b")));
    assertThat(positional).hasMessageThat().isEqualTo("Cannot assign to '@'");
    assertThrows(
        ScriptError.class, () -> Script.script(sb -> sb.readVar(Var.positionalParameters())));
  }

  @Test
  public void lengthOfPositionalParameters() {
    assertThat(
            Script.linearScript(sb -> sb.cmd("echo", sb.lengthVar(Var.positionalParameters()))))
        .isEqualTo("echo \"$#\"");
  }

  @Test
  public void lengthVar() {
    assertThat(
            Script.script(
                sb -> {
                  Var<String> s = sb.newVar("s");
                  sb.cmd("echo", sb.lengthVar(s));
                }))
        .isEqualTo(
            lines("_s=", "_tmp=", "echo \"${_tmp:-\"$(_tmp=\"$_s\"; echo \"${#_tmp}\")\"}\""));
  }

  @Test
  public void withVar() {
    assertThat(
            Script.linearScript(
                sb -> {
                  Var<String> name = sb.newVar("name");
                  sb.cmd("rmdir", name.with(q -> Quote.quote("/home/").concat(q)));
                }))
        .isEqualTo("_name=; rmdir '/home/'\"$_name\"");
  }

  @Test
  public void output() {
    assertThat(Script.linearScript(sb -> sb.cmd("echo", new Output(b -> b.cmd("whoami")))))
        .isEqualTo("echo \"$(whoami)\"");
    assertThat(
            Script.linearScript(
                sb ->
                    sb.cmd(
                        "echo",
                        new Output(
                            b -> b.pipe(c -> c.cmd("cat", "/etc/passwd"), c -> c.cmd("wc"))))))
        .isEqualTo("echo \"$(cat '/etc/passwd' | wc)\"");
  }

  @Test
  public void namesAllocatedInsideOutputAreNotReused() {
    assertThat(
            Script.linearScript(
                sb -> {
                  sb.cmd("echo", new Output(b -> b.newVarContaining("x", "t")));
                  sb.newVar("t");
                }))
        .isEqualTo("echo \"$(_t=x)\"; _t2=");
  }

  @Test
  public void arithmetic() {
    assertThat(Script.linearScript(sb -> sb.cmd("echo", Arith.plus(Arith.num(1), Arith.num(2)))))
        .isEqualTo("echo \"$(((1 + 2)))\"");
    assertThat(
            Script.linearScript(
                sb -> {
                  Var<Long> n = sb.newVarContaining(4L, "n");
                  sb.setVar(n, Arith.mult(Arith.var(n), Arith.var(n)));
                }))
        .isEqualTo("_n=4; _n=\"$((($_n * $_n)))\"");
  }
}
