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

package org.shellwright.tools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.shellwright.compiler.Arith;
import org.shellwright.compiler.Script;
import org.shellwright.compiler.Step;
import org.shellwright.compiler.Var;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A command-line tool that writes a shell script computing Fibonacci numbers; the script takes the
 * number of iterations as its only argument.
 *
 * <p>Set the system property {@code linear=true} to write the script as a single line.
 */
public class Fib {
  private static final Logger logger = LoggerFactory.getLogger(Fib.class);

  private Fib() {}

  /** The whole script: reads the parameter, computes, and echoes the result. */
  static Script script() {
    return sb -> {
      Var<Long> n = sb.takeParameter();
      Var<Long> result = sb.include(fib(n));
      sb.cmd("echo", result);
    };
  }

  /** Returns a Step that emits the loop and returns the Var holding the result. */
  static Step<Var<Long>> fib(Var<Long> n) {
    return sb -> {
      Var<Long> prev = sb.newVarContaining(1L, null);
      Var<Long> acc = sb.newVarContaining(1L, null);
      sb.forCmd(
          b -> b.cmd("seq", prev, n),
          unused ->
              b -> {
                b.setVar(acc, Arith.plus(Arith.var(acc), Arith.var(prev)));
                b.setVar(prev, Arith.minus(Arith.var(acc), Arith.var(prev)));
              });
      return acc;
    };
  }

  public static void main(String[] args) throws IOException {
    if (args.length != 1) {
      System.err.println("Use: fib <output.sh>");
      System.exit(1);
    }
    boolean linear = Boolean.parseBoolean(System.getProperty("linear", "false"));
    Path target = Path.of(args[0]);
    String text = linear ? Script.linearScript(script()) + "\n" : Script.script(script());
    Files.writeString(target, text);
    logger.info("Wrote {} script to {}", linear ? "single-line" : "multi-line", target);
  }
}
