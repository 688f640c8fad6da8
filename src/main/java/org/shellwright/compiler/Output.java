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

import org.shellwright.code.Renderer;

/**
 * A Param for the output of a command (or of a more complicated Script), passed as a quoted
 * command substitution:
 *
 * <pre>{@code
 * sb.cmd("echo", "hello there,", new Output(b -> b.cmd("whoami")));
 * sb.cmd("echo", "root's pwent",
 *     new Output(b -> b.pipe(c -> c.cmd("cat", "/etc/passwd"), c -> c.cmd("grep", "root"))));
 * }</pre>
 */
public final class Output implements Param {
  private final Script script;

  public Output(Script script) {
    this.script = checkNotNull(script);
  }

  @Override
  public String toText(Env env) {
    return "\"$(" + Renderer.linear(script.run(env).exprs()) + ")\"";
  }
}
