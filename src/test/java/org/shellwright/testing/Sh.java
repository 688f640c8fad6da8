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

package org.shellwright.testing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/** Runs generated scripts with {@code /bin/sh}, for tests that check what scripts actually do. */
public final class Sh {

  private static final Path SH = Path.of("/bin/sh");

  private Sh() {}

  /** True if there is a shell to run; tests should use this with {@code Assume}. */
  public static boolean available() {
    return Files.isExecutable(SH);
  }

  /** What a script wrote to standard output, and its exit status. */
  public record Result(int exitStatus, String stdout) {}

  /** Runs {@code script} with the given positional parameters and an empty standard input. */
  public static Result run(String script, String... args)
      throws IOException, InterruptedException {
    List<String> command = new ArrayList<>(List.of(SH.toString(), "-c", script, "sh"));
    command.addAll(Arrays.asList(args));
    Process process =
        new ProcessBuilder(command).redirectError(ProcessBuilder.Redirect.DISCARD).start();
    process.getOutputStream().close();
    String stdout;
    try (InputStream in = process.getInputStream()) {
      stdout = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
    if (!process.waitFor(10, TimeUnit.SECONDS)) {
      process.destroyForcibly();
      throw new AssertionError("Script timed out:\n" + script);
    }
    return new Result(process.exitValue(), stdout);
  }
}
