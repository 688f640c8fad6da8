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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A RedirSpec describes how one file descriptor of a {@link Expr.Redir} is redirected. File paths
 * are quoted when rendered.
 */
public interface RedirSpec {

  int STDIN = 0;
  int STDOUT = 1;
  int STDERR = 2;

  /** {@code fd> path}: redirects {@code fd} to a file, replacing any existing contents. */
  record ToFile(int fd, String path) implements RedirSpec {
    public ToFile {
      checkFd(fd);
      checkNotNull(path);
    }
  }

  /** {@code fd>> path}: appends to a file, creating it if necessary. */
  record AppendToFile(int fd, String path) implements RedirSpec {
    public AppendToFile {
      checkFd(fd);
      checkNotNull(path);
    }
  }

  /** {@code fd< path}: reads {@code fd} from a file. */
  record FromFile(int fd, String path) implements RedirSpec {
    public FromFile {
      checkFd(fd);
      checkNotNull(path);
    }
  }

  /** {@code fd>&target}: makes output to {@code fd} go to {@code target}. */
  record DupOutput(int fd, int target) implements RedirSpec {
    public DupOutput {
      checkFd(fd);
      checkFd(target);
    }
  }

  /** {@code fd<&target}: makes input from {@code fd} come from {@code target}. */
  record DupInput(int fd, int target) implements RedirSpec {
    public DupInput {
      checkFd(fd);
      checkFd(target);
    }
  }

  /** Supplies {@code text} on standard input as a here-document. */
  record HereDoc(String text) implements RedirSpec {
    public HereDoc {
      checkNotNull(text);
    }
  }

  private static void checkFd(int fd) {
    checkArgument(fd >= 0, "Bad file descriptor %s", fd);
  }
}
