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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An Env records every shell variable name and function name that has been used so far while
 * building one script, so that newly-allocated names never collide with them.
 *
 * <p>An Env only grows; a name stays recorded even if the Exprs that used it are later discarded
 * (e.g. when a nested {@link Script} is run only to produce the text of a command substitution).
 *
 * <p>Each Env belongs to a single build and is threaded through it by {@link ScriptBuilder}; it is
 * not thread-safe.
 */
public final class Env {

  private static final Logger logger = LoggerFactory.getLogger(Env.class);

  /** Variables and functions are allocated from separate namespaces. */
  public enum Kind {
    VARIABLE("v"),
    FUNCTION("p");

    /** The seed used when no hint is given. */
    final String defaultSeed;

    Kind(String defaultSeed) {
      this.defaultSeed = defaultSeed;
    }
  }

  /** Only these characters of a name hint are kept. */
  private static final CharMatcher ALPHA =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z')).precomputed();

  /** The characters allowed in a shell name. */
  private static final CharMatcher NAME_CHARS =
      ALPHA.or(CharMatcher.inRange('0', '9')).or(CharMatcher.is('_')).precomputed();

  private final Set<String> vars = new LinkedHashSet<>();
  private final Set<String> funcs = new LinkedHashSet<>();

  /** Creates an empty Env, for the start of a new build. */
  public Env() {}

  private Set<String> names(Kind kind) {
    return (kind == Kind.VARIABLE) ? vars : funcs;
  }

  /**
   * Returns a name of the given kind that has not been used before in this Env, and records it.
   *
   * <p>The name is {@code "_"} followed by the letters of {@code hint} (or the kind's default seed
   * if {@code hint} is null), followed by a number if that is needed to make it unique: {@code
   * _foo}, then {@code _foo2}, {@code _foo3}, and so on.
   *
   * <p>A hint with no letters gives {@code _}, then {@code _2}. Bash sets {@code $_} after every
   * command, so a script meant to run under bash should pass hints that contain letters.
   */
  public String allocate(Kind kind, @Nullable String hint) {
    Set<String> used = names(kind);
    String base = "_" + ((hint == null) ? kind.defaultSeed : ALPHA.retainFrom(hint));
    String name = base;
    for (int attempt = 1; used.contains(name); attempt++) {
      name = base + (attempt + 1);
    }
    used.add(name);
    logger.trace("Allocated {} {}", kind, name);
    return name;
  }

  /**
   * Records a name that is used by the script without being allocated (e.g. {@code PATH}), so that
   * later allocations will avoid it. Returns false if it was already recorded.
   */
  @CanIgnoreReturnValue
  public boolean reserve(Kind kind, String name) {
    checkArgument(isValidName(name), "Not a valid shell name: '%s'", name);
    return names(kind).add(name);
  }

  /** Returns true if {@code name} has been allocated or reserved. */
  public boolean contains(Kind kind, String name) {
    return names(kind).contains(name);
  }

  /** Returns all the names of the given kind, in the order they were recorded. */
  public ImmutableSet<String> allNames(Kind kind) {
    return ImmutableSet.copyOf(names(kind));
  }

  /** Returns true if {@code name} can be used as a shell variable or function name. */
  static boolean isValidName(String name) {
    return !name.isEmpty()
        && !CharMatcher.inRange('0', '9').matches(name.charAt(0))
        && NAME_CHARS.matchesAllOf(name);
  }

  @Override
  public String toString() {
    return String.format("Env{vars=%s, funcs=%s}", vars, funcs);
  }
}
