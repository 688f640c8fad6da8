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

package org.shellwright.util;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Text that is safe to splice, unescaped, into shell source. Instances are only created by {@link
 * Quote} or by code that has already guaranteed the text is safe (see {@link #unsafe}).
 */
public final class Quoted {
  private final String text;

  private Quoted(String text) {
    this.text = checkNotNull(text);
  }

  /**
   * Wraps text that the caller has already made shell-safe. Nothing is checked; passing
   * unquoted user input here defeats the point of this class.
   */
  public static Quoted unsafe(String text) {
    return new Quoted(text);
  }

  /** Returns the shell source text. */
  public String text() {
    return text;
  }

  /** Returns a Quoted whose text is this one's followed by {@code other}'s. */
  public Quoted concat(Quoted other) {
    return new Quoted(text + other.text);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Quoted && text.equals(((Quoted) other).text);
  }

  @Override
  public int hashCode() {
    return text.hashCode();
  }

  @Override
  public String toString() {
    return text;
  }
}
