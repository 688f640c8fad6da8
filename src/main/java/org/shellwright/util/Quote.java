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

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

/** Static methods for turning arbitrary text into shell-safe {@link Quoted} text. */
public class Quote {

  /** Characters that never need quoting. */
  private static final CharMatcher BARE =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.is('_'))
          .precomputed();

  private static final CharMatcher ALPHANUMERIC =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .precomputed();

  /** Characters that are still special inside double quotes. */
  private static final CharMatcher DOUBLE_QUOTE_SPECIAL = CharMatcher.anyOf("$`\"\\");

  /** Characters that keep their meaning in a glob; see {@link #glob}. */
  private static final CharMatcher GLOB_SPECIAL = CharMatcher.anyOf("*?[!-:]\\");

  private static final Splitter ON_SINGLE_QUOTE = Splitter.on('\'');

  /** Closes the current single-quoted run, emits a double-quoted {@code '}, and reopens it. */
  private static final Joiner QUOTE_JOINER = Joiner.on("'\"'\"'");

  /**
   * Returns a single shell word that expands to exactly {@code text}.
   *
   * <p>Non-empty text made only of ASCII letters, digits and underscores is returned as-is;
   * everything else is wrapped in single quotes, with any embedded single quote spliced in from
   * a double-quoted string.
   */
  public static Quoted quote(String text) {
    if (!text.isEmpty() && BARE.matchesAllOf(text)) {
      return Quoted.unsafe(text);
    }
    return Quoted.unsafe("'" + QUOTE_JOINER.join(ON_SINGLE_QUOTE.split(text)) + "'");
  }

  /**
   * Returns {@code text} in double quotes, with {@code $}, {@code `}, {@code "} and {@code \}
   * backslash-escaped. Unlike {@link #quote} the result keeps its value when nested inside another
   * double-quoted word, such as the default of {@code "${name:-...}"}.
   */
  public static Quoted doubleQuote(String text) {
    StringBuilder sb = new StringBuilder(text.length() + 8).append('"');
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (DOUBLE_QUOTE_SPECIAL.matches(c)) {
        sb.append('\\');
      }
      sb.append(c);
    }
    return Quoted.unsafe(sb.append('"').toString());
  }

  /**
   * Treats {@code pattern} as a glob. ASCII letters and digits and the wildcard characters {@code
   * *?[!-:]\} are passed through; every other character is backslash-escaped, so that e.g. spaces
   * may appear in a glob without splitting it.
   *
   * <p>The pattern is assumed to be well formed; nothing checks that brackets are balanced.
   */
  public static Quoted glob(String pattern) {
    StringBuilder sb = new StringBuilder(pattern.length() + 8);
    for (int i = 0; i < pattern.length(); i++) {
      char c = pattern.charAt(i);
      if (!ALPHANUMERIC.matches(c) && !GLOB_SPECIAL.matches(c)) {
        sb.append('\\');
      }
      sb.append(c);
    }
    return Quoted.unsafe(sb.toString());
  }

  private Quote() {}
}
