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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assume.assumeTrue;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import junitparams.naming.TestCaseName;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.shellwright.testing.Sh;

@RunWith(JUnitParamsRunner.class)
public class QuoteTest {

  @Test
  public void bareWordsAreNotQuoted() {
    assertThat(Quote.quote("echo").text()).isEqualTo("echo");
    assertThat(Quote.quote("seq_2").text()).isEqualTo("seq_2");
  }

  @Test
  public void everythingElseIsSingleQuoted() {
    assertThat(Quote.quote("").text()).isEqualTo("''");
    assertThat(Quote.quote("hello, world").text()).isEqualTo("'hello, world'");
    assertThat(Quote.quote("$HOME").text()).isEqualTo("'$HOME'");
    assertThat(Quote.quote("-l").text()).isEqualTo("'-l'");
  }

  @Test
  public void embeddedSingleQuotes() {
    assertThat(Quote.quote("it's").text()).isEqualTo("'it'\"'\"'s'");
    assertThat(Quote.quote("'").text()).isEqualTo("''\"'\"''");
  }

  @Test
  public void glob() {
    assertThat(Quote.glob("*.txt").text()).isEqualTo("*\\.txt");
    assertThat(Quote.glob("my file[0-9]?").text()).isEqualTo("my\\ file[0-9]?");
    assertThat(Quote.glob("a$b").text()).isEqualTo("a\\$b");
    assertThat(Quote.glob("!:\\").text()).isEqualTo("!:\\");
  }

  @Test
  public void doubleQuote() {
    assertThat(Quote.doubleQuote("hello world").text()).isEqualTo("\"hello world\"");
    assertThat(Quote.doubleQuote("it's").text()).isEqualTo("\"it's\"");
    assertThat(Quote.doubleQuote("$x `y` \"z\" \\").text())
        .isEqualTo("\"\\$x \\`y\\` \\\"z\\\" \\\\\"");
    assertThat(Quote.doubleQuote("").text()).isEqualTo("\"\"");
  }

  private static Object[] awkwardText() {
    return new Object[] {
      new Object[] {"plain"},
      new Object[] {""},
      new Object[] {"two words"},
      new Object[] {"it's"},
      new Object[] {"\"double\" quotes"},
      new Object[] {"$HOME and ${PATH}"},
      new Object[] {"`uname`"},
      new Object[] {"back\\slash"},
      new Object[] {"tab\tand\nnewline"},
      new Object[] {"; rm -rf / #"},
      new Object[] {"*?[]"},
      new Object[] {"'\"'\"'"},
    };
  }

  /** The shell must see exactly the original text after expanding the quoted word. */
  @Test
  @Parameters(method = "awkwardText")
  @TestCaseName("roundTrip_{index}")
  public void roundTrip(String text) throws Exception {
    assumeTrue(Sh.available());
    Sh.Result result = Sh.run("printf '%s' " + Quote.quote(text).text());
    assertThat(result.exitStatus()).isEqualTo(0);
    assertThat(result.stdout()).isEqualTo(text);
  }

  @Test
  @Parameters(method = "awkwardText")
  @TestCaseName("doubleQuoteRoundTrip_{index}")
  public void doubleQuoteRoundTrip(String text) throws Exception {
    assumeTrue(Sh.available());
    Sh.Result result = Sh.run("printf '%s' " + Quote.doubleQuote(text).text());
    assertThat(result.exitStatus()).isEqualTo(0);
    assertThat(result.stdout()).isEqualTo(text);
  }
}
