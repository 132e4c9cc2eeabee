/*
 * Copyright (c) Facebook, Inc. and its affiliates.
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

package com.facebook.xcodegen.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

import org.junit.Test;

public class EscaperTest {

  @Test
  public void plainStringsAreLeftAlone() {
    assertThat(Escaper.escapeAsBashString("a.m"), equalTo("a.m"));
  }

  @Test
  public void stringsWithSpecialCharactersAreSingleQuoted() {
    assertThat(Escaper.escapeAsBashString("my file.m"), equalTo("'my file.m'"));
    assertThat(Escaper.escapeAsBashString("$HOME"), equalTo("'$HOME'"));
  }

  @Test
  public void embeddedSingleQuotesAreEscaped() {
    assertThat(Escaper.escapeAsBashString("it's"), equalTo("'it'\\''s'"));
  }

  @Test
  public void emptyStringBecomesEmptyQuotes() {
    assertThat(Escaper.escapeAsBashString(""), equalTo("''"));
  }
}
