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

package com.facebook.xcodegen.log;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;

import java.io.IOException;
import java.util.logging.Level;
import org.junit.Test;

public class LogConfigTest {

  @Test
  public void templateCarriesConsoleLevel() throws IOException {
    String properties = LogConfig.renderTemplate(Level.FINE);

    assertThat(properties, containsString("java.util.logging.ConsoleHandler.level = FINE"));
    assertThat(properties, containsString(".level = INFO"));
    assertThat(
        properties,
        containsString(
            "java.util.logging.ConsoleHandler.formatter = " + LogFormatter.class.getName()));
  }
}
