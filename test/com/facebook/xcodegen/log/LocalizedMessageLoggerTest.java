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
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;

import java.util.Locale;
import org.junit.Test;

public class LocalizedMessageLoggerTest {

  private final LocalizedMessageLogger logger = new LocalizedMessageLogger(Locale.ROOT);

  @Test
  public void warningIsFormattedFromTheBundle() {
    Diagnostic diagnostic = logger.warning("NoDeploymentTarget", "//a:a", "ios_min9.0");

    assertThat(diagnostic.getSeverity(), equalTo(Severity.WARNING));
    assertThat(diagnostic.getKey(), equalTo("NoDeploymentTarget"));
    assertThat(diagnostic.getValues(), contains("//a:a", "ios_min9.0"));
    assertThat(
        diagnostic.getMessage(),
        equalTo("Target //a:a has no deployment target; defaulting to ios_min9.0."));
  }

  @Test
  public void unknownKeyFallsBackToKeyAndValues() {
    assertThat(logger.error("NotAKey", "x", 1).getMessage(), equalTo("NotAKey: x, 1"));
  }

  @Test
  public void diagnosticsAreRecordedByKey() {
    logger.warning("UnknownTargetRule", "//b:b", "//a:a");
    logger.info("GeneratedProject", "out/P.xcodeproj");
    logger.warning("UnknownTargetRule", "//c:c", "//a:a");

    assertThat(logger.getDiagnostics(), hasSize(3));
    assertThat(logger.getDiagnostics("UnknownTargetRule"), hasSize(2));
  }
}
