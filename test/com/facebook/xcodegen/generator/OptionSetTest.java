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

package com.facebook.xcodegen.generator;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.facebook.xcodegen.util.json.ObjectMappers;
import java.io.IOException;
import java.util.Optional;
import org.junit.Test;

public class OptionSetTest {

  @Test
  public void defaultsApplyWithoutValues() {
    OptionSet options = new OptionSet();

    assertTrue(options.isEnabled(OptionKey.SUPPRESS_SWIFT_UPDATE_CHECK));
    assertThat(options.get(OptionKey.BAZEL_BUILD_OPTIONS_DEBUG), equalTo(Optional.empty()));
    assertThat(options.commonBuildSettings(), hasEntry("ALWAYS_SEARCH_USER_PATHS", "NO"));
    assertThat(options.commonBuildSettings(), hasEntry("CLANG_WARN_EMPTY_BODY", "YES"));
    assertThat(options.commonBuildSettings(), not(hasKey("CLANG_CXX_LANGUAGE_STANDARD")));
  }

  @Test
  public void targetValueOverridesProjectValue() {
    OptionSet options =
        new OptionSet()
            .setProjectValue(OptionKey.BAZEL_BUILD_OPTIONS_DEBUG, "--copt=-g")
            .setTargetValue(OptionKey.BAZEL_BUILD_OPTIONS_DEBUG, "//app:app", "--copt=-O0");

    assertThat(
        options.get(OptionKey.BAZEL_BUILD_OPTIONS_DEBUG, "//app:app"),
        equalTo(Optional.of("--copt=-O0")));
    assertThat(
        options.get(OptionKey.BAZEL_BUILD_OPTIONS_DEBUG, "//lib:lib"),
        equalTo(Optional.of("--copt=-g")));
  }

  @Test(expected = IllegalArgumentException.class)
  public void projectOnlyOptionsCanNotBeSetPerTarget() {
    new OptionSet().setTargetValue(OptionKey.SUPPRESS_SWIFT_UPDATE_CHECK, "//a:a", "NO");
  }

  @Test
  public void readsJson() throws IOException {
    OptionSet options =
        ObjectMappers.readValue(
            "{\"SuppressSwiftUpdateCheck\": {\"p\": \"NO\"},"
                + " \"CLANG_CXX_LANGUAGE_STANDARD\":"
                + " {\"p\": \"c++14\", \"t\": {\"Lib\": \"c++17\"}},"
                + " \"NotAnOption\": {\"p\": \"x\"}}",
            OptionSet.class);

    assertFalse(options.isEnabled(OptionKey.SUPPRESS_SWIFT_UPDATE_CHECK));
    assertThat(options.commonBuildSettings(), hasEntry("CLANG_CXX_LANGUAGE_STANDARD", "c++14"));
    assertThat(
        options.buildSettingsForTarget("Lib"), hasEntry("CLANG_CXX_LANGUAGE_STANDARD", "c++17"));
    assertThat(options.buildSettingsForTarget("Other").isEmpty(), equalTo(true));
  }

  @Test
  public void argumentsAreSplitOnSpaces() {
    OptionSet options =
        new OptionSet()
            .setProjectValue(
                OptionKey.PROJECT_GENERATION_BAZEL_STARTUP_OPTIONS,
                "--batch  --host_jvm_args=-Xmx1g");

    assertThat(
        options.getArguments(OptionKey.PROJECT_GENERATION_BAZEL_STARTUP_OPTIONS),
        contains("--batch", "--host_jvm_args=-Xmx1g"));
  }
}
