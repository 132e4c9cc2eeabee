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
import static org.hamcrest.Matchers.equalTo;

import com.facebook.xcodegen.model.BuildLabel;
import org.junit.Test;

public class BuildCommandlineTest {

  private static final BuildLabel APP = BuildLabel.of("//app:app");
  private static final String PREFIX =
      "\"build.py\" //app:app --bazel \"/usr/bin/bazel\" --bazel_bin_path \"bazel-bin\" --verbose ";

  private static String commandline(OptionSet options) {
    return new BuildCommandline("build.py", "/usr/bin/bazel", "bazel-bin", options).forTarget(APP);
  }

  @Test
  public void withoutOptions() {
    assertThat(commandline(new OptionSet()), equalTo(PREFIX));
  }

  @Test
  public void identicalValuesCollapse() {
    OptionSet options =
        new OptionSet()
            .setProjectValue(OptionKey.BAZEL_BUILD_OPTIONS_DEBUG, "--a")
            .setProjectValue(OptionKey.BAZEL_BUILD_OPTIONS_FASTBUILD, "--a")
            .setProjectValue(OptionKey.BAZEL_BUILD_OPTIONS_RELEASE, "--a");

    assertThat(commandline(options), equalTo(PREFIX + "--bazel_options --a -- "));
  }

  @Test
  public void differingValuesAreQualifiedPerConfiguration() {
    OptionSet options =
        new OptionSet()
            .setProjectValue(OptionKey.BAZEL_BUILD_OPTIONS_DEBUG, "--a")
            .setProjectValue(OptionKey.BAZEL_BUILD_OPTIONS_RELEASE, "--b");

    assertThat(
        commandline(options),
        equalTo(PREFIX + "--bazel_options[Debug] --a -- --bazel_options[Release] --b -- "));
  }

  @Test
  public void buildOptionsPrecedeStartupOptions() {
    OptionSet options =
        new OptionSet()
            .setProjectValue(OptionKey.BAZEL_BUILD_OPTIONS_DEBUG, "--x")
            .setProjectValue(OptionKey.BAZEL_BUILD_OPTIONS_FASTBUILD, "--x")
            .setProjectValue(OptionKey.BAZEL_BUILD_OPTIONS_RELEASE, "--x")
            .setProjectValue(OptionKey.BAZEL_BUILD_STARTUP_OPTIONS_DEBUG, "--s")
            .setProjectValue(OptionKey.BAZEL_BUILD_STARTUP_OPTIONS_FASTBUILD, "--s")
            .setProjectValue(OptionKey.BAZEL_BUILD_STARTUP_OPTIONS_RELEASE, "--s");

    assertThat(
        commandline(options),
        equalTo(PREFIX + "--bazel_options --x -- --bazel_startup_options --s -- "));
  }

  @Test
  public void targetSpecificValuesAreUsed() {
    OptionSet options =
        new OptionSet()
            .setTargetValue(OptionKey.BAZEL_BUILD_OPTIONS_DEBUG, "//app:app", "--t")
            .setTargetValue(OptionKey.BAZEL_BUILD_OPTIONS_DEBUG, "//other:other", "--o");

    assertThat(commandline(options), equalTo(PREFIX + "--bazel_options[Debug] --t -- "));
  }
}
