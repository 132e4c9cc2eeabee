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
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.equalTo;

import com.facebook.xcodegen.model.BazelFileInfo;
import com.facebook.xcodegen.model.BuildLabel;
import com.facebook.xcodegen.model.IncludePath;
import com.facebook.xcodegen.model.RuleAttributes;
import com.facebook.xcodegen.model.RuleEntry;
import org.junit.Test;

public class CompileSettingsTest {

  @Test
  public void coptsAreSortedIntoDefinesIncludesAndFlags() {
    RuleEntry entry =
        RuleEntry.builder()
            .setLabel(BuildLabel.of("//lib:lib"))
            .setType("objc_library")
            .setAttributes(
                RuleAttributes.builder()
                    .addCopts("-DFOO=1", "-Ilib/private", "-I/usr/include", "-Wall")
                    .addDefines("BAR")
                    .build())
            .addObjcDefines("BAZ")
            .build();

    CompileSettings settings = CompileSettings.forRuleEntry(entry);

    assertThat(settings.getDefines(), containsInAnyOrder("FOO=1", "BAR", "BAZ"));
    assertThat(
        settings.getIncludes(),
        contains("$(TULSI_EXECUTION_ROOT)/lib/private", "/usr/include"));
    assertThat(settings.getOtherCFlags(), contains("-Wall"));
  }

  @Test
  public void generatedIncludesAreRootedByLocation() {
    RuleEntry entry =
        RuleEntry.builder()
            .setLabel(BuildLabel.of("//lib:lib"))
            .setType("objc_library")
            .addGeneratedIncludePaths(
                IncludePath.of("bazel-tulsi-includes/x/x/lib", false),
                IncludePath.of("external/dep/include", true),
                IncludePath.of("lib/include", false))
            .build();

    assertThat(
        CompileSettings.forRuleEntry(entry).getIncludes(),
        contains(
            "$(TULSI_EXECUTION_ROOT)/bazel-tulsi-includes/x/x/lib",
            "$(TULSI_OUTPUT_BASE)/external/dep/include/**",
            "$(TULSI_WR)/lib/include"));
  }

  @Test
  public void swiftSettingsComeFromModulesAndOptions() {
    RuleEntry entry =
        RuleEntry.builder()
            .setLabel(BuildLabel.of("//lib:swift"))
            .setType("swift_library")
            .setAttributes(
                RuleAttributes.builder().addSwiftcOpts("-Ivendor", "-warnings-as-errors").build())
            .addSwiftTransitiveModules(
                BazelFileInfo.generated("bazel-out/ios/bin", "dep/Dep.swiftmodule"))
            .addObjcModuleMaps(BazelFileInfo.generated("bazel-out/ios/bin", "c/module.modulemap"))
            .addSwiftDefines("DEBUG")
            .build();

    CompileSettings settings = CompileSettings.forRuleEntry(entry);

    assertThat(
        settings.getSwiftIncludePaths(),
        containsInAnyOrder(
            "$(TULSI_EXECUTION_ROOT)/vendor", "$(TULSI_EXECUTION_ROOT)/bazel-out/ios/bin/dep"));
    assertThat(
        settings.getOtherSwiftFlags(),
        contains(
            "-warnings-as-errors",
            "-Xcc -fmodule-map-file=$(TULSI_EXECUTION_ROOT)/bazel-out/ios/bin/c/module.modulemap",
            "-DDEBUG"));
  }

  @Test
  public void parentPathOfSingleComponentIsEmpty() {
    assertThat(CompileSettings.parentPath("a.m"), equalTo(""));
    assertThat(CompileSettings.parentPath("a/b/c.m"), equalTo("a/b"));
  }
}
