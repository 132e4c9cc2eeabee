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

package com.facebook.xcodegen.apple.xcode;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.matchesPattern;
import static org.hamcrest.Matchers.startsWith;

import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXBuildFile;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXFileReference;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXNativeTarget;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXProject;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXSourcesBuildPhase;
import com.facebook.xcodegen.apple.xcode.xcodeproj.ProductType;
import com.facebook.xcodegen.model.DeploymentTarget;
import com.facebook.xcodegen.model.DottedVersion;
import com.facebook.xcodegen.model.PlatformType;
import com.google.common.collect.ImmutableList;
import org.junit.Test;

public class XcodeprojSerializerTest {

  private static PBXProject createProject() {
    PBXProject project = new PBXProject("Sample");
    ImmutableList<PBXFileReference> references =
        project.getOrCreateGroupsAndFileReferencesForPaths(ImmutableList.of("lib/a.m", "lib/b.m"));
    PBXNativeTarget target =
        project.createNativeTarget(
            "Lib",
            DeploymentTarget.of(PlatformType.IOS, DottedVersion.of("10.0")),
            ProductType.STATIC_LIBRARY);
    PBXSourcesBuildPhase phase = new PBXSourcesBuildPhase();
    for (PBXFileReference reference : references) {
      phase.getFiles().add(new PBXBuildFile(reference));
    }
    target.getBuildPhases().add(phase);
    project.getBuildConfigurationList().getOrCreateBuildConfiguration("Debug");
    return project;
  }

  private static String serialize(PBXProject project) {
    return new XcodeprojSerializer(new GidGenerator(), project).toOpenStepString();
  }

  @Test
  public void writesBannerAndRootObject() {
    String contents = serialize(createProject());

    assertThat(contents, startsWith("// !$*UTF8*$!\n{\n\tarchiveVersion = 1;\n"));
    assertThat(contents, containsString("\tobjectVersion = 46;\n"));
    assertThat(
        contents,
        matchesPattern("(?s).*\trootObject = [0-9A-F]{24} /\\* Project object \\*/;\n}"));
    assertThat(contents, endsWith("}"));
  }

  @Test
  public void sectionsAppearInFixedOrder() {
    String contents = serialize(createProject());

    int buildFiles = contents.indexOf("/* Begin PBXBuildFile section */");
    int fileReferences = contents.indexOf("/* Begin PBXFileReference section */");
    int groups = contents.indexOf("/* Begin PBXGroup section */");
    int targets = contents.indexOf("/* Begin PBXNativeTarget section */");
    int configurations = contents.indexOf("/* Begin XCConfigurationList section */");
    assertThat(buildFiles, lessThan(fileReferences));
    assertThat(fileReferences, lessThan(groups));
    assertThat(groups, lessThan(targets));
    assertThat(targets, lessThan(configurations));
  }

  @Test
  public void fileReferencesAreWrittenOnOneLine() {
    String contents = serialize(createProject());

    assertThat(
        contents,
        matchesPattern(
            "(?s).*[0-9A-F]{24} /\\* a\\.m \\*/ = \\{isa = PBXFileReference; "
                + "lastKnownFileType = sourcecode\\.c\\.objc; path = a\\.m; "
                + "sourceTree = \"<group>\"; \\};.*"));
  }

  @Test
  public void outputIsDeterministic() {
    assertThat(serialize(createProject()), equalTo(serialize(createProject())));
  }

  @Test
  public void escapeQuotesOnlyWhenNeeded() {
    assertThat(XcodeprojSerializer.escape("lib/a.m"), equalTo("lib/a.m"));
    assertThat(XcodeprojSerializer.escape("$(SRCROOT)"), equalTo("\"$(SRCROOT)\""));
    assertThat(XcodeprojSerializer.escape("say \"hi\""), equalTo("\"say \\\"hi\\\"\""));
    assertThat(XcodeprojSerializer.escape(""), equalTo("\"\""));
  }
}
