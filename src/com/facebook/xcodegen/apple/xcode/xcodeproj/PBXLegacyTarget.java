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

package com.facebook.xcodegen.apple.xcode.xcodeproj;

import com.facebook.xcodegen.apple.xcode.XcodeprojSerializer;

/** A target that runs an external build tool instead of Xcode's own build system. */
public class PBXLegacyTarget extends PBXTarget {

  private final String buildToolPath;
  private final String buildArgumentsString;
  private final String buildWorkingDirectory;
  private boolean passBuildSettingsInEnvironment = true;

  public PBXLegacyTarget(
      String name,
      String buildToolPath,
      String buildArgumentsString,
      String buildWorkingDirectory) {
    super(name);
    this.buildToolPath = buildToolPath;
    this.buildArgumentsString = buildArgumentsString;
    this.buildWorkingDirectory = buildWorkingDirectory;
  }

  @Override
  public String isa() {
    return "PBXLegacyTarget";
  }

  public String getBuildToolPath() {
    return buildToolPath;
  }

  public String getBuildArgumentsString() {
    return buildArgumentsString;
  }

  public String getBuildWorkingDirectory() {
    return buildWorkingDirectory;
  }

  public void setPassBuildSettingsInEnvironment(boolean passBuildSettingsInEnvironment) {
    this.passBuildSettingsInEnvironment = passBuildSettingsInEnvironment;
  }

  @Override
  public void serializeInto(XcodeprojSerializer s) {
    super.serializeInto(s);
    s.addField("buildArgumentsString", buildArgumentsString);
    s.addField("buildToolPath", buildToolPath);
    s.addField("buildWorkingDirectory", buildWorkingDirectory);
    s.addField("passBuildSettingsInEnvironment", passBuildSettingsInEnvironment);
  }
}
