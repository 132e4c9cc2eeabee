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
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** Runs a shell script as part of building a target. */
public class PBXShellScriptBuildPhase extends PBXBuildPhase {

  private final List<String> inputPaths = new ArrayList<>();
  private final List<String> outputPaths = new ArrayList<>();
  @Nullable private String name;
  private String shellPath = "/bin/sh";
  private String shellScript = "";
  private boolean showEnvVarsInLog;

  @Override
  public String isa() {
    return "PBXShellScriptBuildPhase";
  }

  @Override
  public int stableHash() {
    return shellPath.hashCode() + shellScript.hashCode();
  }

  @Override
  public String getComment() {
    return name == null ? "ShellScript" : name;
  }

  @Nullable
  public String getName() {
    return name;
  }

  public void setName(@Nullable String name) {
    this.name = name;
  }

  public List<String> getInputPaths() {
    return inputPaths;
  }

  public List<String> getOutputPaths() {
    return outputPaths;
  }

  public String getShellPath() {
    return shellPath;
  }

  public void setShellPath(String shellPath) {
    this.shellPath = shellPath;
  }

  public String getShellScript() {
    return shellScript;
  }

  public void setShellScript(String shellScript) {
    this.shellScript = shellScript;
  }

  public void setShowEnvVarsInLog(boolean showEnvVarsInLog) {
    this.showEnvVarsInLog = showEnvVarsInLog;
  }

  @Override
  public void serializeInto(XcodeprojSerializer s) {
    super.serializeInto(s);
    s.addField("name", name);
    s.addStringArrayField("inputPaths", inputPaths);
    s.addStringArrayField("outputPaths", outputPaths);
    s.addField("shellPath", shellPath);
    s.addField("shellScript", shellScript);
    s.addField("showEnvVarsInLog", showEnvVarsInLog);
  }
}
