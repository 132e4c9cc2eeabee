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

/** Superclass of the build phases. Each phase holds the files it takes as input, in order. */
public abstract class PBXBuildPhase extends PBXObject {

  private final List<PBXBuildFile> files = new ArrayList<>();

  public List<PBXBuildFile> getFiles() {
    return files;
  }

  @Override
  public void serializeInto(XcodeprojSerializer s) {
    super.serializeInto(s);
    s.addField("buildActionMask", 0);
    s.addField("files", files);
    s.addField("runOnlyForDeploymentPostprocessing", false);
  }
}
