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
import javax.annotation.Nullable;

/** A versioned group, such as a Core Data {@code .xcdatamodeld} bundle. */
public class XCVersionGroup extends PBXGroup {

  private final String versionGroupType;
  @Nullable private PBXReference currentVersion;

  public XCVersionGroup(
      String name,
      @Nullable String path,
      SourceTree sourceTree,
      @Nullable PBXGroup parent,
      String versionGroupType) {
    super(name, path, sourceTree, parent);
    this.versionGroupType = versionGroupType;
  }

  @Override
  public String isa() {
    return "XCVersionGroup";
  }

  public String getVersionGroupType() {
    return versionGroupType;
  }

  @Nullable
  public PBXReference getCurrentVersion() {
    return currentVersion;
  }

  /**
   * Marks the child file reference with the given group relative path as the active version.
   * Returns false if there is no such child.
   */
  public boolean setCurrentVersionByName(String name) {
    PBXFileReference reference =
        getFileReferenceBySourceTreePath(new SourceTreePath(SourceTree.GROUP, name));
    if (reference == null) {
      return false;
    }
    currentVersion = reference;
    return true;
  }

  @Override
  public void serializeInto(XcodeprojSerializer s) {
    super.serializeInto(s);
    s.addField("currentVersion", currentVersion);
    s.addField("versionGroupType", versionGroupType);
  }
}
