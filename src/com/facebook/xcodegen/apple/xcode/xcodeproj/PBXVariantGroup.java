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

import javax.annotation.Nullable;

/**
 * Groups the localized copies of one resource. The group is named after the resource and each
 * child is named after its locale, e.g. {@code en} with path {@code en.lproj/Main.strings}.
 */
public class PBXVariantGroup extends PBXGroup {

  public PBXVariantGroup(
      String name, @Nullable String path, SourceTree sourceTree, @Nullable PBXGroup parent) {
    super(name, path, sourceTree, parent);
  }

  @Override
  public String isa() {
    return "PBXVariantGroup";
  }

  public PBXFileReference getOrCreateVariantFileReferenceByNameAndSourceTreePath(
      String variantName, SourceTreePath sourceTreePath) {
    return getOrCreateFileReferenceBySourceTreePath(sourceTreePath, variantName);
  }
}
