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
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** Superclass for file references, groups and variant groups. */
public abstract class PBXReference extends PBXObject {

  private final String name;
  @Nullable private final String path;
  private final SourceTree sourceTree;

  /** Non-owning link to the group holding this reference; null for the main group. */
  @Nullable private final PBXGroup parent;

  private boolean serializesName;

  protected PBXReference(
      String name, @Nullable String path, SourceTree sourceTree, @Nullable PBXGroup parent) {
    this.name = Preconditions.checkNotNull(name);
    this.path = path;
    this.sourceTree = sourceTree;
    this.parent = parent;
  }

  public String getName() {
    return name;
  }

  @Nullable
  public String getPath() {
    return path;
  }

  public SourceTree getSourceTree() {
    return sourceTree;
  }

  @Nullable
  public PBXGroup getParent() {
    return parent;
  }

  public boolean getSerializesName() {
    return serializesName;
  }

  public void setSerializesName(boolean serializesName) {
    this.serializesName = serializesName;
  }

  public SourceTreePath getSourceTreePath() {
    return new SourceTreePath(sourceTree, Preconditions.checkNotNull(path));
  }

  /**
   * The path of this reference from the outermost group that has a path. Runs in time linear in
   * the depth of the reference.
   */
  public String getSourceRootRelativePath() {
    List<String> hierarchy = new ArrayList<>();
    hierarchy.add(Preconditions.checkNotNull(path));
    PBXGroup group = parent;
    while (group != null && group.getPath() != null) {
      hierarchy.add(group.getPath());
      group = group.getParent();
    }
    return Joiner.on('/').join(Lists.reverse(hierarchy));
  }

  @Override
  public int stableHash() {
    return name.hashCode() + (path == null ? 0 : path.hashCode());
  }

  @Override
  public String getComment() {
    return name;
  }

  @Override
  public void serializeInto(XcodeprojSerializer s) {
    super.serializeInto(s);
    if (serializesName) {
      s.addField("name", name);
    }
    s.addField("path", path);
    s.addField("sourceTree", sourceTree.toString());
  }
}
