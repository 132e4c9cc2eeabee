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

import com.facebook.xcodegen.apple.FileTypes;
import com.facebook.xcodegen.apple.xcode.XcodeprojSerializer;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * A folder in the project navigator. Children are kept in creation order and written sorted by
 * name.
 *
 * <p>Each kind of child has its own index so that asking twice for the same child returns the same
 * object: groups, variant groups and version groups by name, file references by {@link
 * SourceTreePath}.
 */
public class PBXGroup extends PBXReference {

  private final List<PBXReference> children = new ArrayList<>();

  private final Map<String, PBXGroup> childGroupsByName = new HashMap<>();
  private final Map<String, PBXVariantGroup> childVariantGroupsByName = new HashMap<>();
  private final Map<String, XCVersionGroup> childVersionGroupsByName = new HashMap<>();
  private final Map<SourceTreePath, PBXFileReference> fileReferencesBySourceTreePath =
      new HashMap<>();

  public PBXGroup(
      String name, @Nullable String path, SourceTree sourceTree, @Nullable PBXGroup parent) {
    super(name, path, sourceTree, parent);
  }

  @Override
  public String isa() {
    return "PBXGroup";
  }

  public ImmutableList<PBXReference> getChildren() {
    return ImmutableList.copyOf(children);
  }

  /** Every file reference below this group, depth first. */
  public ImmutableList<PBXFileReference> getAllFileReferences() {
    ImmutableList.Builder<PBXFileReference> references = ImmutableList.builder();
    for (PBXReference child : children) {
      if (child instanceof PBXFileReference) {
        references.add((PBXFileReference) child);
      } else if (child instanceof PBXGroup) {
        references.addAll(((PBXGroup) child).getAllFileReferences());
      }
    }
    return references.build();
  }

  public PBXGroup getOrCreateChildGroupByName(String name) {
    return getOrCreateChildGroupByName(name, null);
  }

  public PBXGroup getOrCreateChildGroupByName(String name, @Nullable String path) {
    PBXGroup group = childGroupsByName.get(name);
    if (group == null) {
      group = new PBXGroup(name, path, SourceTree.GROUP, this);
      childGroupsByName.put(name, group);
      children.add(group);
    }
    return group;
  }

  /** Walks a {@code /} separated path, creating one group per component. */
  public PBXGroup getOrCreateDescendantGroupByPath(String path) {
    PBXGroup group = this;
    for (String component : path.split("/", -1)) {
      String groupName = component.isEmpty() ? "/" : component;
      group = group.getOrCreateChildGroupByName(groupName, component);
    }
    return group;
  }

  public PBXVariantGroup getOrCreateChildVariantGroupByName(String name) {
    PBXVariantGroup group = childVariantGroupsByName.get(name);
    if (group == null) {
      group = new PBXVariantGroup(name, null, SourceTree.GROUP, this);
      childVariantGroupsByName.put(name, group);
      children.add(group);
    }
    return group;
  }

  public XCVersionGroup getOrCreateChildVersionGroupByName(
      String name, @Nullable String path, String versionGroupType) {
    XCVersionGroup group = childVersionGroupsByName.get(name);
    if (group == null) {
      group = new XCVersionGroup(name, path, SourceTree.GROUP, this, versionGroupType);
      childVersionGroupsByName.put(name, group);
      children.add(group);
    }
    return group;
  }

  public PBXFileReference getOrCreateFileReferenceBySourceTreePath(SourceTreePath sourceTreePath) {
    return getOrCreateFileReferenceBySourceTreePath(
        sourceTreePath, FileTypes.getLastPathComponent(sourceTreePath.getPath()));
  }

  protected PBXFileReference getOrCreateFileReferenceBySourceTreePath(
      SourceTreePath sourceTreePath, String name) {
    PBXFileReference reference = fileReferencesBySourceTreePath.get(sourceTreePath);
    if (reference == null) {
      reference =
          new PBXFileReference(
              name, sourceTreePath.getPath(), sourceTreePath.getSourceTree(), this);
      fileReferencesBySourceTreePath.put(sourceTreePath, reference);
      children.add(reference);
    }
    return reference;
  }

  @Nullable
  public PBXFileReference getFileReferenceBySourceTreePath(SourceTreePath sourceTreePath) {
    return fileReferencesBySourceTreePath.get(sourceTreePath);
  }

  @Override
  public void serializeInto(XcodeprojSerializer s) {
    super.serializeInto(s);
    List<PBXReference> sortedChildren = new ArrayList<>(children);
    sortedChildren.sort(Comparator.comparing(PBXReference::getName));
    s.addField("children", sortedChildren);
  }
}
