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

import com.dd.plist.NSArray;
import com.dd.plist.NSDictionary;
import com.dd.plist.NSString;
import com.facebook.xcodegen.apple.FileTypes;
import com.facebook.xcodegen.apple.xcode.XcodeprojSerializer;
import com.facebook.xcodegen.model.DeploymentTarget;
import com.google.common.base.Preconditions;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Table;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/** The root object of a project file. */
public class PBXProject extends PBXObject {

  /** Name of the group holding the product references of the targets. */
  public static final String PRODUCTS_GROUP_NAME = "Products";

  private static final String COMPATIBILITY_VERSION = "Xcode 3.2";
  private static final String LAST_UPGRADE_CHECK = "0830";
  private static final String LOCALIZATION_DIRECTORY_EXTENSION = ".lproj";

  private final String name;
  private final PBXGroup mainGroup;
  private final XCConfigurationList buildConfigurationList;
  private final Map<String, PBXTarget> targetsByName = new LinkedHashMap<>();

  /** Test target to the host application it runs in. */
  private final Map<PBXTarget, PBXTarget> testTargetLinkages = new LinkedHashMap<>();

  private final Table<PBXObject, PBXContainerItemProxy.ProxyType, PBXTargetDependency>
      targetDependencies = HashBasedTable.create();

  @Nullable private String lastSwiftUpdateCheck;

  public PBXProject(String name) {
    this(name, new PBXGroup("mainGroup", null, SourceTree.SOURCE_ROOT, null));
  }

  /** Creates a project whose file paths are resolved against {@code mainGroup}. */
  public PBXProject(String name, PBXGroup mainGroup) {
    this.name = Preconditions.checkNotNull(name);
    this.mainGroup = Preconditions.checkNotNull(mainGroup);
    this.mainGroup.setSerializesName(true);
    this.buildConfigurationList = new XCConfigurationList(isa(), name);
  }

  @Override
  public String isa() {
    return "PBXProject";
  }

  @Override
  public int stableHash() {
    return name.hashCode();
  }

  @Override
  public String getComment() {
    return "Project object";
  }

  public String getName() {
    return name;
  }

  public PBXGroup getMainGroup() {
    return mainGroup;
  }

  public XCConfigurationList getBuildConfigurationList() {
    return buildConfigurationList;
  }

  /** Records the Xcode version of the last Swift migration check, e.g. {@code 0710}. */
  public void setLastSwiftUpdateCheck(@Nullable String lastSwiftUpdateCheck) {
    this.lastSwiftUpdateCheck = lastSwiftUpdateCheck;
  }

  public ImmutableList<PBXTarget> getTargets() {
    return ImmutableList.copyOf(targetsByName.values());
  }

  public Optional<PBXTarget> getTargetByName(String targetName) {
    return Optional.ofNullable(targetsByName.get(targetName));
  }

  /**
   * Creates a native target and its product reference in the {@code Products} group. The product
   * is a build output, so it is not marked as an input file.
   */
  public PBXNativeTarget createNativeTarget(
      String targetName, @Nullable DeploymentTarget deploymentTarget, ProductType productType) {
    PBXNativeTarget target = new PBXNativeTarget(targetName, productType);
    target.setDeploymentTarget(deploymentTarget);
    targetsByName.put(targetName, target);

    PBXGroup productsGroup = getProductsGroup();
    PBXFileReference productReference =
        productsGroup.getOrCreateFileReferenceBySourceTreePath(
            new SourceTreePath(
                SourceTree.BUILT_PRODUCTS_DIR, productType.getProductName(targetName)));
    productReference.setFileTypeOverride(productType.getExplicitFileType());
    productReference.setInputFile(false);
    target.setProductReference(productReference);
    return target;
  }

  public PBXLegacyTarget createLegacyTarget(
      String targetName,
      String buildToolPath,
      String buildArgumentsString,
      String buildWorkingDirectory) {
    PBXLegacyTarget target =
        new PBXLegacyTarget(targetName, buildToolPath, buildArgumentsString, buildWorkingDirectory);
    targetsByName.put(targetName, target);
    return target;
  }

  /**
   * Adds a reference to a build byproduct that is not the main output of any target, under the
   * {@code Products} group.
   */
  public PBXFileReference createProductReference(String path) {
    return createGroupsAndFileReferenceForPath(path, getProductsGroup());
  }

  private PBXGroup getProductsGroup() {
    PBXGroup productsGroup = mainGroup.getOrCreateChildGroupByName(PRODUCTS_GROUP_NAME);
    productsGroup.setSerializesName(true);
    return productsGroup;
  }

  /** Makes {@code testTarget} run inside {@code hostTarget} and depend on it. */
  public void linkTestTarget(PBXTarget testTarget, PBXTarget hostTarget) {
    testTargetLinkages.put(testTarget, hostTarget);
    testTarget.createDependencyOn(
        hostTarget, PBXContainerItemProxy.ProxyType.TARGET_REFERENCE, this);
  }

  public ImmutableList<PBXTarget> getLinkedTestTargetsForHost(PBXTarget host) {
    ImmutableList.Builder<PBXTarget> tests = ImmutableList.builder();
    for (Map.Entry<PBXTarget, PBXTarget> linkage : testTargetLinkages.entrySet()) {
      if (linkage.getValue() == host) {
        tests.add(linkage.getKey());
      }
    }
    return tests.build();
  }

  public Optional<PBXTarget> getLinkedHostForTestTarget(PBXTarget testTarget) {
    return Optional.ofNullable(testTargetLinkages.get(testTarget));
  }

  /**
   * Returns the dependency on {@code target} through a proxy of the given type, creating it on
   * first use. Every target depending on the same target shares the returned instance.
   */
  public PBXTargetDependency createTargetDependency(
      PBXTarget target, PBXContainerItemProxy.ProxyType proxyType) {
    PBXTargetDependency dependency = targetDependencies.get(target, proxyType);
    if (dependency == null) {
      dependency = new PBXTargetDependency(new PBXContainerItemProxy(this, target, proxyType));
      targetDependencies.put(target, proxyType, dependency);
    }
    return dependency;
  }

  /**
   * Creates groups and file references for input files at the given workspace relative paths.
   * Directory components become nested groups under the main group.
   */
  public ImmutableList<PBXFileReference> getOrCreateGroupsAndFileReferencesForPaths(
      Iterable<String> paths) {
    ImmutableList.Builder<PBXFileReference> references = ImmutableList.builder();
    for (String path : paths) {
      PBXFileReference reference = createGroupsAndFileReferenceForPath(path, mainGroup);
      reference.setInputFile(true);
      references.add(reference);
    }
    return references.build();
  }

  /** Returns the group for a directory path, or the main group for the empty path. */
  public PBXGroup getOrCreateGroupForPath(String path) {
    if (path.isEmpty()) {
      return mainGroup;
    }
    return mainGroup.getOrCreateDescendantGroupByPath(path);
  }

  public XCVersionGroup getOrCreateVersionGroupForPath(String path, String versionGroupType) {
    int slash = path.lastIndexOf('/');
    PBXGroup group = getOrCreateGroupForPath(slash < 0 ? "" : path.substring(0, slash));
    String versionGroupName = FileTypes.getLastPathComponent(path);
    return group.getOrCreateChildVersionGroupByName(
        versionGroupName, versionGroupName, versionGroupType);
  }

  /**
   * Walks the components of {@code path} below {@code parent}, creating a group for each
   * directory and a file reference for the last component.
   *
   * <p>Directories that Xcode treats as files, such as {@code .xcassets}, end the walk: the
   * reference is created for the directory itself. Files inside a {@code <locale>.lproj} directory
   * are collected in a variant group named after the file, with one child per locale.
   */
  public PBXFileReference createGroupsAndFileReferenceForPath(String path, PBXGroup parent) {
    String[] components = path.split("/", -1);
    PBXGroup group = parent;
    for (int i = 0; i < components.length - 1; i++) {
      String component = components[i];
      Optional<String> bundleType = FileTypes.getDirectoryUniformTypeIdentifier(component);
      if (bundleType.isPresent()) {
        PBXFileReference reference =
            group.getOrCreateFileReferenceBySourceTreePath(
                new SourceTreePath(SourceTree.GROUP, component));
        reference.setFileTypeOverride(bundleType.get());
        return reference;
      }
      if (i == components.length - 2 && component.endsWith(LOCALIZATION_DIRECTORY_EXTENSION)) {
        String fileName = components[i + 1];
        String locale =
            component.substring(0, component.length() - LOCALIZATION_DIRECTORY_EXTENSION.length());
        return group
            .getOrCreateChildVariantGroupByName(fileName)
            .getOrCreateVariantFileReferenceByNameAndSourceTreePath(
                locale, new SourceTreePath(SourceTree.GROUP, component + "/" + fileName));
      }
      String groupName = component.isEmpty() ? "/" : component;
      group = group.getOrCreateChildGroupByName(groupName, component);
    }
    return group.getOrCreateFileReferenceBySourceTreePath(
        new SourceTreePath(SourceTree.GROUP, components[components.length - 1]));
  }

  @Override
  public void serializeInto(XcodeprojSerializer s) {
    super.serializeInto(s);

    NSDictionary attributes = new NSDictionary();
    attributes.put("LastUpgradeCheck", LAST_UPGRADE_CHECK);
    if (lastSwiftUpdateCheck != null) {
      attributes.put("LastSwiftUpdateCheck", lastSwiftUpdateCheck);
    }
    NSDictionary targetAttributes = new NSDictionary();
    for (Map.Entry<PBXTarget, PBXTarget> linkage : testTargetLinkages.entrySet()) {
      String testTargetId = s.serializeObject(linkage.getKey(), true);
      String hostTargetId = s.serializeObject(linkage.getValue(), true);
      NSDictionary testAttributes = new NSDictionary();
      testAttributes.put("TestTargetID", hostTargetId);
      targetAttributes.put(testTargetId, testAttributes);
    }
    if (!targetAttributes.isEmpty()) {
      attributes.put("TargetAttributes", targetAttributes);
    }
    s.addField("attributes", attributes);

    s.addField("buildConfigurationList", buildConfigurationList);
    s.addField("compatibilityVersion", COMPATIBILITY_VERSION);
    s.addField("mainGroup", mainGroup);

    List<PBXTarget> sortedTargets = new ArrayList<>(targetsByName.values());
    sortedTargets.sort(Comparator.comparing(PBXTarget::getName));
    s.addField("targets", sortedTargets);

    // Defaults Xcode writes for every project.
    s.addField("developmentRegion", "English");
    s.addField("hasScannedForEncodings", false);
    s.addField("knownRegions", new NSArray(new NSString("en")));
  }
}
