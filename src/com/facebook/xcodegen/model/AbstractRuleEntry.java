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

package com.facebook.xcodegen.model;

import com.facebook.xcodegen.apple.xcode.xcodeproj.ProductType;
import com.facebook.xcodegen.util.immutables.XcodegenStyleImmutable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Everything the extractor reported about one Bazel target in one build configuration. The same
 * label may be described by several entries when it is built for several deployment targets.
 */
@Value.Immutable(prehash = true)
@XcodegenStyleImmutable
abstract class AbstractRuleEntry {

  public abstract BuildLabel getLabel();

  /** The Bazel rule type, e.g. {@code objc_library}. */
  public abstract String getType();

  @Value.Default
  public RuleAttributes getAttributes() {
    return RuleAttributes.builder().build();
  }

  /** Outputs of this rule. */
  public abstract ImmutableList<BazelFileInfo> getArtifacts();

  public abstract ImmutableList<BazelFileInfo> getSourceFiles();

  public abstract ImmutableList<BazelFileInfo> getNonARCSourceFiles();

  /** {@code .framework} bundles imported by this rule. */
  public abstract ImmutableList<BazelFileInfo> getFrameworkImports();

  /** Implicit outputs such as dSYM bundles. */
  public abstract ImmutableList<BazelFileInfo> getSecondaryArtifacts();

  public abstract ImmutableSet<BuildLabel> getDependencies();

  /**
   * Labels used only to expand aggregate rules like {@code test_suite}. These never become build
   * dependencies.
   */
  public abstract ImmutableSet<BuildLabel> getWeakDependencies();

  /** Extensions bundled by an application, e.g. the watch extension of a watch app. */
  public abstract ImmutableSet<BuildLabel> getExtensions();

  public abstract Optional<String> getBundleId();

  public abstract Optional<String> getBundleName();

  public abstract Optional<DeploymentTarget> getDeploymentTarget();

  /** Directories of generated headers that dependers need on their search path. */
  public abstract ImmutableList<IncludePath> getGeneratedIncludePaths();

  public abstract ImmutableList<String> getObjcDefines();

  public abstract ImmutableList<String> getSwiftDefines();

  public abstract ImmutableList<BazelFileInfo> getSwiftTransitiveModules();

  public abstract ImmutableList<BazelFileInfo> getObjcModuleMaps();

  public abstract Optional<String> getModuleName();

  /** The BUILD file declaring this rule, relative to the workspace root. */
  public abstract Optional<String> getBuildFilePath();

  public Optional<String> getSwiftLanguageVersion() {
    return getAttributes().getSwiftLanguageVersion();
  }

  public Optional<String> getSwiftToolchain() {
    return getAttributes().getSwiftToolchain();
  }

  public ImmutableSet<BuildLabel> getLinkedTargetLabels() {
    return getAttributes().getLinkedTargetLabels();
  }

  /** The Xcode product type of the target built for this rule, if it builds one. */
  @Value.Lazy
  public Optional<ProductType> getProductType() {
    // Non-XCTest ios_test rules (e.g. KIF) run as applications.
    if (RuleTypes.IOS_TEST.equals(getType())
        && getAttributes().getXctest().isPresent()
        && !getAttributes().getXctest().get()) {
      return RuleTypes.getProductType(RuleTypes.IOS_APPLICATION);
    }
    return RuleTypes.getProductType(getType());
  }

  /** The {@code SDKROOT} for the product target of this rule. */
  public Optional<String> getXcodeSdkRoot() {
    Optional<ProductType> productType = getProductType();
    if (!productType.isPresent()) {
      return Optional.empty();
    }
    // watchOS 1 apps build against the iphoneos SDK.
    if (productType.get() == ProductType.WATCH2_APPLICATION) {
      return Optional.of("watchos");
    }
    // tvOS and iOS apps share a product type, only the rule type tells them apart.
    if (productType.get() == ProductType.TV_APP_EXTENSION
        || RuleTypes.isTvosApplication(getType())) {
      return Optional.of("appletvos");
    }
    return Optional.of("iphoneos");
  }

  /** Files that need a project reference but are neither compiled nor versioned. */
  public ImmutableList<BazelFileInfo> getNormalNonSourceArtifacts() {
    ImmutableList.Builder<BazelFileInfo> artifacts = ImmutableList.builder();
    getAttributes().getLaunchStoryboard().ifPresent(artifacts::add);
    artifacts.addAll(getAttributes().getSupportingFiles());
    return artifacts.build();
  }

  /** Files that are shown as versioned groups, such as Core Data models. */
  public ImmutableList<BazelFileInfo> getVersionedNonSourceArtifacts() {
    return getAttributes().getDatamodels();
  }

  @Override
  public String toString() {
    return String.format("RuleEntry(%s %s)", getLabel(), getType());
  }
}
