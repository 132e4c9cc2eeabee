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
import com.facebook.xcodegen.log.Logger;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Information for building a specific artifact (a library, binary, or test). */
public abstract class PBXTarget extends PBXObject {

  private static final Logger LOG = Logger.get(PBXTarget.class);

  private final String name;
  private final List<PBXTargetDependency> dependencies = new ArrayList<>();
  private final Set<PBXTarget> buildActionDependencies = new LinkedHashSet<>();
  private final List<PBXBuildPhase> buildPhases = new ArrayList<>();
  private final XCConfigurationList buildConfigurationList;

  protected PBXTarget(String name) {
    this.name = Preconditions.checkNotNull(name);
    this.buildConfigurationList = new XCConfigurationList(isa(), name);
  }

  public String getName() {
    return name;
  }

  public String getProductName() {
    return name;
  }

  /** The main artifact of this target, usually the product name with an extension. */
  public String getBuildableName() {
    return name;
  }

  public ImmutableList<PBXTargetDependency> getDependencies() {
    return ImmutableList.copyOf(dependencies);
  }

  /** Targets that schemes must build along with this one without a true dependency edge. */
  public ImmutableSet<PBXTarget> getBuildActionDependencies() {
    return ImmutableSet.copyOf(buildActionDependencies);
  }

  public List<PBXBuildPhase> getBuildPhases() {
    return buildPhases;
  }

  public XCConfigurationList getBuildConfigurationList() {
    return buildConfigurationList;
  }

  /**
   * Makes this target depend on {@code target}. Dependencies are shared through the project's
   * proxy cache, so asking twice for the same dependency adds it once. A target never depends on
   * itself.
   *
   * @param first insert the dependency ahead of the existing ones
   */
  public void createDependencyOn(
      PBXTarget target,
      PBXContainerItemProxy.ProxyType proxyType,
      PBXProject project,
      boolean first) {
    if (target == this) {
      LOG.warn("Ignoring dependency of target %s on itself", name);
      return;
    }
    PBXTargetDependency dependency = project.createTargetDependency(target, proxyType);
    if (dependencies.contains(dependency)) {
      return;
    }
    if (first) {
      dependencies.add(0, dependency);
    } else {
      dependencies.add(dependency);
    }
  }

  public void createDependencyOn(
      PBXTarget target, PBXContainerItemProxy.ProxyType proxyType, PBXProject project) {
    createDependencyOn(target, proxyType, project, false);
  }

  /** Adds a dependency that only affects the build action of schemes, not the target graph. */
  public void createBuildActionDependencyOn(PBXTarget target) {
    buildActionDependencies.add(target);
  }

  @Override
  public int stableHash() {
    return name.hashCode() + getComment().hashCode();
  }

  @Override
  public String getComment() {
    return name;
  }

  @Override
  public void serializeInto(XcodeprojSerializer s) {
    super.serializeInto(s);
    s.addField("buildPhases", buildPhases);
    s.addField("buildConfigurationList", buildConfigurationList);
    s.addField("dependencies", dependencies);
    s.addField("name", name);
    s.addField("productName", getProductName());
  }
}
