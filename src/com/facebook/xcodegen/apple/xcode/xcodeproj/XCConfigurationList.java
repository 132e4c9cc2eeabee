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
import com.google.common.collect.ImmutableSortedMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/** The build configurations of a project or a target. */
public class XCConfigurationList extends PBXObject {

  private final Map<String, XCBuildConfiguration> buildConfigurations = new LinkedHashMap<>();
  @Nullable private final String comment;
  private boolean defaultConfigurationIsVisible;
  @Nullable private String defaultConfigurationName;

  public XCConfigurationList() {
    this.comment = null;
  }

  /** Creates the list owned by the object of type {@code ownerIsa} named {@code ownerName}. */
  public XCConfigurationList(String ownerIsa, String ownerName) {
    this.comment = String.format("Build configuration list for %s \"%s\"", ownerIsa, ownerName);
  }

  @Override
  public String isa() {
    return "XCConfigurationList";
  }

  @Override
  public int stableHash() {
    return comment == null ? 0 : comment.hashCode();
  }

  @Nullable
  @Override
  public String getComment() {
    return comment;
  }

  public XCBuildConfiguration getOrCreateBuildConfiguration(String name) {
    return buildConfigurations.computeIfAbsent(name, XCBuildConfiguration::new);
  }

  public Optional<XCBuildConfiguration> getBuildConfiguration(String name) {
    return Optional.ofNullable(buildConfigurations.get(name));
  }

  /** The configurations keyed and sorted by name. */
  public ImmutableSortedMap<String, XCBuildConfiguration> getBuildConfigurationsByName() {
    return ImmutableSortedMap.copyOf(buildConfigurations);
  }

  public void setDefaultConfigurationIsVisible(boolean defaultConfigurationIsVisible) {
    this.defaultConfigurationIsVisible = defaultConfigurationIsVisible;
  }

  public void setDefaultConfigurationName(@Nullable String defaultConfigurationName) {
    this.defaultConfigurationName = defaultConfigurationName;
  }

  @Override
  public void serializeInto(XcodeprojSerializer s) {
    super.serializeInto(s);
    s.addField("buildConfigurations", getBuildConfigurationsByName().values().asList());
    s.addField("defaultConfigurationIsVisible", defaultConfigurationIsVisible);
    s.addField("defaultConfigurationName", defaultConfigurationName);
  }
}
