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

import com.dd.plist.NSDictionary;
import com.facebook.xcodegen.apple.xcode.XcodeprojSerializer;
import com.google.common.base.Preconditions;
import javax.annotation.Nullable;

/** A named set of build settings, such as {@code Debug}. */
public class XCBuildConfiguration extends PBXObject {

  private final String name;
  private NSDictionary buildSettings;
  @Nullable private PBXFileReference baseConfigurationReference;

  public XCBuildConfiguration(String name) {
    this.name = Preconditions.checkNotNull(name);
    this.buildSettings = new NSDictionary();
  }

  @Override
  public String isa() {
    return "XCBuildConfiguration";
  }

  @Override
  public int stableHash() {
    return name.hashCode();
  }

  @Override
  public String getComment() {
    return name;
  }

  public String getName() {
    return name;
  }

  public NSDictionary getBuildSettings() {
    return buildSettings;
  }

  public void setBuildSettings(NSDictionary buildSettings) {
    this.buildSettings = Preconditions.checkNotNull(buildSettings);
  }

  @Nullable
  public PBXFileReference getBaseConfigurationReference() {
    return baseConfigurationReference;
  }

  public void setBaseConfigurationReference(PBXFileReference baseConfigurationReference) {
    this.baseConfigurationReference = baseConfigurationReference;
  }

  @Override
  public void serializeInto(XcodeprojSerializer s) {
    super.serializeInto(s);
    s.addField("name", name);
    // Xcode crashes on configurations without a buildSettings dictionary, even an empty one.
    s.addField("buildSettings", buildSettings);
    s.addField("baseConfigurationReference", baseConfigurationReference);
  }
}
