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
import com.facebook.xcodegen.apple.xcode.XcodeprojSerializer;
import com.facebook.xcodegen.model.DeploymentTarget;
import com.google.common.base.Preconditions;
import javax.annotation.Nullable;

/** A target that Xcode builds itself and that produces a product. */
public class PBXNativeTarget extends PBXTarget {

  private final ProductType productType;
  @Nullable private PBXFileReference productReference;
  @Nullable private DeploymentTarget deploymentTarget;

  public PBXNativeTarget(String name, ProductType productType) {
    super(name);
    this.productType = Preconditions.checkNotNull(productType);
  }

  @Override
  public String isa() {
    return "PBXNativeTarget";
  }

  public ProductType getProductType() {
    return productType;
  }

  @Override
  public String getBuildableName() {
    return productType.getProductName(getName());
  }

  @Nullable
  public PBXFileReference getProductReference() {
    return productReference;
  }

  public void setProductReference(PBXFileReference productReference) {
    this.productReference = productReference;
  }

  /** The platform and OS version this target builds for, if it is tied to one. */
  @Nullable
  public DeploymentTarget getDeploymentTarget() {
    return deploymentTarget;
  }

  public void setDeploymentTarget(@Nullable DeploymentTarget deploymentTarget) {
    this.deploymentTarget = deploymentTarget;
  }

  @Override
  public void serializeInto(XcodeprojSerializer s) {
    super.serializeInto(s);
    // Xcode always writes an empty buildRules list.
    s.addField("buildRules", new NSArray(0));
    s.addField("productReference", productReference);
    s.addField("productType", productType.getIdentifier());
  }
}
