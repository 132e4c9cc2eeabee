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
import com.google.common.base.Preconditions;

/** An edge from a target to the target its proxy refers to. */
public class PBXTargetDependency extends PBXObject {

  private final PBXContainerItemProxy targetProxy;

  public PBXTargetDependency(PBXContainerItemProxy targetProxy) {
    this.targetProxy = Preconditions.checkNotNull(targetProxy);
  }

  public PBXContainerItemProxy getTargetProxy() {
    return targetProxy;
  }

  @Override
  public String isa() {
    return "PBXTargetDependency";
  }

  @Override
  public int stableHash() {
    return targetProxy.stableHash();
  }

  @Override
  public String getComment() {
    return "PBXTargetDependency";
  }

  @Override
  public void serializeInto(XcodeprojSerializer s) {
    super.serializeInto(s);
    s.addField("targetProxy", targetProxy);
  }
}
