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

/** Points at a target or a file, possibly in another project. */
public class PBXContainerItemProxy extends PBXObject {

  /** The kind of object the proxy refers to. */
  public enum ProxyType {
    /** A target in some project file. */
    TARGET_REFERENCE(1),
    /** A file reference in another project file, i.e. an output of one of its targets. */
    FILE_REFERENCE(2),
    ;

    private final int intValue;

    ProxyType(int intValue) {
      this.intValue = intValue;
    }

    public int getIntValue() {
      return intValue;
    }
  }

  private final PBXProject containerPortal;
  private final PBXObject remoteObject;
  private final ProxyType proxyType;

  public PBXContainerItemProxy(
      PBXProject containerPortal, PBXObject remoteObject, ProxyType proxyType) {
    this.containerPortal = Preconditions.checkNotNull(containerPortal);
    this.remoteObject = Preconditions.checkNotNull(remoteObject);
    this.proxyType = Preconditions.checkNotNull(proxyType);
  }

  public PBXProject getContainerPortal() {
    return containerPortal;
  }

  public PBXObject getRemoteObject() {
    return remoteObject;
  }

  public ProxyType getProxyType() {
    return proxyType;
  }

  @Override
  public String isa() {
    return "PBXContainerItemProxy";
  }

  @Override
  public int stableHash() {
    return remoteObject.stableHash() + proxyType.getIntValue();
  }

  @Override
  public String getComment() {
    return "PBXContainerItemProxy";
  }

  @Override
  public void serializeInto(XcodeprojSerializer s) {
    super.serializeInto(s);
    s.addField("containerPortal", containerPortal);
    s.addField("proxyType", proxyType.getIntValue());
    s.addRawIdField("remoteGlobalIDString", remoteObject);
  }
}
