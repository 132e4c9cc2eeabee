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
import com.dd.plist.NSObject;
import com.facebook.xcodegen.apple.xcode.XcodeprojSerializer;
import com.google.common.base.Preconditions;
import java.util.Map;
import java.util.Optional;

/**
 * A file in a build phase, with optional per-file settings such as {@code COMPILER_FLAGS}. The
 * same file reference may appear in several targets with different settings.
 */
public class PBXBuildFile extends PBXObject {

  private final PBXReference fileRef;
  private Optional<NSDictionary> settings = Optional.empty();

  public PBXBuildFile(PBXReference fileRef) {
    this.fileRef = Preconditions.checkNotNull(fileRef);
  }

  public PBXReference getFileRef() {
    return fileRef;
  }

  public Optional<NSDictionary> getSettings() {
    return settings;
  }

  public void setSettings(Optional<NSDictionary> settings) {
    this.settings = settings;
  }

  @Override
  public String isa() {
    return "PBXBuildFile";
  }

  @Override
  public int stableHash() {
    int hash = fileRef.stableHash();
    if (settings.isPresent()) {
      for (Map.Entry<String, NSObject> entry : settings.get().entrySet()) {
        hash += entry.getKey().hashCode() + entry.getValue().toJavaObject().hashCode();
      }
    }
    return hash;
  }

  @Override
  public String getComment() {
    PBXGroup parent = fileRef.getParent();
    if (parent != null) {
      return String.format("%s in %s", fileRef.getComment(), parent.getComment());
    }
    return fileRef.getComment();
  }

  @Override
  public void serializeInto(XcodeprojSerializer s) {
    super.serializeInto(s);
    s.addField("fileRef", fileRef);
    if (settings.isPresent()) {
      s.addField("settings", settings.get());
    }
  }
}
