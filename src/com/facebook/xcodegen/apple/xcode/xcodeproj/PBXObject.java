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
import javax.annotation.Nullable;

/** Base of every object that appears in the {@code objects} table of a project file. */
public abstract class PBXObject {

  @Nullable private String globalID;

  @Nullable
  public String getGlobalID() {
    return globalID;
  }

  public void setGlobalID(String gid) {
    globalID = gid;
  }

  /** The type tag written as {@code isa}. */
  public abstract String isa();

  /**
   * A hash that only depends on the object's identifying fields, so that the same project input
   * produces the same global IDs on every run.
   */
  public abstract int stableHash();

  /** Text written next to references to this object, or null for none. */
  @Nullable
  public String getComment() {
    return null;
  }

  public void serializeInto(XcodeprojSerializer s) {}

  @Override
  public String toString() {
    return String.format("%s isa=%s gid=%s", super.toString(), isa(), getGlobalID());
  }
}
