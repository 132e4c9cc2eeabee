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

/**
 * How the path of a {@link PBXReference} is interpreted. These correspond to the "Location" menu
 * in Xcode's file inspector.
 */
public enum SourceTree {
  /** Relative to the enclosing group. */
  GROUP("<group>"),
  ABSOLUTE("<absolute>"),
  BUILT_PRODUCTS_DIR("BUILT_PRODUCTS_DIR"),
  SDKROOT("SDKROOT"),
  /** Relative to the directory holding the project bundle. */
  SOURCE_ROOT("SOURCE_ROOT"),
  DEVELOPER_DIR("DEVELOPER_DIR"),
  ;

  private final String rep;

  SourceTree(String rep) {
    this.rep = rep;
  }

  @Override
  public String toString() {
    return rep;
  }
}
