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

import java.util.Optional;

/** Xcode product types, identified by their {@code com.apple.product-type.*} strings. */
public enum ProductType {
  STATIC_LIBRARY("com.apple.product-type.library.static", "archive.ar"),
  DYNAMIC_LIBRARY("com.apple.product-type.library.dynamic", "compiled.mach-o.dylib"),
  TOOL("com.apple.product-type.tool", "compiled.mach-o.executable"),
  BUNDLE("com.apple.product-type.bundle", "wrapper.bundle"),
  FRAMEWORK("com.apple.product-type.framework", "wrapper.framework"),
  STATIC_FRAMEWORK("com.apple.product-type.framework.static", "wrapper.framework.static"),
  APPLICATION("com.apple.product-type.application", "wrapper.application"),
  UNIT_TEST("com.apple.product-type.bundle.unit-test", "wrapper.cfbundle"),
  UI_TEST("com.apple.product-type.bundle.ui-testing", "wrapper.cfbundle"),
  IN_APP_PURCHASE_CONTENT("com.apple.product-type.in-app-purchase-content", "folder"),
  APP_EXTENSION("com.apple.product-type.app-extension", "wrapper.app-extension"),
  XPC_SERVICE("com.apple.product-type.xpc-service", "wrapper.xpc-service"),
  WATCH1_APPLICATION("com.apple.product-type.application.watchapp", "wrapper.application"),
  WATCH2_APPLICATION("com.apple.product-type.application.watchapp2", "wrapper.application"),
  WATCH1_EXTENSION("com.apple.product-type.watchkit-extension", "wrapper.app-extension"),
  WATCH2_EXTENSION("com.apple.product-type.watchkit2-extension", "wrapper.app-extension"),
  TV_APP_EXTENSION("com.apple.product-type.tv-app-extension", "wrapper.app-extension"),
  ;

  private final String identifier;
  private final String explicitFileType;

  ProductType(String identifier, String explicitFileType) {
    this.identifier = identifier;
    this.explicitFileType = explicitFileType;
  }

  public String getIdentifier() {
    return identifier;
  }

  /** The file type Xcode records for the product reference of a target of this type. */
  public String getExplicitFileType() {
    return explicitFileType;
  }

  public boolean isWatchApplication() {
    return this == WATCH1_APPLICATION || this == WATCH2_APPLICATION;
  }

  public boolean isTest() {
    return this == UNIT_TEST || this == UI_TEST;
  }

  /** The extension type paired with a watch application type. */
  public Optional<ProductType> getWatchApplicationExtensionType() {
    switch (this) {
      case WATCH1_APPLICATION:
        return Optional.of(WATCH1_EXTENSION);
      case WATCH2_APPLICATION:
        return Optional.of(WATCH2_EXTENSION);
      default:
        return Optional.empty();
    }
  }

  /** File name of the product built for a target with the given name. */
  public String getProductName(String name) {
    switch (this) {
      case STATIC_LIBRARY:
        return "lib" + name + ".a";
      case DYNAMIC_LIBRARY:
        return "lib" + name + ".dylib";
      case TOOL:
      case IN_APP_PURCHASE_CONTENT:
        return name;
      case BUNDLE:
        return name + ".bundle";
      case FRAMEWORK:
      case STATIC_FRAMEWORK:
        return name + ".framework";
      case APPLICATION:
      case WATCH2_APPLICATION:
        return name + ".app";
      case UNIT_TEST:
      case UI_TEST:
        return name + ".xctest";
      case WATCH1_APPLICATION:
        // watchOS 1 apps are packaged as extensions.
      case WATCH1_EXTENSION:
      case WATCH2_EXTENSION:
      case TV_APP_EXTENSION:
      case APP_EXTENSION:
        return name + ".appex";
      case XPC_SERVICE:
        return name + ".xpc";
    }
    throw new IllegalStateException("Unhandled product type " + this);
  }

  @Override
  public String toString() {
    return identifier;
  }
}
