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

package com.facebook.xcodegen.model;

import com.facebook.xcodegen.apple.xcode.xcodeproj.ProductType;
import com.google.common.collect.ImmutableMap;
import java.util.Optional;

/** Well known Bazel rule types and the Xcode product types they build. */
public final class RuleTypes {

  public static final String IOS_TEST = "ios_test";
  public static final String IOS_APPLICATION = "ios_application";
  public static final String TVOS_APPLICATION = "tvos_application";
  public static final String PRIVATE_TVOS_APPLICATION = "_tvos_application";
  public static final String SWIFT_LIBRARY = "swift_library";
  public static final String TEST_SUITE = "test_suite";
  public static final String FILEGROUP = "filegroup";

  /** A generic application used to host tests whose real host was not selected for generation. */
  public static final String TEST_HOST_PLACEHOLDER = "_test_host_";

  private static final ImmutableMap<String, ProductType> PRODUCT_TYPES =
      ImmutableMap.<String, ProductType>builder()
          .put("apple_ui_test", ProductType.UI_TEST)
          .put("apple_unit_test", ProductType.UNIT_TEST)
          .put("apple_watch1_extension", ProductType.WATCH1_APPLICATION)
          .put("apple_watch2_extension", ProductType.WATCH2_APPLICATION)
          .put("cc_library", ProductType.STATIC_LIBRARY)
          .put("ios_application", ProductType.APPLICATION)
          .put("ios_extension", ProductType.APP_EXTENSION)
          .put("ios_framework", ProductType.FRAMEWORK)
          .put("ios_test", ProductType.UNIT_TEST)
          .put("ios_ui_test", ProductType.UI_TEST)
          .put("ios_unit_test", ProductType.UNIT_TEST)
          .put("macos_application", ProductType.APPLICATION)
          .put("objc_binary", ProductType.APPLICATION)
          .put("objc_library", ProductType.STATIC_LIBRARY)
          .put("swift_library", ProductType.STATIC_LIBRARY)
          .put("tvos_application", ProductType.APPLICATION)
          .put("tvos_extension", ProductType.TV_APP_EXTENSION)
          .put("watchos_application", ProductType.WATCH2_APPLICATION)
          .put("watchos_extension", ProductType.WATCH2_EXTENSION)
          // Rules wrapped by macros carry an underscore prefix.
          .put("_ios_application", ProductType.APPLICATION)
          .put("_ios_extension", ProductType.APP_EXTENSION)
          .put("_tvos_application", ProductType.APPLICATION)
          .put("_tvos_extension", ProductType.TV_APP_EXTENSION)
          .put(TEST_HOST_PLACEHOLDER, ProductType.APPLICATION)
          .build();

  private RuleTypes() {}

  public static Optional<ProductType> getProductType(String ruleType) {
    return Optional.ofNullable(PRODUCT_TYPES.get(ruleType));
  }

  public static boolean isTvosApplication(String ruleType) {
    return TVOS_APPLICATION.equals(ruleType) || PRIVATE_TVOS_APPLICATION.equals(ruleType);
  }
}
