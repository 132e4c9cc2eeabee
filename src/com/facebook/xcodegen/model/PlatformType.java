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

import com.facebook.xcodegen.util.HumanReadableException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/** Apple platforms a deployment target can be for. */
public enum PlatformType {
  IOS("ios", "IPHONEOS_DEPLOYMENT_TARGET", "iphoneos", "iphonesimulator"),
  MACOS("macos", "MACOSX_DEPLOYMENT_TARGET", "macosx", "macosx"),
  TVOS("tvos", "TVOS_DEPLOYMENT_TARGET", "appletvos", "appletvsimulator"),
  WATCHOS("watchos", "WATCHOS_DEPLOYMENT_TARGET", "watchos", "watchsimulator"),
  ;

  private final String identifier;
  private final String deploymentTargetBuildSetting;
  private final String deviceSdk;
  private final String simulatorSdk;

  PlatformType(
      String identifier,
      String deploymentTargetBuildSetting,
      String deviceSdk,
      String simulatorSdk) {
    this.identifier = identifier;
    this.deploymentTargetBuildSetting = deploymentTargetBuildSetting;
    this.deviceSdk = deviceSdk;
    this.simulatorSdk = simulatorSdk;
  }

  @JsonCreator
  public static PlatformType fromIdentifier(String identifier) {
    for (PlatformType platform : values()) {
      if (platform.identifier.equals(identifier)) {
        return platform;
      }
    }
    throw new HumanReadableException("Unknown platform type '%s'", identifier);
  }

  @JsonValue
  public String getIdentifier() {
    return identifier;
  }

  /** The Xcode build setting holding the minimum OS version for this platform. */
  public String getDeploymentTargetBuildSetting() {
    return deploymentTargetBuildSetting;
  }

  public String getDeviceSdk() {
    return deviceSdk;
  }

  public String getSimulatorSdk() {
    return simulatorSdk;
  }

  /**
   * The {@code TEST_HOST} value for a test bundle hosted by the given product. watchOS does not
   * support hosted tests.
   */
  public Optional<String> getTestHostPath(String hostTargetPath, String hostTargetProductName) {
    switch (this) {
      case IOS:
      case TVOS:
        return Optional.of(
            String.format("$(BUILT_PRODUCTS_DIR)/%s/%s", hostTargetPath, hostTargetProductName));
      case MACOS:
        return Optional.of(
            String.format(
                "$(BUILT_PRODUCTS_DIR)/%s/Contents/MacOS/%s",
                hostTargetPath, hostTargetProductName));
      case WATCHOS:
        return Optional.empty();
    }
    throw new IllegalStateException("Unhandled platform " + this);
  }

  @Override
  public String toString() {
    return identifier;
  }
}
