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

package com.facebook.xcodegen.apple.xcode;

import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXObject;
import java.util.HashMap;
import java.util.Map;

/**
 * Generates the 24 hex digit global IDs of project objects. An ID is the object's type hash and
 * stable hash followed by a counter, so equal objects still get distinct IDs and the same project
 * always gets the same IDs.
 */
public class GidGenerator {

  private final Map<String, Integer> nextCounterByPrefix = new HashMap<>();

  public String generateGid(PBXObject object) {
    String prefix = String.format("%08X%08X", object.isa().hashCode(), object.stableHash());
    int counter = nextCounterByPrefix.getOrDefault(prefix, 0);
    nextCounterByPrefix.put(prefix, counter + 1);
    return prefix + String.format("%08X", counter);
  }
}
