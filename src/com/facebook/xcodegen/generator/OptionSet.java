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

package com.facebook.xcodegen.generator;

import com.facebook.xcodegen.log.Logger;
import com.facebook.xcodegen.util.HumanReadableException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Values of {@link OptionKey}s for one project.
 *
 * <p>Each option has a project wide value and, if it is target specializable, values for
 * individual targets keyed by target label. In JSON an option set looks like
 *
 * <pre>
 *   {"BazelBuildOptionsDebug": {"p": "--copt=-g", "t": {"//app:App": "--copt=-O0"}}}
 * </pre>
 */
public class OptionSet {

  private static final Logger LOG = Logger.get(OptionSet.class);

  private static final String PROJECT_VALUE_KEY = "p";
  private static final String TARGET_VALUES_KEY = "t";

  private static final String YES = "YES";

  /** Warning settings every generated project starts from. */
  private static final ImmutableSortedMap<String, String> DEFAULT_BUILD_SETTINGS =
      ImmutableSortedMap.<String, String>naturalOrder()
          .put("CLANG_WARN_BOOL_CONVERSION", YES)
          .put("CLANG_WARN_CONSTANT_CONVERSION", YES)
          .put("CLANG_WARN_EMPTY_BODY", YES)
          .put("CLANG_WARN_ENUM_CONVERSION", YES)
          .put("CLANG_WARN_INT_CONVERSION", YES)
          .put("CLANG_WARN_UNREACHABLE_CODE", YES)
          .put("CLANG_WARN__DUPLICATE_METHOD_MATCH", YES)
          .put("GCC_WARN_64_TO_32_BIT_CONVERSION", YES)
          .put("GCC_WARN_ABOUT_RETURN_TYPE", YES)
          .put("GCC_WARN_UNDECLARED_SELECTOR", YES)
          .put("GCC_WARN_UNINITIALIZED_AUTOS", YES)
          .put("GCC_WARN_UNUSED_FUNCTION", YES)
          .put("GCC_WARN_UNUSED_VARIABLE", YES)
          .build();

  private final Map<OptionKey, String> projectValues = new EnumMap<>(OptionKey.class);
  private final Map<OptionKey, Map<String, String>> targetValues = new EnumMap<>(OptionKey.class);

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static OptionSet fromJson(JsonNode node) {
    OptionSet optionSet = new OptionSet();
    if (node == null || node.isNull()) {
      return optionSet;
    }
    if (!node.isObject()) {
      throw new HumanReadableException("Expected an object of options but got %s", node);
    }
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      Optional<OptionKey> key = OptionKey.fromName(field.getKey());
      if (!key.isPresent()) {
        LOG.warn("Ignoring unknown option %s", field.getKey());
        continue;
      }
      JsonNode value = field.getValue();
      JsonNode projectValue = value.get(PROJECT_VALUE_KEY);
      if (projectValue != null && !projectValue.isNull()) {
        optionSet.setProjectValue(key.get(), projectValue.asText());
      }
      JsonNode targets = value.get(TARGET_VALUES_KEY);
      if (targets != null && targets.isObject()) {
        Iterator<Map.Entry<String, JsonNode>> targetFields = targets.fields();
        while (targetFields.hasNext()) {
          Map.Entry<String, JsonNode> targetField = targetFields.next();
          optionSet.setTargetValue(
              key.get(), targetField.getKey(), targetField.getValue().asText());
        }
      }
    }
    return optionSet;
  }

  public OptionSet setProjectValue(OptionKey key, String value) {
    projectValues.put(key, Preconditions.checkNotNull(value));
    return this;
  }

  public OptionSet setTargetValue(OptionKey key, String target, String value) {
    Preconditions.checkArgument(
        key.isTargetSpecializable(), "Option %s can not be set per target", key.getName());
    targetValues.computeIfAbsent(key, k -> new HashMap<>()).put(target, value);
    return this;
  }

  /** The project wide value of {@code key}, falling back to its default. */
  public Optional<String> get(OptionKey key) {
    String value = projectValues.get(key);
    if (value != null) {
      return Optional.of(value);
    }
    return key.getDefaultValue();
  }

  /** The value of {@code key} for {@code target}, falling back to the project wide value. */
  public Optional<String> get(OptionKey key, @Nullable String target) {
    if (target != null) {
      Map<String, String> values = targetValues.get(key);
      if (values != null && values.containsKey(target)) {
        return Optional.of(values.get(target));
      }
    }
    return get(key);
  }

  /** The project wide value of {@code key} split on spaces, empty if it has none. */
  public ImmutableList<String> getArguments(OptionKey key) {
    return get(key)
        .map(value -> ImmutableList.copyOf(Splitter.on(' ').omitEmptyStrings().split(value)))
        .orElse(ImmutableList.of());
  }

  public boolean isEnabled(OptionKey key) {
    Preconditions.checkArgument(key.getKind() == OptionKey.Kind.BOOLEAN);
    return get(key).map(YES::equals).orElse(false);
  }

  /** Build settings shared by every target of the project. */
  public ImmutableSortedMap<String, String> commonBuildSettings() {
    ImmutableSortedMap.Builder<String, String> settings = ImmutableSortedMap.naturalOrder();
    Map<String, String> merged = new HashMap<>(DEFAULT_BUILD_SETTINGS);
    for (OptionKey key : OptionKey.values()) {
      if (key.getKind() != OptionKey.Kind.BUILD_SETTING) {
        continue;
      }
      get(key).ifPresent(value -> merged.put(key.getName(), value));
    }
    return settings.putAll(merged).build();
  }

  /** Build settings that {@code target} overrides with values of its own. */
  public ImmutableSortedMap<String, String> buildSettingsForTarget(String target) {
    ImmutableSortedMap.Builder<String, String> settings = ImmutableSortedMap.naturalOrder();
    for (OptionKey key : OptionKey.values()) {
      if (key.getKind() != OptionKey.Kind.BUILD_SETTING) {
        continue;
      }
      Map<String, String> values = targetValues.get(key);
      if (values != null && values.containsKey(target)) {
        settings.put(key.getName(), values.get(target));
      }
    }
    return settings.build();
  }
}
