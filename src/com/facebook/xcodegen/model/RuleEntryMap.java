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

import com.facebook.xcodegen.log.LocalizedMessageLogger;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.ListMultimap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Stores the {@link RuleEntry}s read from the extractor, keyed by label.
 *
 * <p>One label may map to several entries because Bazel splits configurations: an {@code
 * objc_library} depended on by an application targeting iOS 9 and by a test targeting iOS 10 is
 * reported once for each. Lookups that know the depender pick the entry with the matching
 * deployment target.
 */
public class RuleEntryMap {

  private final ListMultimap<BuildLabel, RuleEntry> labelToEntries = ArrayListMultimap.create();
  private final List<RuleEntry> allEntries = new ArrayList<>();
  private final Set<BuildLabel> labelsWithWarning = new HashSet<>();
  private final LocalizedMessageLogger localizedMessageLogger;

  public RuleEntryMap(LocalizedMessageLogger localizedMessageLogger) {
    this.localizedMessageLogger = localizedMessageLogger;
  }

  /** Creates a map holding the same entries as {@code other} with a fresh warning state. */
  public RuleEntryMap(RuleEntryMap other) {
    this(other.localizedMessageLogger);
    for (RuleEntry entry : other.allEntries) {
      insert(entry);
    }
  }

  public void insert(RuleEntry ruleEntry) {
    allEntries.add(ruleEntry);
    labelToEntries.put(ruleEntry.getLabel(), ruleEntry);
  }

  public ImmutableList<RuleEntry> allRuleEntries() {
    return ImmutableList.copyOf(allEntries);
  }

  public ImmutableList<RuleEntry> allRuleEntries(BuildLabel label) {
    return ImmutableList.copyOf(labelToEntries.get(label));
  }

  public boolean hasEntry(BuildLabel label) {
    return labelToEntries.containsKey(label);
  }

  public int size() {
    return allEntries.size();
  }

  /** Returns the most recently inserted entry for {@code label}, or null if there is none. */
  @Nullable
  public RuleEntry anyEntry(BuildLabel label) {
    List<RuleEntry> entries = labelToEntries.get(label);
    return entries.isEmpty() ? null : Iterables.getLast(entries);
  }

  /** Returns the entry for {@code label} built in the same configuration as {@code depender}. */
  @Nullable
  public RuleEntry entry(BuildLabel label, RuleEntry depender) {
    Optional<DeploymentTarget> deploymentTarget = depender.getDeploymentTarget();
    if (!deploymentTarget.isPresent()) {
      localizedMessageLogger.warning(
          "DependentRuleEntryHasNoDeploymentTarget", depender.getLabel(), label);
      return anyEntry(label);
    }
    return entry(label, deploymentTarget.get());
  }

  /**
   * Returns the entry for {@code label} matching {@code deploymentTarget}. A label with a single
   * entry always resolves to it. When several entries exist and none matches, a warning is logged
   * once per label and the most recent entry is returned.
   */
  @Nullable
  public RuleEntry entry(BuildLabel label, DeploymentTarget deploymentTarget) {
    List<RuleEntry> entries = labelToEntries.get(label);
    if (entries.isEmpty()) {
      return null;
    }
    if (entries.size() == 1) {
      return entries.get(0);
    }
    for (RuleEntry entry : entries) {
      if (entry.getDeploymentTarget().equals(Optional.of(deploymentTarget))) {
        return entry;
      }
    }
    if (labelsWithWarning.add(label)) {
      localizedMessageLogger.warning("AmbiguousRuleEntryReference", label);
    }
    return Iterables.getLast(entries);
  }
}
