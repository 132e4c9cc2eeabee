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

import com.facebook.xcodegen.log.LocalizedMessageLogger;
import com.facebook.xcodegen.model.RuleEntry;
import com.facebook.xcodegen.model.RuleEntryMap;
import com.facebook.xcodegen.model.RuleEntryParser;
import java.io.IOException;
import java.nio.file.Path;

/** Reads rule entries from a JSON file written by the extraction aspect. */
public class JsonWorkspaceInfoExtractor implements WorkspaceInfoExtractor {

  private final Path ruleEntriesFile;
  private final LocalizedMessageLogger localizedMessageLogger;

  public JsonWorkspaceInfoExtractor(
      Path ruleEntriesFile, LocalizedMessageLogger localizedMessageLogger) {
    this.ruleEntriesFile = ruleEntriesFile;
    this.localizedMessageLogger = localizedMessageLogger;
  }

  @Override
  public RuleEntryMap extractRuleEntries() throws IOException {
    RuleEntryMap ruleEntryMap = new RuleEntryMap(localizedMessageLogger);
    for (RuleEntry entry : new RuleEntryParser().parse(ruleEntriesFile)) {
      ruleEntryMap.insert(entry);
    }
    return ruleEntryMap;
  }
}
