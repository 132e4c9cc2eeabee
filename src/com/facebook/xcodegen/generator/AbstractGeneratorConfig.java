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

import com.facebook.xcodegen.model.BuildLabel;
import com.facebook.xcodegen.util.immutables.XcodegenStyleImmutable;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import org.immutables.value.Value;

/** What to generate, read from the JSON configuration file given on the command line. */
@Value.Immutable(copy = true)
@XcodegenStyleImmutable
@JsonDeserialize(as = GeneratorConfig.class)
@JsonIgnoreProperties(ignoreUnknown = true)
abstract class AbstractGeneratorConfig {

  static final String DEFAULT_SCRIPTS_DIRECTORY = "$(PROJECT_FILE_PATH)/.tulsi/Scripts";

  @JsonProperty("projectName")
  public abstract String getProjectName();

  /** Labels of the rules to create build targets for. */
  @JsonProperty("buildTargets")
  public abstract ImmutableList<BuildLabel> getBuildTargetLabels();

  /** Directories whose files get references, see {@link PathFilter}. */
  @JsonProperty("sourceFilters")
  public abstract ImmutableSet<String> getPathFilters();

  /** Workspace files to reference even though no rule uses them, such as BUILD files. */
  @JsonProperty("additionalFilePaths")
  public abstract ImmutableList<String> getAdditionalFilePaths();

  @Value.Default
  @JsonProperty("bazelPath")
  public String getBazelPath() {
    return "bazel";
  }

  /** The output symlink of the workspace, relative to the workspace root. */
  @Value.Default
  @JsonProperty("bazelBinPath")
  public String getBazelBinPath() {
    return "bazel-bin";
  }

  @JsonProperty("workspaceRoot")
  public abstract Optional<String> getWorkspaceRoot();

  @Value.Default
  @JsonProperty("optionSet")
  public OptionSet getOptions() {
    return new OptionSet();
  }

  /** The script the build phase of every product target runs. */
  @Value.Default
  @JsonProperty("buildScriptPath")
  public String getBuildScriptPath() {
    return DEFAULT_SCRIPTS_DIRECTORY + "/bazel_build.py";
  }

  @Value.Default
  @JsonProperty("cleanScriptPath")
  public String getCleanScriptPath() {
    return DEFAULT_SCRIPTS_DIRECTORY + "/bazel_clean.sh";
  }
}
