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

package com.facebook.xcodegen.cli;

import com.facebook.xcodegen.generator.GeneratorConfig;
import com.facebook.xcodegen.generator.JsonWorkspaceInfoExtractor;
import com.facebook.xcodegen.generator.OptionKey;
import com.facebook.xcodegen.generator.ProjectGenerationException;
import com.facebook.xcodegen.generator.ProjectGenerator;
import com.facebook.xcodegen.generator.WorkspacePathInfoFetcher;
import com.facebook.xcodegen.log.LocalizedMessageLogger;
import com.facebook.xcodegen.log.LogConfig;
import com.facebook.xcodegen.log.Logger;
import com.facebook.xcodegen.util.HumanReadableException;
import com.facebook.xcodegen.util.json.ObjectMappers;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.logging.Level;
import javax.annotation.Nullable;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/**
 * Command line entry point.
 *
 * <p>Expected usage: {@code bazel-xcodegen --config project.json --rule-entries entries.json}.
 */
public class Main {

  private static final Logger LOG = Logger.get(Main.class);

  static final int EXIT_SUCCESS = 0;
  static final int EXIT_USAGE = 1;
  static final int EXIT_GENERATION_FAILED = 2;

  @Option(
      name = "--config",
      usage = "JSON file describing the project to generate",
      required = true)
  private String configPath;

  @Option(
      name = "--rule-entries",
      usage = "JSON file with the rule entries written by the extraction aspect",
      required = true)
  private String ruleEntriesPath;

  @Option(name = "--output-folder", usage = "directory the .xcodeproj bundle is written to")
  private String outputFolder = ".";

  @Option(name = "--workspace-root", usage = "overrides the workspace root of the config")
  @Nullable
  private String workspaceRoot;

  @Option(name = "--bazel", usage = "overrides the Bazel binary of the config")
  @Nullable
  private String bazelPath;

  @Option(name = "--fetch-workspace-info", usage = "run bazel info to link the execution root")
  private boolean fetchWorkspaceInfo;

  @Option(name = "--log-properties", usage = "java.util.logging properties overriding defaults")
  @Nullable
  private String logProperties;

  @Option(name = "--verbose", aliases = "-v", usage = "log debug output to the console")
  private boolean verbose;

  public static void main(String[] args) {
    System.exit(new Main().runMain(args));
  }

  int runMain(String[] args) {
    CmdLineParser parser = new CmdLineParser(this);
    try {
      parser.parseArgument(args);
    } catch (CmdLineException e) {
      System.err.println(e.getLocalizedMessage());
      parser.printUsage(System.err);
      return EXIT_USAGE;
    }

    try {
      LogConfig.setupLogging(
          verbose ? Level.FINE : Level.INFO, Optional.ofNullable(logProperties).map(Paths::get));
      return run();
    } catch (HumanReadableException e) {
      System.err.println(e.getHumanReadableErrorMessage());
      return EXIT_GENERATION_FAILED;
    } catch (ProjectGenerationException e) {
      LOG.error(e, "Project generation failed (%s)", e.getKind());
      System.err.println(e.getMessage());
      return EXIT_GENERATION_FAILED;
    } catch (IOException e) {
      LOG.error(e, "I/O error during project generation");
      System.err.println(e.getMessage());
      return EXIT_GENERATION_FAILED;
    }
  }

  private int run() throws IOException, ProjectGenerationException {
    GeneratorConfig config = ObjectMappers.readValue(Paths.get(configPath), GeneratorConfig.class);
    if (bazelPath != null) {
      config = config.withBazelPath(bazelPath);
    }
    Path resolvedWorkspaceRoot =
        Paths.get(
                Optional.ofNullable(workspaceRoot)
                    .orElse(config.getWorkspaceRoot().orElse(".")))
            .toAbsolutePath()
            .normalize();

    LocalizedMessageLogger localizedMessageLogger = new LocalizedMessageLogger();
    Optional<WorkspacePathInfoFetcher> fetcher = Optional.empty();
    if (fetchWorkspaceInfo) {
      ImmutableList<String> startupOptions =
          config.getOptions().getArguments(OptionKey.PROJECT_GENERATION_BAZEL_STARTUP_OPTIONS);
      fetcher =
          Optional.of(
              new WorkspacePathInfoFetcher(
                  config.getBazelPath(), resolvedWorkspaceRoot, startupOptions));
    }

    ProjectGenerator generator =
        new ProjectGenerator(
            config,
            new JsonWorkspaceInfoExtractor(Paths.get(ruleEntriesPath), localizedMessageLogger),
            localizedMessageLogger,
            resolvedWorkspaceRoot,
            Paths.get(outputFolder).toAbsolutePath().normalize(),
            fetcher);
    Path bundle = generator.generate();
    System.out.println(bundle);
    return EXIT_SUCCESS;
  }
}
