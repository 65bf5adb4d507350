/*
 * Copyright (2025) The Delta Lake Project Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.sparkharness.app;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/** Parsed application arguments. */
public final class AppArgs {

  /** Module name meaning "run nothing". */
  public static final String NO_MODULE = "None";

  private final List<String> modules;
  private final String dataDir;
  private final String inputDir;
  private final String outputDir;

  private AppArgs(List<String> modules, String dataDir, String inputDir, String outputDir) {
    this.modules = Collections.unmodifiableList(modules);
    this.dataDir = dataDir;
    this.inputDir = inputDir;
    this.outputDir = outputDir;
  }

  static Options options() {
    return new Options()
        .addOption(
            Option.builder("m")
                .longOpt("run-module")
                .hasArgs()
                .desc("Modules to run; \"" + NO_MODULE + "\" runs nothing")
                .build())
        .addOption(
            Option.builder()
                .longOpt("data-dir")
                .hasArg()
                .required()
                .desc("Top level data directory")
                .build())
        .addOption(
            Option.builder()
                .longOpt("input-dir")
                .hasArg()
                .desc("Input directory (default <data-dir>/input)")
                .build())
        .addOption(
            Option.builder()
                .longOpt("output-dir")
                .hasArg()
                .desc("Output directory (default <data-dir>/output)")
                .build());
  }

  /**
   * Parses {@code args}.
   *
   * @throws IllegalArgumentException if the arguments are invalid
   */
  public static AppArgs parse(String[] args) {
    CommandLineParser parser = new DefaultParser();
    CommandLine cli;
    try {
      cli = parser.parse(options(), args);
    } catch (ParseException e) {
      throw new IllegalArgumentException(
          "Invalid application arguments " + Arrays.toString(args) + ": " + e.getMessage(), e);
    }
    if (!cli.getArgList().isEmpty()) {
      throw new IllegalArgumentException("Unexpected arguments " + cli.getArgList());
    }

    List<String> modules = new ArrayList<>();
    String[] requested = cli.getOptionValues("m");
    if (requested != null) {
      for (String module : requested) {
        if (!NO_MODULE.equals(module)) {
          modules.add(module);
        }
      }
    }
    String dataDir = stripTrailingSlash(cli.getOptionValue("data-dir"));
    String inputDir =
        Optional.ofNullable(cli.getOptionValue("input-dir")).orElse(dataDir + "/input");
    String outputDir =
        Optional.ofNullable(cli.getOptionValue("output-dir")).orElse(dataDir + "/output");
    return new AppArgs(modules, dataDir, inputDir, outputDir);
  }

  private static String stripTrailingSlash(String dir) {
    return dir.length() > 1 && dir.endsWith("/") ? dir.substring(0, dir.length() - 1) : dir;
  }

  /** Requested modules, without the {@value #NO_MODULE} marker. */
  public List<String> modules() {
    return modules;
  }

  public String dataDir() {
    return dataDir;
  }

  public String inputDir() {
    return inputDir;
  }

  public String outputDir() {
    return outputDir;
  }
}
