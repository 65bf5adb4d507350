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
package io.sparkharness.scratch;

import static java.util.Objects.requireNonNull;

import io.sparkharness.fs.FileSystemProvider;
import java.io.File;

/**
 * Per-test-class scratch directories under a common data directory.
 *
 * <p>Directories are keyed by the test class name and are never removed automatically; {@link
 * #reset(String)} wipes and recreates one on request.
 */
public class ScratchSpace {

  public static final String DEFAULT_FILE_CONTENTS = "xxx";

  /** Marker the JVM puts in nested and synthetic class names. */
  private static final String RESERVED_MARKER = "$";

  private final String dataDir;
  private final FileSystemProvider fs;

  public ScratchSpace(String dataDir, FileSystemProvider fs) {
    requireNonNull(dataDir, "dataDir");
    this.dataDir = dataDir.endsWith("/") ? dataDir : dataDir + "/";
    this.fs = requireNonNull(fs, "fs");
  }

  /** Name of the scratch directory for {@code identity}; a pure function of its argument. */
  public String temporaryDirectoryFor(String identity) {
    return dataDir + identity.replace(RESERVED_MARKER, "");
  }

  /** Wipe out the scratch directory of {@code identity} and recreate it empty. */
  public void reset(String identity) {
    String dir = temporaryDirectoryFor(identity);
    fs.deleteRecursively(dir);
    fs.mkdirs(dir);
  }

  public File createFile(String identity, String baseName) {
    return createFile(identity, baseName, DEFAULT_FILE_CONTENTS);
  }

  /**
   * Creates (or overwrites) {@code baseName} in the scratch directory of {@code identity} with
   * exactly {@code contents}.
   *
   * @throws IllegalStateException if the scratch directory does not exist yet
   */
  public File createFile(String identity, String baseName, String contents) {
    String dir = temporaryDirectoryFor(identity);
    if (!fs.exists(dir)) {
      throw new IllegalStateException(
          "Scratch directory " + dir + " does not exist; call reset(\"" + identity + "\") first");
    }
    File file = new File(dir, baseName);
    fs.writeText(file.getPath(), contents);
    return file;
  }
}
