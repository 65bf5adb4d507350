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
package io.sparkharness.fs;

import java.util.List;

/**
 * The filesystem operations the harness needs for scratch directories and fixture files. All
 * methods report I/O failures as {@link java.io.UncheckedIOException}.
 */
public interface FileSystemProvider {

  boolean exists(String path);

  /** Deletes {@code path} and everything under it. Returns false if nothing was there. */
  boolean deleteRecursively(String path);

  void mkdirs(String path);

  /** Creates or overwrites {@code path} so that its full content is {@code contents} (UTF-8). */
  void writeText(String path, String contents);

  String readText(String path);

  /** Names (not paths) of the direct children of {@code dir}, sorted. */
  List<String> list(String dir);
}
