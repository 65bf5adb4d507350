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

import static org.junit.jupiter.api.Assertions.*;

import io.sparkharness.fs.HadoopFileSystemProvider;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ScratchSpaceTest {

  private static final String IDENTITY = "com.example.Outer$InnerTest";

  @TempDir File dataDir;

  private ScratchSpace scratch;

  @BeforeEach
  public void setUp() {
    scratch = new ScratchSpace(dataDir.getPath(), new HadoopFileSystemProvider());
  }

  @Test
  public void directoryNameIsDeterministicAndSanitized() {
    String dir = scratch.temporaryDirectoryFor(IDENTITY);

    assertEquals(dataDir.getPath() + "/com.example.OuterInnerTest", dir);
    assertEquals(dir, scratch.temporaryDirectoryFor(IDENTITY));
  }

  @Test
  public void dataDirWithTrailingSlashIsNotDoubled() {
    ScratchSpace withSlash =
        new ScratchSpace(dataDir.getPath() + "/", new HadoopFileSystemProvider());

    assertEquals(
        scratch.temporaryDirectoryFor(IDENTITY), withSlash.temporaryDirectoryFor(IDENTITY));
  }

  @Test
  public void resetTwiceOnPopulatedDirectoryLeavesItEmpty() {
    scratch.reset(IDENTITY);
    scratch.createFile(IDENTITY, "a.csv", "1,2");
    File dir = new File(scratch.temporaryDirectoryFor(IDENTITY));

    scratch.reset(IDENTITY);
    assertTrue(dir.isDirectory());
    assertEquals(0, dir.list().length);

    scratch.reset(IDENTITY);
    assertTrue(dir.isDirectory());
    assertEquals(0, dir.list().length);
  }

  @Test
  public void createFileUsesDefaultContents() throws Exception {
    scratch.reset(IDENTITY);

    File file = scratch.createFile(IDENTITY, "default.txt");

    assertEquals("xxx", read(file));
  }

  @Test
  public void createFileOverwritesWithExactContents() throws Exception {
    scratch.reset(IDENTITY);
    scratch.createFile(IDENTITY, "f.txt", "a much longer first version\n");

    File file = scratch.createFile(IDENTITY, "f.txt", "short");

    assertEquals(new File(scratch.temporaryDirectoryFor(IDENTITY), "f.txt"), file);
    assertEquals("short", read(file));
  }

  @Test
  public void createFileRequiresReset() {
    IllegalStateException e =
        assertThrows(
            IllegalStateException.class, () -> scratch.createFile("never.Reset", "f.txt", "x"));
    assertTrue(e.getMessage().contains("reset"));
  }

  private static String read(File file) throws Exception {
    return new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
  }
}
