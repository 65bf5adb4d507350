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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FSDataInputStream;
import org.apache.hadoop.fs.FSDataOutputStream;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.IOUtils;

/**
 * {@link FileSystemProvider} over Hadoop's raw local filesystem. The raw variant is used so that
 * writes do not leave {@code .crc} side files next to fixtures.
 */
public class HadoopFileSystemProvider implements FileSystemProvider {

  private final FileSystem fs;

  public HadoopFileSystemProvider() {
    this(new Configuration());
  }

  public HadoopFileSystemProvider(Configuration hadoopConf) {
    try {
      this.fs = FileSystem.getLocal(hadoopConf).getRawFileSystem();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to open the local filesystem", e);
    }
  }

  @Override
  public boolean exists(String path) {
    try {
      return fs.exists(new Path(path));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to check " + path, e);
    }
  }

  @Override
  public boolean deleteRecursively(String path) {
    try {
      Path p = new Path(path);
      return fs.exists(p) && fs.delete(p, true);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to delete " + path, e);
    }
  }

  @Override
  public void mkdirs(String path) {
    try {
      if (!fs.mkdirs(new Path(path))) {
        throw new IOException("mkdirs returned false");
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create directory " + path, e);
    }
  }

  @Override
  public void writeText(String path, String contents) {
    try (FSDataOutputStream out = fs.create(new Path(path), true)) {
      out.write(contents.getBytes(UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write " + path, e);
    }
  }

  @Override
  public String readText(String path) {
    try (FSDataInputStream in = fs.open(new Path(path));
        ByteArrayOutputStream buffer = new ByteArrayOutputStream()) {
      IOUtils.copyBytes(in, buffer, 4096, false);
      return new String(buffer.toByteArray(), UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + path, e);
    }
  }

  @Override
  public List<String> list(String dir) {
    try {
      FileStatus[] statuses = fs.listStatus(new Path(dir));
      return Arrays.stream(statuses)
          .map(status -> status.getPath().getName())
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list " + dir, e);
    }
  }
}
