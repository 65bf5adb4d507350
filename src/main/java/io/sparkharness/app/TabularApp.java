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

import static java.util.Objects.requireNonNull;

import io.sparkharness.context.ComputeContext;
import io.sparkharness.data.CsvAttributes;
import io.sparkharness.data.DatasetFactory;
import io.sparkharness.fs.FileSystemProvider;
import io.sparkharness.fs.HadoopFileSystemProvider;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application handle for one test class. It is created by {@link #init(String[], ComputeContext)}
 * with an externally owned compute context and lives no longer than that context.
 */
public class TabularApp {

  private static final Logger LOG = LoggerFactory.getLogger(TabularApp.class);

  private final AppArgs args;
  private final ComputeContext context;
  private final DatasetFactory datasets;

  TabularApp(AppArgs args, ComputeContext context, FileSystemProvider fs) {
    this.args = args;
    this.context = context;
    this.datasets = new DatasetFactory(context.session(), fs);
  }

  public static TabularApp init(String[] args, ComputeContext context) {
    return init(args, context, new HadoopFileSystemProvider());
  }

  public static TabularApp init(String[] args, ComputeContext context, FileSystemProvider fs) {
    requireNonNull(context, "context");
    AppArgs parsed = AppArgs.parse(args);
    LOG.info(
        "Initializing app on '{}' with modules {} and data dir {}",
        context.name(),
        parsed.modules(),
        parsed.dataDir());
    return new TabularApp(parsed, context, fs);
  }

  public AppArgs args() {
    return args;
  }

  public ComputeContext context() {
    return context;
  }

  /** Dataset with the given compact schema and {@code ;}/{@code ,} separated literal data. */
  public Dataset<Row> createDataset(String schema, String data) {
    return datasets.createDataset(schema, data);
  }

  /** Reads a CSV file that has a sibling {@code .schema} file. */
  public Dataset<Row> open(String path, CsvAttributes attributes) {
    return datasets.loadCsv(path, attributes);
  }

  public Dataset<Row> open(String path) {
    return open(path, CsvAttributes.defaultCsv());
  }

  public DatasetFactory datasets() {
    return datasets;
  }
}
