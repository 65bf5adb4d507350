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
package io.sparkharness.junit;

import io.sparkharness.app.TabularApp;
import io.sparkharness.data.CsvAttributes;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;

/**
 * {@link SparkTestSupport} that also initializes a {@link TabularApp} on the class' session.
 *
 * <pre>
 * public class MyModuleTest extends AppTestSupport {
 *   {@literal @}Override
 *   protected String[] appArgs() {
 *     return new String[] {"-m", "MyModule", "--data-dir", testcaseTempDir()};
 *   }
 * }
 * </pre>
 */
public abstract class AppTestSupport extends SparkTestSupport {

  protected TabularApp app;

  /** Arguments the app is initialized with. */
  protected String[] appArgs() {
    return new String[] {"-m", "None", "--data-dir", testcaseTempDir()};
  }

  @BeforeAll
  public void initApp() {
    app = TabularApp.init(appArgs(), computeContext(), fileSystem());
  }

  @AfterAll
  public void releaseApp() {
    app = null;
  }

  /** Reads {@code path}, relative to the working directory, as CSV with its schema file. */
  protected Dataset<Row> open(String path) {
    return app.open("./" + path, CsvAttributes.defaultCsv());
  }

  protected Dataset<Row> createDataset(String schema, String data) {
    return app.createDataset(schema, data);
  }
}
