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

import io.sparkharness.config.HarnessConfig;
import io.sparkharness.context.ComputeContext;
import io.sparkharness.context.ComputeContextFactory;
import io.sparkharness.context.ComputeContextLifecycle;
import io.sparkharness.context.LocalSparkContextFactory;
import io.sparkharness.fs.FileSystemProvider;
import io.sparkharness.fs.HadoopFileSystemProvider;
import io.sparkharness.logging.Log4jLoggingContext;
import io.sparkharness.logging.LoggingContext;
import io.sparkharness.scratch.ScratchSpace;
import java.io.File;
import org.apache.logging.log4j.Level;
import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.sql.SparkSession;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.TestInstance;

/**
 * Base class for tests that need a local Spark session.
 *
 * <p>A fresh {@code local[2]} session is created before the first test of the class and stopped
 * after the last one, even if tests fail. By default every logger is forced to {@code ERROR}
 * first, because Spark's {@code INFO} output just clutters the test run. Override {@link
 * #disableLogging()} to silence logging completely, or call {@link #setLoggingLevel(Level)} while
 * debugging a single test to get the logs back.
 *
 * <p>Usage:
 *
 * <pre>
 * public class MyTransformTest extends SparkTestSupport {
 *
 *   {@literal @}Test
 *   public void keepsAllRows() {
 *     Dataset&lt;Row&gt; df = spark.range(3).toDF("id");
 *     assertDatasetEqual(df, "0; 1; 2");
 *   }
 * }
 * </pre>
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class SparkTestSupport {

  protected final HarnessConfig config = HarnessConfig.load();

  protected SparkSession spark;
  protected JavaSparkContext sc;

  private ComputeContextLifecycle lifecycle;
  private ScratchSpace scratch;
  private FileSystemProvider fileSystem;

  /** Override to turn logging off entirely for this class. */
  protected boolean disableLogging() {
    return config.disableLogging();
  }

  /** Identity of this test class, used as the Spark app name and the scratch directory name. */
  protected String name() {
    return getClass().getName().replace("$", "");
  }

  protected LoggingContext loggingContext() {
    return new Log4jLoggingContext();
  }

  protected ComputeContextFactory contextFactory() {
    return new LocalSparkContextFactory(config);
  }

  protected FileSystemProvider fileSystem() {
    if (fileSystem == null) {
      fileSystem = new HadoopFileSystemProvider();
    }
    return fileSystem;
  }

  @BeforeAll
  public void startComputeContext() {
    scratch = new ScratchSpace(config.dataDir(), fileSystem());
    lifecycle = new ComputeContextLifecycle(loggingContext(), contextFactory());
    lifecycle.start(name(), disableLogging());
    spark = lifecycle.session();
    sc = lifecycle.context().sparkContext();
  }

  @AfterAll
  public void stopComputeContext() {
    spark = null;
    sc = null;
    if (lifecycle != null) {
      lifecycle.stop();
      lifecycle = null;
    }
  }

  protected ComputeContext computeContext() {
    return lifecycle.context();
  }

  /** Forces every registered logger to {@code level}; the change outlives this test class. */
  protected void setLoggingLevel(Level level) {
    loggingContext().setLevel(level);
  }

  /** Top of the data dir used by tests. For a per class directory use testcaseTempDir(). */
  protected String testDataDir() {
    return config.dataDir();
  }

  /** Name of a scratch directory specific to this test class. */
  protected String testcaseTempDir() {
    return scratch.temporaryDirectoryFor(name());
  }

  /** Wipe out the scratch directory and recreate an empty instance. */
  protected void resetTestcaseTempDir() {
    scratch.reset(name());
  }

  protected File createTempFile(String baseName) {
    return scratch.createFile(name(), baseName);
  }

  /** Create a file in the scratch directory with the given contents. */
  protected File createTempFile(String baseName, String contents) {
    return scratch.createFile(name(), baseName, contents);
  }
}
