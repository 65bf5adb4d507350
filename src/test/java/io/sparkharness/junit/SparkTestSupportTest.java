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

import static io.sparkharness.assertions.EquivalenceAssertions.assertDatasetEqual;
import static org.junit.jupiter.api.Assertions.*;

import io.sparkharness.context.ContextState;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.junit.jupiter.api.Test;

public class SparkTestSupportTest extends SparkTestSupport {

  @Test
  public void sessionIsLocalWithTwoWorkers() {
    assertEquals("local[2]", sc.master());
    assertEquals(2, computeContext().parallelism());
    assertEquals(ContextState.ACTIVE, computeContext().state());
    assertSame(spark, computeContext().session());
  }

  @Test
  public void appNameIsTheTestClass() {
    assertEquals("io.sparkharness.junit.SparkTestSupportTest", name());
    assertEquals(name(), sc.appName());
  }

  @Test
  public void sessionRunsQueries() {
    assertDatasetEqual(spark.range(3).toDF("id"), "0; 1; 2");
  }

  @Test
  public void loggingIsForcedToErrorByDefault() {
    assertFalse(disableLogging());
    assertEquals(Level.ERROR, LogManager.getRootLogger().getLevel());
  }

  @Test
  public void scratchDirectoryLivesBelowTestDataDir() throws Exception {
    assertEquals("target/test-classes/data/", testDataDir());
    assertEquals(
        "target/test-classes/data/io.sparkharness.junit.SparkTestSupportTest", testcaseTempDir());

    resetTestcaseTempDir();
    File file = createTempFile("input.csv", "1,a\n");
    File defaulted = createTempFile("marker");

    assertEquals(new File(testcaseTempDir(), "input.csv"), file);
    assertEquals("1,a\n", new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8));
    assertEquals("xxx", new String(Files.readAllBytes(defaulted.toPath()), StandardCharsets.UTF_8));

    resetTestcaseTempDir();
    assertFalse(file.exists());
  }
}
