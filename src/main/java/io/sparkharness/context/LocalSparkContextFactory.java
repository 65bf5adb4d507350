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
package io.sparkharness.context;

import static com.google.common.base.Preconditions.checkArgument;

import io.sparkharness.config.HarnessConfig;
import java.util.Map;
import org.apache.spark.SparkConf;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds a {@code local[n]} Spark session per call. */
public class LocalSparkContextFactory implements ComputeContextFactory {

  private static final Logger LOG = LoggerFactory.getLogger(LocalSparkContextFactory.class);

  private final Map<String, String> extraConf;

  public LocalSparkContextFactory(HarnessConfig config) {
    this.extraConf = config.sparkConf();
  }

  @Override
  public ComputeContext create(String name, int parallelism) {
    checkArgument(parallelism > 0, "parallelism must be positive: %s", parallelism);
    if (SparkSession.getDefaultSession().isDefined()) {
      throw new LifecycleMisuseException(
          "A Spark session is still active; stop it before creating '" + name + "'");
    }
    SparkConf conf =
        new SparkConf()
            .setMaster("local[" + parallelism + "]")
            .setAppName(name)
            .set("spark.ui.enabled", "false")
            .set("spark.sql.shuffle.partitions", String.valueOf(parallelism));
    extraConf.forEach(conf::set);

    LOG.debug("Creating local Spark session '{}' with {} workers", name, parallelism);
    SparkSession session = SparkSession.builder().config(conf).getOrCreate();
    return new SparkComputeContext(name, parallelism, session);
  }
}
