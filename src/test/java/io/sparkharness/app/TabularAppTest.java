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

import static org.junit.jupiter.api.Assertions.*;

import io.sparkharness.config.HarnessConfig;
import io.sparkharness.context.ComputeContextLifecycle;
import io.sparkharness.context.LocalSparkContextFactory;
import io.sparkharness.logging.Log4jLoggingContext;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

public class TabularAppTest {

  @Test
  public void initParsesArgumentsAgainstAGivenContext() throws Exception {
    ComputeContextLifecycle lifecycle =
        new ComputeContextLifecycle(
            new Log4jLoggingContext(), new LocalSparkContextFactory(HarnessConfig.load()));

    lifecycle.runScoped(
        "io.sparkharness.app.TabularAppTest",
        false,
        context -> {
          TabularApp app =
              TabularApp.init(
                  new String[] {"-m", "etl.Load", "etl.Score", "--data-dir", "/srv/data/"},
                  context);

          assertEquals(Arrays.asList("etl.Load", "etl.Score"), app.args().modules());
          assertEquals("/srv/data/output", app.args().outputDir());
          assertEquals(2, app.createDataset("x:Integer", "1;2").count());
          assertThrows(
              IllegalArgumentException.class,
              () -> TabularApp.init(new String[] {"-m", "x"}, context));
        });
  }
}
