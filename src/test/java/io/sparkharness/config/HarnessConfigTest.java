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
package io.sparkharness.config;

import static org.junit.jupiter.api.Assertions.*;

import java.net.URL;
import java.net.URLClassLoader;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;

public class HarnessConfigTest {

  @Test
  public void readsClasspathResource() {
    HarnessConfig config = HarnessConfig.load(getClass().getClassLoader(), new Properties());

    assertEquals("target/test-classes/data/", config.dataDir());
    assertFalse(config.disableLogging());
  }

  @Test
  public void systemPropertiesOverrideHarnessKeysOnly() {
    Properties system = new Properties();
    system.setProperty(HarnessConfig.DISABLE_LOGGING, "true");
    system.setProperty(HarnessConfig.DATA_DIR, " /tmp/harness ");
    system.setProperty("spark.sql.session.timeZone", "Asia/Tokyo");

    HarnessConfig config = HarnessConfig.load(getClass().getClassLoader(), system);

    assertTrue(config.disableLogging());
    assertEquals("/tmp/harness", config.dataDir());
    assertEquals("UTC", config.sparkConf().get("spark.sql.session.timeZone"));
  }

  @Test
  public void sparkConfExcludesHarnessKeys() {
    Map<String, String> conf =
        HarnessConfig.load(getClass().getClassLoader(), new Properties()).sparkConf();

    assertEquals("localhost", conf.get("spark.driver.host"));
    assertFalse(conf.keySet().stream().anyMatch(k -> k.startsWith(HarnessConfig.PREFIX)));
    assertThrows(UnsupportedOperationException.class, () -> conf.put("spark.x", "y"));
  }

  @Test
  public void defaultsWithoutResource() throws Exception {
    try (URLClassLoader empty = new URLClassLoader(new URL[0], null)) {
      HarnessConfig config = HarnessConfig.load(empty, new Properties());

      assertEquals(HarnessConfig.DEFAULT_DATA_DIR, config.dataDir());
      assertFalse(config.disableLogging());
      assertTrue(config.sparkConf().isEmpty());
    }
  }

  @Test
  public void blankDataDirFallsBackToDefault() {
    Properties props = new Properties();
    props.setProperty(HarnessConfig.DATA_DIR, "");

    assertEquals(HarnessConfig.DEFAULT_DATA_DIR, new HarnessConfig(props).dataDir());
  }
}
