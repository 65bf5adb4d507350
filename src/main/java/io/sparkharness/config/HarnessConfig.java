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

import com.google.common.base.Strings;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Harness settings. Loaded from {@value #RESOURCE_NAME} on the classpath when present, then
 * overridden by JVM system properties that start with {@value #PREFIX}.
 *
 * <p>Any other {@code spark.*} key in the resource is forwarded to the {@code SparkConf} of every
 * compute context the harness creates.
 */
public final class HarnessConfig {

  private static final Logger LOG = LoggerFactory.getLogger(HarnessConfig.class);

  public static final String RESOURCE_NAME = "spark-harness.properties";
  public static final String PREFIX = "spark.harness.";

  public static final String DATA_DIR = PREFIX + "dataDir";
  public static final String DISABLE_LOGGING = PREFIX + "disableLogging";

  /** Top of the data dir used by tests; per test class directories live below it. */
  public static final String DEFAULT_DATA_DIR = "target/test-classes/data/";

  private final Properties props;

  public HarnessConfig(Properties props) {
    this.props = props;
  }

  public static HarnessConfig load() {
    return load(HarnessConfig.class.getClassLoader(), System.getProperties());
  }

  static HarnessConfig load(ClassLoader loader, Properties systemProps) {
    Properties props = new Properties();
    try (InputStream in = loader.getResourceAsStream(RESOURCE_NAME)) {
      if (in != null) {
        props.load(in);
        LOG.debug("Loaded {} from the classpath", RESOURCE_NAME);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
    }
    for (String key : systemProps.stringPropertyNames()) {
      if (key.startsWith(PREFIX)) {
        props.setProperty(key, systemProps.getProperty(key));
      }
    }
    return new HarnessConfig(props);
  }

  public String dataDir() {
    String dir = props.getProperty(DATA_DIR);
    return Strings.isNullOrEmpty(dir) ? DEFAULT_DATA_DIR : dir.trim();
  }

  public boolean disableLogging() {
    return Boolean.parseBoolean(props.getProperty(DISABLE_LOGGING, "false").trim());
  }

  /** {@code spark.*} entries other than the harness' own keys. */
  public Map<String, String> sparkConf() {
    Map<String, String> conf = new TreeMap<>();
    for (String key : props.stringPropertyNames()) {
      if (key.startsWith("spark.") && !key.startsWith(PREFIX)) {
        conf.put(key, props.getProperty(key).trim());
      }
    }
    return Collections.unmodifiableMap(conf);
  }
}
